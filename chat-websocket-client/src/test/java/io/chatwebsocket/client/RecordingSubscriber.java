package io.chatwebsocket.client;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Flow;
import java.util.concurrent.TimeUnit;

/**
 * Unbounded subscriber collecting every signal.
 */
final class RecordingSubscriber<T> implements Flow.Subscriber<T> {
    final List<T> items = new CopyOnWriteArrayList<>();
    private final CountDownLatch terminated = new CountDownLatch(1);
    private final long delayMillis;
    volatile Throwable error;
    volatile boolean completed;

    RecordingSubscriber() {
        this(0);
    }

    /**
     * @param delayMillis time spent on each item, to let items queue up behind a slow consumer
     */
    RecordingSubscriber(long delayMillis) {
        this.delayMillis = delayMillis;
    }

    static <T> RecordingSubscriber<T> subscribe(Flow.Publisher<T> publisher) {
        RecordingSubscriber<T> subscriber = new RecordingSubscriber<>();
        publisher.subscribe(subscriber);
        return subscriber;
    }

    static <T> RecordingSubscriber<T> subscribeSlowly(Flow.Publisher<T> publisher, long delayMillis) {
        RecordingSubscriber<T> subscriber = new RecordingSubscriber<>(delayMillis);
        publisher.subscribe(subscriber);
        return subscriber;
    }

    @Override
    public void onSubscribe(Flow.Subscription subscription) {
        subscription.request(Long.MAX_VALUE);
    }

    @Override
    public void onNext(T item) {
        if (delayMillis > 0) {
            try {
                Thread.sleep(delayMillis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        items.add(item);
    }

    @Override
    public void onError(Throwable throwable) {
        error = throwable;
        terminated.countDown();
    }

    @Override
    public void onComplete() {
        completed = true;
        terminated.countDown();
    }

    boolean await(long timeout, TimeUnit unit) throws InterruptedException {
        return terminated.await(timeout, unit);
    }
}
