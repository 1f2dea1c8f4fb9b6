package io.chatwebsocket.client;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.Flow;
import java.util.concurrent.SubmissionPublisher;

/**
 * Hot publisher that holds items, and the terminal signal, until its first subscriber arrives.
 *
 * <p>The first subscriber sees everything from the start; later subscribers only see what is submitted
 * after they subscribe, plus the terminal signal.
 *
 * <p>Failure is signalled in band: the delegate is always closed normally, which delivers every queued item
 * first, and each subscriber's completion is turned into {@code onError} when the publisher failed.
 * {@link SubmissionPublisher#closeExceptionally} would discard queued items.
 */
final class BufferingPublisher<T> implements Flow.Publisher<T> {

    private final SubmissionPublisher<T> delegate;
    private List<T> backlog = new ArrayList<>();
    private List<T> replay;
    private boolean terminated;
    private volatile Throwable failure;

    BufferingPublisher(Executor executor) {
        this.delegate = new SubmissionPublisher<>(executor, Flow.defaultBufferSize());
    }

    /**
     * @throws IllegalStateException if the publisher is already terminated
     */
    synchronized void submit(T item) {
        Objects.requireNonNull(item, "item");
        if (terminated) {
            throw new IllegalStateException("Publisher is closed");
        }
        if (backlog != null) {
            backlog.add(item);
        } else if (replay != null) {
            replay.add(item);
        } else {
            delegate.submit(item);
        }
    }

    synchronized void close() {
        terminate(null);
    }

    synchronized void closeExceptionally(Throwable error) {
        terminate(Objects.requireNonNull(error, "error"));
    }

    synchronized boolean isClosed() {
        return terminated;
    }

    @Override
    public synchronized void subscribe(Flow.Subscriber<? super T> subscriber) {
        Objects.requireNonNull(subscriber, "subscriber");
        delegate.subscribe(new FailureAwareSubscriber(subscriber));
        if (backlog == null) {
            return;
        }
        // subscriber callbacks may submit or settle while the backlog is replayed
        replay = backlog;
        backlog = null;
        try {
            for (int i = 0; i < replay.size(); i++) {
                delegate.submit(replay.get(i));
            }
        } finally {
            replay = null;
        }
        if (terminated) {
            finish();
        }
    }

    private void terminate(Throwable error) {
        if (terminated) {
            return;
        }
        terminated = true;
        failure = error;
        if (backlog == null && replay == null) {
            finish();
        }
    }

    private void finish() {
        delegate.close();
    }

    private final class FailureAwareSubscriber implements Flow.Subscriber<T> {
        private final Flow.Subscriber<? super T> downstream;

        private FailureAwareSubscriber(Flow.Subscriber<? super T> downstream) {
            this.downstream = downstream;
        }

        @Override
        public void onSubscribe(Flow.Subscription subscription) {
            downstream.onSubscribe(subscription);
        }

        @Override
        public void onNext(T item) {
            downstream.onNext(item);
        }

        @Override
        public void onError(Throwable throwable) {
            downstream.onError(throwable);
        }

        @Override
        public void onComplete() {
            Throwable error = failure;
            if (error == null) {
                downstream.onComplete();
            } else {
                downstream.onError(error);
            }
        }
    }
}
