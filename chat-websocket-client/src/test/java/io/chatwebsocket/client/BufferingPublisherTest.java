package io.chatwebsocket.client;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Queue;
import java.util.concurrent.Flow;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BufferingPublisherTest {

    @Test
    void firstSubscriberReceivesBacklogAndTerminalSignal() {
        BufferingPublisher<String> publisher = new BufferingPublisher<>(Runnable::run);
        publisher.submit("a");
        publisher.submit("b");
        publisher.close();

        RecordingSubscriber<String> first = RecordingSubscriber.subscribe(publisher);
        RecordingSubscriber<String> second = RecordingSubscriber.subscribe(publisher);

        assertThat(first.items).containsExactly("a", "b");
        assertThat(first.completed).isTrue();
        assertThat(second.items).isEmpty();
        assertThat(second.completed).isTrue();
    }

    @Test
    void laterSubscribersOnlySeeNewItems() {
        BufferingPublisher<String> publisher = new BufferingPublisher<>(Runnable::run);
        publisher.submit("a");
        RecordingSubscriber<String> first = RecordingSubscriber.subscribe(publisher);
        RecordingSubscriber<String> second = RecordingSubscriber.subscribe(publisher);

        publisher.submit("b");
        IOException failure = new IOException("x");
        publisher.closeExceptionally(failure);

        assertThat(first.items).containsExactly("a", "b");
        assertThat(second.items).containsExactly("b");
        assertThat(second.error).isSameAs(failure);
    }

    @Test
    void failureIsDeliveredAfterQueuedItems() {
        Queue<Runnable> tasks = new ArrayDeque<>();
        BufferingPublisher<String> publisher = new BufferingPublisher<>(tasks::add);
        RecordingSubscriber<String> subscriber = RecordingSubscriber.subscribe(publisher);

        publisher.submit("a");
        publisher.submit("b");
        IOException failure = new IOException("x");
        publisher.closeExceptionally(failure);
        Runnable task;
        while ((task = tasks.poll()) != null) {
            task.run();
        }

        assertThat(subscriber.items).containsExactly("a", "b");
        assertThat(subscriber.error).isSameAs(failure);
        assertThat(subscriber.completed).isFalse();
    }

    @Test
    void submitAfterCloseFails() {
        BufferingPublisher<String> publisher = new BufferingPublisher<>(Runnable::run);
        publisher.close();

        assertThat(publisher.isClosed()).isTrue();
        assertThatThrownBy(() -> publisher.submit("late")).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void closingFromSubscriberDuringReplayDefersTerminalSignal() {
        BufferingPublisher<String> publisher = new BufferingPublisher<>(Runnable::run);
        publisher.submit("a");
        publisher.submit("b");
        RecordingSubscriber<String> recorder = new RecordingSubscriber<>();

        publisher.subscribe(new Flow.Subscriber<>() {
            @Override
            public void onSubscribe(Flow.Subscription subscription) {
                recorder.onSubscribe(subscription);
            }

            @Override
            public void onNext(String item) {
                recorder.onNext(item);
                publisher.close();
            }

            @Override
            public void onError(Throwable throwable) {
                recorder.onError(throwable);
            }

            @Override
            public void onComplete() {
                recorder.onComplete();
            }
        });

        assertThat(recorder.items).containsExactly("a", "b");
        assertThat(recorder.completed).isTrue();
    }
}
