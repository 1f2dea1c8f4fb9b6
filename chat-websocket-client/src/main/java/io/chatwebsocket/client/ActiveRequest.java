package io.chatwebsocket.client;

import io.chatwebsocket.core.ChatWebSocketException;
import io.chatwebsocket.core.ServerEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.Flow;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Correlates inbound events to one outstanding request.
 *
 * <p>Every {@code handle*} entry point is a no-op once the request has settled, so late frames, late
 * cancellations and repeated closes can arrive in any order.
 */
final class ActiveRequest implements RequestHandle {

    private static final Logger log = LoggerFactory.getLogger(ActiveRequest.class);

    private final BufferingPublisher<ServerEvent> events;
    private final BufferingPublisher<Throwable> errors;
    private final BufferingPublisher<ServerEvent.Completed> completions;
    private final CompletableFuture<Void> done = new CompletableFuture<>();
    private final AtomicBoolean settled = new AtomicBoolean();

    ActiveRequest(Executor executor) {
        Objects.requireNonNull(executor, "executor");
        this.events = new BufferingPublisher<>(executor);
        this.errors = new BufferingPublisher<>(executor);
        this.completions = new BufferingPublisher<>(executor);
    }

    @Override
    public Flow.Publisher<ServerEvent> events() {
        return events;
    }

    @Override
    public Flow.Publisher<Throwable> errors() {
        return errors;
    }

    @Override
    public Flow.Publisher<ServerEvent.Completed> completions() {
        return completions;
    }

    @Override
    public CompletableFuture<Void> done() {
        return done.copy();
    }

    @Override
    public boolean isSettled() {
        return settled.get();
    }

    /**
     * The completion future itself, for internal listeners.
     */
    CompletableFuture<Void> settlement() {
        return done;
    }

    void handleEvent(ServerEvent event) {
        if (settled.get()) {
            return;
        }
        if (event instanceof ServerEvent.Error error) {
            fail(new ChatWebSocketException.ServerError(error.message(), error.code()));
            return;
        }
        emit(event);
        if (event instanceof ServerEvent.Completed completed) {
            complete(completed);
        }
    }

    void handleConnectionClose(int code, String reason) {
        fail(new ChatWebSocketException.ConnectionClosed(code, reason));
    }

    void handleError(Throwable error) {
        fail(error);
    }

    private void emit(ServerEvent event) {
        try {
            events.submit(event);
        } catch (IllegalStateException e) {
            // settled concurrently; the publisher is already closed
            log.debug("Dropping {} event received after settlement", event.type());
        }
    }

    private void complete(ServerEvent.Completed event) {
        if (!settled.compareAndSet(false, true)) {
            return;
        }
        completions.submit(event);
        done.complete(null);
        events.close();
        errors.close();
        completions.close();
    }

    private void fail(Throwable error) {
        if (!settled.compareAndSet(false, true)) {
            return;
        }
        errors.submit(error);
        done.completeExceptionally(error);
        events.closeExceptionally(error);
        errors.close();
        completions.close();
    }
}
