package io.chatwebsocket.client;

import io.chatwebsocket.core.ServerEvent;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Flow;

/**
 * Caller's view of one request sent on a {@link ChatConnection}.
 *
 * <p>A request settles exactly once: successfully when {@code response.completed} arrives, or with a
 * {@link io.chatwebsocket.core.ChatWebSocketException} for every failure path. Each publisher holds its
 * items until its first subscriber arrives, so that subscriber sees the whole request; later subscribers
 * only see what arrives after they subscribe, plus the terminal signal.
 */
public interface RequestHandle {

    /**
     * Every non-error event in arrival order, including the completion event. Completes normally on
     * success and exceptionally with the failure cause otherwise.
     */
    Flow.Publisher<ServerEvent> events();

    /**
     * Emits the failure cause once if the request fails, then completes.
     */
    Flow.Publisher<Throwable> errors();

    /**
     * Emits the completion event once if the request succeeds, then completes.
     */
    Flow.Publisher<ServerEvent.Completed> completions();

    /**
     * Completes when the request succeeds and fails with the cause otherwise.
     */
    CompletableFuture<Void> done();

    boolean isSettled();
}
