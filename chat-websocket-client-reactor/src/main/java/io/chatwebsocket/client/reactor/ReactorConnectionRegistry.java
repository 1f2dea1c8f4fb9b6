package io.chatwebsocket.client.reactor;

import io.chatwebsocket.client.ChatConnection;
import io.chatwebsocket.client.ConnectionRegistry;
import io.chatwebsocket.client.RequestHandle;
import io.chatwebsocket.core.CancellationToken;
import io.chatwebsocket.core.ServerEvent;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.Map;
import java.util.Objects;

/**
 * Reactor adapter over {@link ConnectionRegistry}.
 *
 * <p>Handshakes block, so connection acquisition is shifted onto a scheduler that tolerates blocking
 * ({@link Schedulers#boundedElastic()} unless one is given).
 */
public final class ReactorConnectionRegistry {

    private final ConnectionRegistry delegate;
    private final Scheduler connectScheduler;

    public ReactorConnectionRegistry(ConnectionRegistry delegate) {
        this(delegate, Schedulers.boundedElastic());
    }

    public ReactorConnectionRegistry(ConnectionRegistry delegate, Scheduler connectScheduler) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.connectScheduler = Objects.requireNonNull(connectScheduler, "connectScheduler");
    }

    public ConnectionRegistry delegate() {
        return delegate;
    }

    public Mono<ChatConnection> getOrCreate(String conversationId, String turnId, String credential) {
        return Mono.fromCallable(() -> delegate.getOrCreate(conversationId, turnId, credential))
                .subscribeOn(connectScheduler);
    }

    /**
     * Sends {@code body} when subscribed and streams the request's events.
     *
     * <p>Cancelling the subscription cancels the request; the connection stays open for the next one.
     * The flux errors with the request's failure cause.
     */
    public static Flux<ServerEvent> stream(ChatConnection connection, Map<String, ?> body) {
        Objects.requireNonNull(connection, "connection");
        Objects.requireNonNull(body, "body");
        return Flux.defer(() -> {
            CancellationToken token = CancellationToken.create();
            RequestHandle handle = connection.send(body, token);
            return events(handle).doOnCancel(token::cancel);
        });
    }

    public static Flux<ServerEvent> events(RequestHandle handle) {
        return FlowInterop.flux(handle.events());
    }

    public static Mono<ServerEvent.Completed> completion(RequestHandle handle) {
        return Mono.fromFuture(handle::done)
                .then(FlowInterop.mono(handle.completions()));
    }

    public static Mono<Void> done(RequestHandle handle) {
        return Mono.fromFuture(handle::done);
    }
}
