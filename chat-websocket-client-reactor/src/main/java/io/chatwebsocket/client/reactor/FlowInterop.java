package io.chatwebsocket.client.reactor;

import org.reactivestreams.FlowAdapters;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Objects;
import java.util.concurrent.Flow;

/**
 * Bridges {@link Flow} publishers into Reactor types via Reactive Streams.
 */
final class FlowInterop {
    private FlowInterop() {}

    static <T> Flux<T> flux(Flow.Publisher<T> publisher) {
        Objects.requireNonNull(publisher, "publisher");
        return Flux.from(FlowAdapters.toPublisher(publisher));
    }

    /**
     * First item of the publisher, or empty if it completes without one.
     */
    static <T> Mono<T> mono(Flow.Publisher<T> publisher) {
        Objects.requireNonNull(publisher, "publisher");
        return Mono.from(FlowAdapters.toPublisher(publisher));
    }
}
