package io.chatwebsocket.client;

import io.chatwebsocket.core.CancellationToken;
import io.chatwebsocket.core.ChatWebSocketException;
import io.chatwebsocket.core.ServerEvent;
import io.chatwebsocket.json.spi.JsonCodecs;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static io.chatwebsocket.client.WebSocketConnectionTest.failure;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DefaultConnectionRegistryTest {

    private FakeTransport transport;
    private DefaultConnectionRegistry registry;

    @BeforeEach
    void setUp() {
        transport = new FakeTransport();
        ChatWebSocketConfig config = ChatWebSocketConfig.builder()
                .baseUrl(URI.create("https://api.example.com/v1"))
                .eventExecutor(Runnable::run)
                .build();
        registry = (DefaultConnectionRegistry) ConnectionRegistry.builder()
                .config(config)
                .transport(transport)
                .jsonCodec(JsonCodecs.discover())
                .build();
    }

    @Test
    void resolvesResponsesEndpoint() {
        registry.getOrCreate("c1", "t1", "tok");

        assertThat(transport.last().request.url()).isEqualTo(URI.create("wss://api.example.com/responses"));
    }

    @Test
    void reusesOpenConnectionForSameTurn() {
        ChatConnection first = registry.getOrCreate("c1", "t1", "tok");
        ChatConnection second = registry.getOrCreate("c1", "t1", "tok");

        assertThat(second).isSameAs(first);
        assertThat(transport.sockets).hasSize(1);
        assertThat(registry.hasActive("c1", "t1")).isTrue();
        assertThat(registry.hasActive("c1", "t2")).isFalse();
    }

    @Test
    void newTurnReplacesConnection() {
        ChatConnection first = registry.getOrCreate("c1", "t1", "tok");
        RequestHandle outstanding = first.send(Map.of(), CancellationToken.none());
        FakeTransport.FakeSocket firstSocket = transport.last();

        ChatConnection second = registry.getOrCreate("c1", "t2", "tok");

        assertThat(second).isNotSameAs(first);
        assertThat(first.isOpen()).isFalse();
        assertThat(firstSocket.closeCode).isEqualTo(1000);
        assertThat(failure(outstanding)).isInstanceOf(ChatWebSocketException.Disposed.class);
        assertThat(transport.sockets).hasSize(2);
        assertThat(registry.hasActive("c1", "t1")).isFalse();
        assertThat(registry.hasActive("c1", "t2")).isTrue();
        assertThat(registry.size()).isEqualTo(1);
    }

    @Test
    void conversationsAreIndependent() {
        ChatConnection a = registry.getOrCreate("c1", "t1", "tok");
        ChatConnection b = registry.getOrCreate("c2", "t1", "tok");

        assertThat(a).isNotSameAs(b);
        assertThat(registry.size()).isEqualTo(2);
    }

    @Test
    void peerCloseDeregistersAndNextCallReconnects() {
        ChatConnection first = registry.getOrCreate("c1", "t1", "tok");

        transport.last().peerClose(1001, "going away");

        assertThat(registry.hasActive("c1", "t1")).isFalse();
        assertThat(registry.size()).isZero();

        ChatConnection second = registry.getOrCreate("c1", "t1", "tok");
        assertThat(second).isNotSameAs(first);
        assertThat(second.isOpen()).isTrue();
    }

    @Test
    void handshakeFailureLeavesNoEntry() {
        transport.failHandshakes(new IOException("403 Forbidden"));

        assertThatThrownBy(() -> registry.getOrCreate("c1", "t1", "tok"))
                .isInstanceOf(ChatWebSocketException.HandshakeFailed.class);
        assertThat(registry.size()).isZero();
        assertThat(registry.hasActive("c1", "t1")).isFalse();
    }

    @Test
    void turnGuardedCloseIgnoresOtherTurns() {
        ChatConnection connection = registry.getOrCreate("c1", "t2", "tok");

        registry.close("c1", "t1");
        assertThat(connection.isOpen()).isTrue();
        assertThat(registry.hasActive("c1", "t2")).isTrue();

        registry.close("c1", "t2");
        assertThat(connection.isOpen()).isFalse();
        assertThat(registry.size()).isZero();
    }

    @Test
    void unconditionalCloseDisposesWhateverTurn() {
        ChatConnection connection = registry.getOrCreate("c1", "t1", "tok");

        registry.close("c1");
        registry.close("missing");

        assertThat(connection.isOpen()).isFalse();
        assertThat(registry.size()).isZero();
    }

    @Test
    void closeAllIsIdempotent() {
        ChatConnection a = registry.getOrCreate("c1", "t1", "tok");
        ChatConnection b = registry.getOrCreate("c2", "t1", "tok");

        registry.closeAll();
        registry.closeAll();
        registry.close();

        assertThat(a.isOpen()).isFalse();
        assertThat(b.isOpen()).isFalse();
        assertThat(registry.size()).isZero();
    }

    @Test
    void requestRoundTripThroughRegistry() {
        ChatConnection connection = registry.getOrCreate("c1", "t1", "tok");
        RequestHandle handle = connection.send(Map.of("model", "m"), CancellationToken.none());
        RecordingSubscriber<ServerEvent> events = RecordingSubscriber.subscribe(handle.events());

        transport.last().receive("{\"type\":\"response.created\"}");
        transport.last().receive("{\"type\":\"response.completed\"}");

        assertThat(events.items).extracting(ServerEvent::type).containsExactly("response.created", "response.completed");
        assertThat(handle.done()).isCompleted();

        // a second tool-call round of the same turn reuses the socket
        assertThat(registry.getOrCreate("c1", "t1", "tok")).isSameAs(connection);
        RequestHandle next = connection.send(Map.of("model", "m"), CancellationToken.none());
        transport.last().receive("{\"type\":\"response.completed\"}");
        assertThat(next.done()).isCompleted();
        assertThat(transport.last().sent).hasSize(2);
        assertThat(registry.hasActive("c1", "t1")).isTrue();

        registry.close("c1");
        assertThat(registry.hasActive("c1", "t1")).isFalse();
    }

    @Test
    void completionCallbackMayCloseWhileAnotherThreadCloses() throws Exception {
        ChatConnection connection = registry.getOrCreate("c1", "t1", "tok");
        RequestHandle first = connection.send(Map.of(), CancellationToken.none());
        CountDownLatch inCallback = new CountDownLatch(1);
        Thread closer = new Thread(() -> {
            awaitQuietly(inCallback);
            registry.close("c1");
        }, "closer");
        first.done().whenComplete((ignored, error) -> {
            inCallback.countDown();
            awaitBlockedOrTerminated(closer);
            registry.close("c1", "t1");
        });
        Thread sender = new Thread(() -> connection.send(Map.of(), CancellationToken.none()), "sender");

        closer.start();
        sender.start();
        sender.join(5_000);
        closer.join(5_000);

        assertThat(sender.isAlive()).isFalse();
        assertThat(closer.isAlive()).isFalse();
        assertThat(failure(first)).isInstanceOf(ChatWebSocketException.Superseded.class);
        assertThat(connection.isOpen()).isFalse();
        assertThat(registry.size()).isZero();
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void awaitBlockedOrTerminated(Thread thread) {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(1);
        while (System.nanoTime() < deadline) {
            Thread.State state = thread.getState();
            if (state == Thread.State.BLOCKED || state == Thread.State.TERMINATED) {
                return;
            }
            try {
                Thread.sleep(5);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    @Test
    void builderRequiresConfig() {
        assertThatThrownBy(() -> ConnectionRegistry.builder().transport(transport).build())
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void unavailableRegistryRejectsConnections() {
        ConnectionRegistry unavailable = ConnectionRegistry.unavailable();

        assertThatThrownBy(() -> unavailable.getOrCreate("c1", "t1", "tok"))
                .isInstanceOf(UnsupportedOperationException.class)
                .hasMessage("WebSocket not available");
        assertThat(unavailable.hasActive("c1", "t1")).isFalse();
        unavailable.close("c1");
        unavailable.close("c1", "t1");
        unavailable.closeAll();
    }
}
