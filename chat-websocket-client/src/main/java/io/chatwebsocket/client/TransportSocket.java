package io.chatwebsocket.client;

import java.util.concurrent.CompletableFuture;

/**
 * An open socket as seen by a {@link WebSocketConnection}.
 */
public interface TransportSocket {

    /**
     * Writes one complete text frame. Writes are delivered in call order.
     *
     * @return a future completing when the frame is written, or failing if it cannot be
     */
    CompletableFuture<Void> sendText(String text);

    /**
     * Starts the closing handshake. Closing an already closed socket is a no-op.
     */
    void close(int code, String reason);
}
