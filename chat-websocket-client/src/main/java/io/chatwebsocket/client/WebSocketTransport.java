package io.chatwebsocket.client;

import java.util.concurrent.CompletableFuture;

/**
 * Abstraction over WebSocket client implementations.
 *
 * <p>Implementations should be thread-safe and reusable across connections.
 */
public interface WebSocketTransport {

    /**
     * Starts the opening handshake.
     *
     * @param request endpoint, headers and timeout
     * @param listener receives the socket's inbound notifications
     * @return a future completing with the open socket, or failing if the handshake fails
     */
    CompletableFuture<TransportSocket> connect(TransportRequest request, TransportListener listener);
}
