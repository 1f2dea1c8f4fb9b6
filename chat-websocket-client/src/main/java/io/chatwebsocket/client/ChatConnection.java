package io.chatwebsocket.client;

import io.chatwebsocket.core.CancellationToken;

import java.util.Map;

/**
 * One WebSocket connection to the responses endpoint, carrying at most one request at a time.
 */
public interface ChatConnection extends AutoCloseable {

    /**
     * Sends a {@code response.create} request.
     *
     * <p>An outstanding request on this connection is failed with
     * {@link io.chatwebsocket.core.ChatWebSocketException.Superseded} first.
     *
     * @param body request fields; {@code stream} is dropped because the socket always streams
     * @param token cancels the request (not the connection) when triggered before it settles
     * @return the request handle
     * @throws IllegalStateException if the connection is not open
     */
    RequestHandle send(Map<String, ?> body, CancellationToken token);

    /**
     * Whether the connection is open and usable.
     */
    boolean isOpen();

    /**
     * Disposes the connection: fails the outstanding request, closes the socket. Idempotent.
     */
    @Override
    void close();
}
