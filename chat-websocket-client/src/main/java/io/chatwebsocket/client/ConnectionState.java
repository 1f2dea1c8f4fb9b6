package io.chatwebsocket.client;

/**
 * Lifecycle of a {@link WebSocketConnection}. {@code CLOSED} is terminal.
 */
public enum ConnectionState {
    CONNECTING,
    OPEN,
    CLOSED
}
