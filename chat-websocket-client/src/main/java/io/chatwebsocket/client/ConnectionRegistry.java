package io.chatwebsocket.client;

/**
 * Owns at most one connection per conversation and decides between reuse and replacement.
 *
 * <p>A connection is scoped to a single turn: it is reused across tool-call rounds of the same turn and
 * replaced when a new turn starts or the socket is no longer healthy.
 */
public interface ConnectionRegistry extends AutoCloseable {

    /**
     * Returns the open connection of this conversation turn, or replaces whatever the conversation held
     * with a new connection and blocks until its handshake completes.
     *
     * @param conversationId stable conversation identifier
     * @param turnId identifier of the current turn
     * @param credential bearer credential used for a new handshake
     * @return an open connection
     * @throws io.chatwebsocket.core.ChatWebSocketException.HandshakeFailed if a new connection cannot be opened
     */
    ChatConnection getOrCreate(String conversationId, String turnId, String credential);

    /**
     * Whether the conversation holds an open connection for exactly this turn, i.e. whether the server
     * already has context from earlier rounds of the turn.
     */
    boolean hasActive(String conversationId, String turnId);

    /**
     * Closes and forgets the conversation's connection, whatever its turn.
     */
    void close(String conversationId);

    /**
     * Closes and forgets the conversation's connection only if it still belongs to {@code turnId}.
     */
    void close(String conversationId, String turnId);

    /**
     * Closes every connection. Idempotent.
     */
    void closeAll();

    @Override
    default void close() {
        closeAll();
    }

    static ConnectionRegistryBuilder builder() {
        return new ConnectionRegistryBuilder();
    }

    /**
     * Registry for environments without WebSocket support.
     */
    static ConnectionRegistry unavailable() {
        return UnavailableConnectionRegistry.INSTANCE;
    }
}
