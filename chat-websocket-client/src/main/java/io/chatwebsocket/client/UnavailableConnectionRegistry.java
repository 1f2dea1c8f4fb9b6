package io.chatwebsocket.client;

/**
 * No-op registry: every lookup fails and nothing is ever active.
 */
final class UnavailableConnectionRegistry implements ConnectionRegistry {

    static final UnavailableConnectionRegistry INSTANCE = new UnavailableConnectionRegistry();

    private UnavailableConnectionRegistry() {}

    @Override
    public ChatConnection getOrCreate(String conversationId, String turnId, String credential) {
        throw new UnsupportedOperationException("WebSocket not available");
    }

    @Override
    public boolean hasActive(String conversationId, String turnId) {
        return false;
    }

    @Override
    public void close(String conversationId) {
    }

    @Override
    public void close(String conversationId, String turnId) {
    }

    @Override
    public void closeAll() {
    }
}
