package io.chatwebsocket.core;

/**
 * Handle for a listener subscription. Closing it detaches the listener; closing twice is a no-op.
 */
@FunctionalInterface
public interface Registration extends AutoCloseable {

    @Override
    void close();

    static Registration noop() {
        return () -> {};
    }
}
