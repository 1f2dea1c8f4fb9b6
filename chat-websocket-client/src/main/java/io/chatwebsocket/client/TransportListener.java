package io.chatwebsocket.client;

/**
 * Receives inbound socket notifications. Transports call these serially for one socket.
 */
public interface TransportListener {

    /**
     * A complete text message arrived.
     */
    void onText(String text);

    /**
     * The socket closed. This is the last notification for the socket.
     */
    void onClose(int code, String reason);

    /**
     * A socket-level error occurred. A close may still follow.
     */
    void onError(Throwable error);
}
