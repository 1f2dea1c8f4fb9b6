package io.chatwebsocket.core;

/**
 * Base class for failures reported by chat WebSocket connections and requests.
 *
 * <p>Each subclass names one way a connection or an in-flight request can end badly. None of them is
 * retried by the library; callers decide whether to reconnect or resend.
 */
public abstract class ChatWebSocketException extends RuntimeException {

    protected ChatWebSocketException(String message) {
        super(message);
    }

    protected ChatWebSocketException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Raised when the opening handshake fails, times out, or the socket closes before it is open.
     */
    public static class HandshakeFailed extends ChatWebSocketException {
        public HandshakeFailed(String message) {
            super(message);
        }

        public HandshakeFailed(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Raised when the server sends an {@code error} event.
     */
    public static class ServerError extends ChatWebSocketException {
        private final String code;

        public ServerError(String message, String code) {
            super(message == null ? "Server error" : message);
            this.code = code;
        }

        /**
         * Machine-readable error code, or null when the server sent none.
         */
        public String code() {
            return code;
        }
    }

    /**
     * Raised when the socket closes while a request is still pending.
     */
    public static class ConnectionClosed extends ChatWebSocketException {
        private final int closeCode;
        private final String closeReason;

        public ConnectionClosed(int closeCode, String closeReason) {
            super("WebSocket closed unexpectedly (code: " + CloseCodes.format(closeCode, closeReason) + ")");
            this.closeCode = closeCode;
            this.closeReason = closeReason;
        }

        public int closeCode() {
            return closeCode;
        }

        public String closeReason() {
            return closeReason;
        }
    }

    /**
     * Raised for socket-level errors that are not a close, and for failed writes.
     */
    public static class TransportFailure extends ChatWebSocketException {
        public TransportFailure(String message) {
            super(message);
        }

        public TransportFailure(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Raised when the caller cancels a request before it settles.
     */
    public static class Cancelled extends ChatWebSocketException {
        public Cancelled() {
            super("Request cancelled");
        }
    }

    /**
     * Raised on a request that was replaced by a newer request on the same connection.
     */
    public static class Superseded extends ChatWebSocketException {
        public Superseded() {
            super("Request superseded by new request");
        }
    }

    /**
     * Raised on a request whose connection was disposed.
     */
    public static class Disposed extends ChatWebSocketException {
        public Disposed() {
            super("Connection disposed");
        }
    }

    /**
     * Raised when a request body cannot be encoded.
     */
    public static class InvalidRequest extends ChatWebSocketException {
        public InvalidRequest(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
