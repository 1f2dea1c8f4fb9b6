package io.chatwebsocket.core;

/**
 * WebSocket close codes (RFC 6455 section 7.4.1) and their human-readable names.
 */
public final class CloseCodes {
    private CloseCodes() {}

    public static final int NORMAL_CLOSURE = 1000;
    public static final int GOING_AWAY = 1001;
    public static final int PROTOCOL_ERROR = 1002;
    public static final int UNSUPPORTED_DATA = 1003;
    public static final int NO_STATUS_RECEIVED = 1005;
    public static final int ABNORMAL_CLOSURE = 1006;
    public static final int INVALID_PAYLOAD = 1007;
    public static final int POLICY_VIOLATION = 1008;
    public static final int MESSAGE_TOO_BIG = 1009;
    public static final int MISSING_EXTENSION = 1010;
    public static final int INTERNAL_ERROR = 1011;
    public static final int SERVICE_RESTART = 1012;
    public static final int TRY_AGAIN_LATER = 1013;
    public static final int BAD_GATEWAY = 1014;
    public static final int TLS_HANDSHAKE_FAILED = 1015;

    /**
     * Returns the name of a close code, or {@code "Unknown"} for codes outside the table.
     */
    public static String describe(int code) {
        return switch (code) {
            case NORMAL_CLOSURE -> "Normal Closure";
            case GOING_AWAY -> "Going Away";
            case PROTOCOL_ERROR -> "Protocol Error";
            case UNSUPPORTED_DATA -> "Unsupported Data";
            case NO_STATUS_RECEIVED -> "No Status Received";
            case ABNORMAL_CLOSURE -> "Abnormal Closure";
            case INVALID_PAYLOAD -> "Invalid Payload";
            case POLICY_VIOLATION -> "Policy Violation";
            case MESSAGE_TOO_BIG -> "Message Too Big";
            case MISSING_EXTENSION -> "Missing Extension";
            case INTERNAL_ERROR -> "Internal Error";
            case SERVICE_RESTART -> "Service Restart";
            case TRY_AGAIN_LATER -> "Try Again Later";
            case BAD_GATEWAY -> "Bad Gateway";
            case TLS_HANDSHAKE_FAILED -> "TLS Handshake Failed";
            default -> "Unknown";
        };
    }

    /**
     * Formats a close code with its name and an optional reason, e.g. {@code "1006 Abnormal Closure, reason: eof"}.
     */
    public static String format(int code, String reason) {
        StringBuilder sb = new StringBuilder().append(code).append(' ').append(describe(code));
        if (reason != null && !reason.isEmpty()) {
            sb.append(", reason: ").append(reason);
        }
        return sb.toString();
    }
}
