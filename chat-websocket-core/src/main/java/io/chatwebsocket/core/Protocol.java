package io.chatwebsocket.core;

/**
 * Wire protocol constants (message types, field names, header names and well-known values).
 *
 * <p>Shared by transports and clients; no socket bindings and no JSON library types.
 */
public final class Protocol {
    private Protocol() {}

    // Message type discriminators
    public static final String TYPE_RESPONSE_CREATE = "response.create";
    public static final String TYPE_RESPONSE_COMPLETED = "response.completed";
    public static final String TYPE_ERROR = "error";

    // Message fields
    public static final String F_TYPE = "type";
    public static final String F_STREAM = "stream";
    public static final String F_MESSAGE = "message";
    public static final String F_CODE = "code";

    // Handshake headers
    public static final String H_AUTHORIZATION = "Authorization";
    public static final String H_INTEGRATION_ID = "Copilot-Integration-Id";

    /** Prefix of the bearer credential in {@link #H_AUTHORIZATION}. */
    public static final String BEARER_PREFIX = "Bearer ";

    /** Integration identifier sent when none is configured. */
    public static final String DEFAULT_INTEGRATION_ID = "vscode-chat";

    /** Path of the streaming responses endpoint. */
    public static final String PATH_RESPONSES = "/responses";

    // URI schemes
    public static final String SCHEME_WS = "ws";
    public static final String SCHEME_WSS = "wss";
    public static final String SCHEME_HTTPS = "https";
}
