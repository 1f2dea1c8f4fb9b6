package io.chatwebsocket.core;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Objects;

/**
 * Utility to derive WebSocket endpoint addresses from HTTP service addresses.
 */
public final class Endpoints {
    private Endpoints() {}

    /**
     * Default resolver: {@code https} maps to {@code wss}, any other scheme to {@code ws}, and the path
     * is replaced with {@link Protocol#PATH_RESPONSES}. Query and fragment are dropped.
     */
    public static EndpointResolver responses() {
        return base -> toWebSocket(base, Protocol.PATH_RESPONSES);
    }

    public static URI toWebSocket(URI base, String path) {
        Objects.requireNonNull(base, "base");
        Objects.requireNonNull(path, "path");
        if (base.getHost() == null) {
            throw new IllegalArgumentException("base URL has no host: " + base);
        }
        String scheme = Protocol.SCHEME_HTTPS.equalsIgnoreCase(base.getScheme()) ? Protocol.SCHEME_WSS : Protocol.SCHEME_WS;
        try {
            return new URI(scheme, base.getUserInfo(), base.getHost(), base.getPort(), path, null, null);
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("cannot derive WebSocket URL from " + base, e);
        }
    }
}
