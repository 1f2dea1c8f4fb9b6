package io.chatwebsocket.client;

import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Opening handshake parameters.
 *
 * @param url the WebSocket endpoint
 * @param headers handshake headers
 * @param timeout connect timeout (may be null for the transport default)
 */
public record TransportRequest(URI url, Map<String, String> headers, Duration timeout) {
    public TransportRequest {
        Objects.requireNonNull(url, "url");
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }
}
