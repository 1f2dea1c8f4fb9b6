package io.chatwebsocket.core;

import java.net.URI;

/**
 * Resolves the streaming WebSocket endpoint from the base address of the service.
 */
@FunctionalInterface
public interface EndpointResolver {

    URI resolve(URI baseUrl);
}
