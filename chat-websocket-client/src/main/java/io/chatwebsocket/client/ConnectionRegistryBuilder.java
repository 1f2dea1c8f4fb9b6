package io.chatwebsocket.client;

import io.chatwebsocket.core.EndpointResolver;
import io.chatwebsocket.core.Endpoints;
import io.chatwebsocket.json.spi.JsonCodec;
import io.chatwebsocket.json.spi.JsonCodecs;

import java.net.http.HttpClient;
import java.util.Objects;

public final class ConnectionRegistryBuilder {
    private ChatWebSocketConfig config;
    private WebSocketTransport transport;
    private JsonCodec jsonCodec;
    private EndpointResolver endpointResolver = Endpoints.responses();

    public ConnectionRegistryBuilder config(ChatWebSocketConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        return this;
    }

    public ConnectionRegistryBuilder transport(WebSocketTransport transport) {
        this.transport = Objects.requireNonNull(transport, "transport");
        return this;
    }

    public ConnectionRegistryBuilder jdkHttpClient(HttpClient httpClient) {
        this.transport = new JdkWebSocketTransport(Objects.requireNonNull(httpClient, "httpClient"));
        return this;
    }

    public ConnectionRegistryBuilder jsonCodec(JsonCodec jsonCodec) {
        this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
        return this;
    }

    public ConnectionRegistryBuilder endpointResolver(EndpointResolver endpointResolver) {
        this.endpointResolver = Objects.requireNonNull(endpointResolver, "endpointResolver");
        return this;
    }

    public ConnectionRegistry build() {
        if (config == null) {
            throw new IllegalStateException("config is required");
        }
        WebSocketTransport resolvedTransport = transport;
        if (resolvedTransport == null) {
            resolvedTransport = new JdkWebSocketTransport(HttpClient.newHttpClient());
        }
        JsonCodec resolvedCodec = jsonCodec == null ? JsonCodecs.discover() : jsonCodec;
        DefaultConnectionRegistry registry = new DefaultConnectionRegistry(config, resolvedTransport, resolvedCodec, endpointResolver);
        if (config.closeOnShutdown()) {
            registry.registerShutdownHook();
        }
        return registry;
    }
}
