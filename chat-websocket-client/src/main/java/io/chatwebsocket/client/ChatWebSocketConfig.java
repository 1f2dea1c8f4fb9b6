package io.chatwebsocket.client;

import io.chatwebsocket.core.Protocol;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URI;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * Immutable settings shared by every connection of a {@link ConnectionRegistry}.
 *
 * <p>Configure programmatically through {@link #builder()} or from properties:
 * <pre>
 * chat-websocket.base-url=https://api.example.com
 * chat-websocket.handshake-timeout-ms=30000
 * chat-websocket.integration-id=vscode-chat
 * chat-websocket.integration-id-header=Copilot-Integration-Id
 * chat-websocket.close-on-shutdown=true
 * </pre>
 */
public final class ChatWebSocketConfig {

    public static final String PREFIX = "chat-websocket.";
    public static final String RESOURCE = "chat-websocket.properties";

    public static final Duration DEFAULT_HANDSHAKE_TIMEOUT = Duration.ofSeconds(30);

    private final URI baseUrl;
    private final Duration handshakeTimeout;
    private final String integrationId;
    private final String integrationIdHeader;
    private final boolean closeOnShutdown;
    private final Executor eventExecutor;

    private ChatWebSocketConfig(Builder b) {
        this.baseUrl = Objects.requireNonNull(b.baseUrl, "baseUrl");
        this.handshakeTimeout = b.handshakeTimeout;
        this.integrationId = b.integrationId;
        this.integrationIdHeader = b.integrationIdHeader;
        this.closeOnShutdown = b.closeOnShutdown;
        this.eventExecutor = b.eventExecutor;
    }

    /**
     * Base address of the service; the streaming endpoint is derived from it.
     */
    public URI baseUrl() {
        return baseUrl;
    }

    /**
     * Maximum time to wait for the opening handshake.
     */
    public Duration handshakeTimeout() {
        return handshakeTimeout;
    }

    public String integrationId() {
        return integrationId;
    }

    public String integrationIdHeader() {
        return integrationIdHeader;
    }

    /**
     * Whether the registry closes all connections from a JVM shutdown hook.
     */
    public boolean closeOnShutdown() {
        return closeOnShutdown;
    }

    /**
     * Executor delivering request events to subscribers.
     */
    public Executor eventExecutor() {
        return eventExecutor;
    }

    public Builder toBuilder() {
        return new Builder()
                .baseUrl(baseUrl)
                .handshakeTimeout(handshakeTimeout)
                .integrationId(integrationId)
                .integrationIdHeader(integrationIdHeader)
                .closeOnShutdown(closeOnShutdown)
                .eventExecutor(eventExecutor);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads {@code chat-websocket.*} keys. Missing keys keep their defaults.
     *
     * @throws IllegalArgumentException if a value cannot be parsed or {@code base-url} is missing
     */
    public static ChatWebSocketConfig fromProperties(Properties props) {
        Objects.requireNonNull(props, "props");
        Builder b = builder();
        String baseUrl = trimmed(props, "base-url");
        if (baseUrl == null) {
            throw new IllegalArgumentException("missing required property: " + PREFIX + "base-url");
        }
        b.baseUrl(URI.create(baseUrl));

        String timeout = trimmed(props, "handshake-timeout-ms");
        if (timeout != null) {
            try {
                b.handshakeTimeout(Duration.ofMillis(Long.parseLong(timeout)));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("invalid " + PREFIX + "handshake-timeout-ms: " + timeout, e);
            }
        }

        String integrationId = trimmed(props, "integration-id");
        if (integrationId != null) b.integrationId(integrationId);

        String header = trimmed(props, "integration-id-header");
        if (header != null) b.integrationIdHeader(header);

        String shutdown = trimmed(props, "close-on-shutdown");
        if (shutdown != null) b.closeOnShutdown(Boolean.parseBoolean(shutdown));

        return b.build();
    }

    /**
     * Loads {@value #RESOURCE} from the context class loader.
     *
     * @return the configuration, or empty if the resource is absent
     * @throws IllegalArgumentException if the resource is present but invalid
     */
    public static Optional<ChatWebSocketConfig> load() {
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        if (cl == null) {
            cl = ChatWebSocketConfig.class.getClassLoader();
        }
        return load(cl);
    }

    /**
     * Loads {@value #RESOURCE} from the given class loader.
     *
     * @return the configuration, or empty if the resource is absent
     * @throws IllegalArgumentException if the resource is present but invalid
     */
    public static Optional<ChatWebSocketConfig> load(ClassLoader cl) {
        Objects.requireNonNull(cl, "cl");
        try (InputStream in = cl.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                return Optional.empty();
            }
            Properties props = new Properties();
            props.load(in);
            return Optional.of(fromProperties(props));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE, e);
        }
    }

    private static String trimmed(Properties props, String key) {
        String v = props.getProperty(PREFIX + key);
        if (v == null || v.isBlank()) return null;
        return v.trim();
    }

    public static final class Builder {
        private URI baseUrl;
        private Duration handshakeTimeout = DEFAULT_HANDSHAKE_TIMEOUT;
        private String integrationId = Protocol.DEFAULT_INTEGRATION_ID;
        private String integrationIdHeader = Protocol.H_INTEGRATION_ID;
        private boolean closeOnShutdown;
        private Executor eventExecutor = ForkJoinPool.commonPool();

        private Builder() {}

        public Builder baseUrl(URI baseUrl) {
            this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
            return this;
        }

        public Builder handshakeTimeout(Duration handshakeTimeout) {
            Objects.requireNonNull(handshakeTimeout, "handshakeTimeout");
            if (handshakeTimeout.isNegative() || handshakeTimeout.isZero()) {
                throw new IllegalArgumentException("handshakeTimeout must be positive");
            }
            this.handshakeTimeout = handshakeTimeout;
            return this;
        }

        public Builder integrationId(String integrationId) {
            this.integrationId = Objects.requireNonNull(integrationId, "integrationId");
            return this;
        }

        public Builder integrationIdHeader(String integrationIdHeader) {
            this.integrationIdHeader = Objects.requireNonNull(integrationIdHeader, "integrationIdHeader");
            return this;
        }

        public Builder closeOnShutdown(boolean closeOnShutdown) {
            this.closeOnShutdown = closeOnShutdown;
            return this;
        }

        public Builder eventExecutor(Executor eventExecutor) {
            this.eventExecutor = Objects.requireNonNull(eventExecutor, "eventExecutor");
            return this;
        }

        public ChatWebSocketConfig build() {
            return new ChatWebSocketConfig(this);
        }
    }
}
