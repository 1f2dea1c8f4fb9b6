package io.chatwebsocket.client;

import io.chatwebsocket.core.ChatWebSocketException;
import io.chatwebsocket.core.EndpointResolver;
import io.chatwebsocket.core.Registration;
import io.chatwebsocket.json.spi.JsonCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link ConnectionRegistry} keeping one {@link WebSocketConnection} per conversation.
 *
 * <p>The conversation map is guarded by this instance's monitor. Handshakes and disposals run outside it,
 * so a slow connect never blocks lookups and request callbacks may call back into the registry.
 */
public final class DefaultConnectionRegistry implements ConnectionRegistry {

    private static final Logger log = LoggerFactory.getLogger(DefaultConnectionRegistry.class);

    private final ChatWebSocketConfig config;
    private final WebSocketTransport transport;
    private final JsonCodec json;
    private final EndpointResolver endpointResolver;

    private final Map<String, Entry> entries = new HashMap<>();

    private record Entry(String turnId, WebSocketConnection connection, Registration disposal) {}

    public DefaultConnectionRegistry(ChatWebSocketConfig config, WebSocketTransport transport, JsonCodec json,
                                     EndpointResolver endpointResolver) {
        this.config = Objects.requireNonNull(config, "config");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.json = Objects.requireNonNull(json, "json");
        this.endpointResolver = Objects.requireNonNull(endpointResolver, "endpointResolver");
    }

    @Override
    public ChatConnection getOrCreate(String conversationId, String turnId, String credential) {
        Objects.requireNonNull(conversationId, "conversationId");
        Objects.requireNonNull(turnId, "turnId");
        Objects.requireNonNull(credential, "credential");

        WebSocketConnection connection;
        Entry stale = null;
        synchronized (this) {
            Entry existing = entries.get(conversationId);
            if (existing != null && existing.turnId().equals(turnId) && existing.connection().isOpen()) {
                log.debug("Reusing connection for conversation {} turn {}", conversationId, turnId);
                return existing.connection();
            }

            if (existing != null) {
                log.debug("Closing previous connection for conversation {} turn {} (requested turn {})",
                        conversationId, existing.turnId(), turnId);
                stale = detach(conversationId, existing);
            }

            URI url = endpointResolver.resolve(config.baseUrl());
            connection = new WebSocketConnection(url, credential, conversationId, turnId, config, transport, json);
            log.debug("Creating new connection for conversation {} turn {}", conversationId, turnId);

            WebSocketConnection created = connection;
            Registration disposal = connection.onDispose(() -> onDisposed(conversationId, created));
            entries.put(conversationId, new Entry(turnId, connection, disposal));
        }
        if (stale != null) {
            stale.connection().close();
        }

        try {
            connection.connect();
        } catch (ChatWebSocketException e) {
            synchronized (this) {
                Entry entry = entries.get(conversationId);
                if (entry != null && entry.connection() == connection) {
                    entries.remove(conversationId);
                    entry.disposal().close();
                }
            }
            throw e;
        }
        return connection;
    }

    @Override
    public synchronized boolean hasActive(String conversationId, String turnId) {
        Entry entry = entries.get(conversationId);
        return entry != null && entry.turnId().equals(turnId) && entry.connection().isOpen();
    }

    @Override
    public void close(String conversationId) {
        Entry entry;
        synchronized (this) {
            entry = entries.get(conversationId);
            if (entry == null) {
                return;
            }
            log.debug("Closing connection for conversation {} turn {}", conversationId, entry.turnId());
            detach(conversationId, entry);
        }
        entry.connection().close();
    }

    @Override
    public void close(String conversationId, String turnId) {
        Objects.requireNonNull(turnId, "turnId");
        Entry entry;
        synchronized (this) {
            entry = entries.get(conversationId);
            if (entry == null) {
                return;
            }
            if (!entry.turnId().equals(turnId)) {
                log.debug("Not closing connection for conversation {}: requested turn {} does not match active turn {}",
                        conversationId, turnId, entry.turnId());
                return;
            }
            log.debug("Closing connection for conversation {} turn {}", conversationId, turnId);
            detach(conversationId, entry);
        }
        entry.connection().close();
    }

    @Override
    public void closeAll() {
        List<Entry> snapshot;
        synchronized (this) {
            snapshot = new ArrayList<>(entries.values());
            entries.clear();
        }
        for (Entry entry : snapshot) {
            entry.disposal().close();
            entry.connection().close();
        }
    }

    synchronized int size() {
        return entries.size();
    }

    void registerShutdownHook() {
        Runtime.getRuntime().addShutdownHook(new Thread(this::closeAll, "chat-websocket-shutdown"));
    }

    /**
     * Forgets the entry and stops listening for its disposal. Callers close the connection after leaving
     * the monitor, since disposal runs request callbacks.
     */
    private Entry detach(String conversationId, Entry entry) {
        entries.remove(conversationId);
        entry.disposal().close();
        return entry;
    }

    private synchronized void onDisposed(String conversationId, WebSocketConnection connection) {
        Entry entry = entries.get(conversationId);
        if (entry != null && entry.connection() == connection) {
            log.debug("Connection for conversation {} turn {} disposed; removing", conversationId, entry.turnId());
            entries.remove(conversationId);
        }
    }
}
