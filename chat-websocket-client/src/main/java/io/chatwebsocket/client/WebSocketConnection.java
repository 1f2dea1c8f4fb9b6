package io.chatwebsocket.client;

import io.chatwebsocket.core.CancellationToken;
import io.chatwebsocket.core.ChatWebSocketException;
import io.chatwebsocket.core.CloseCodes;
import io.chatwebsocket.core.Protocol;
import io.chatwebsocket.core.Registration;
import io.chatwebsocket.core.ServerEvent;
import io.chatwebsocket.json.spi.JsonCodec;
import io.chatwebsocket.json.spi.JsonException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A single socket to the responses endpoint, scoped to one conversation turn.
 *
 * <p>State moves {@code CONNECTING -> OPEN -> CLOSED} and never back. At most one request is live at a
 * time; inbound frames go to that request until it settles.
 */
public final class WebSocketConnection implements ChatConnection {

    private static final Logger log = LoggerFactory.getLogger(WebSocketConnection.class);

    private final URI url;
    private final String credential;
    private final String conversationId;
    private final String turnId;
    private final ChatWebSocketConfig config;
    private final WebSocketTransport transport;
    private final JsonCodec json;

    private final CompletableFuture<Void> opened = new CompletableFuture<>();
    private final AtomicReference<ActiveRequest> activeRequest = new AtomicReference<>();
    private final AtomicBoolean disposed = new AtomicBoolean();
    private final List<Runnable> disposeListeners = new CopyOnWriteArrayList<>();

    private volatile ConnectionState state = ConnectionState.CONNECTING;
    private volatile TransportSocket socket;
    private boolean handshakeStarted;

    public WebSocketConnection(URI url, String credential, String conversationId, String turnId,
                               ChatWebSocketConfig config, WebSocketTransport transport, JsonCodec json) {
        this.url = Objects.requireNonNull(url, "url");
        this.credential = Objects.requireNonNull(credential, "credential");
        this.conversationId = Objects.requireNonNull(conversationId, "conversationId");
        this.turnId = Objects.requireNonNull(turnId, "turnId");
        this.config = Objects.requireNonNull(config, "config");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.json = Objects.requireNonNull(json, "json");
    }

    public ConnectionState state() {
        return state;
    }

    @Override
    public boolean isOpen() {
        return state == ConnectionState.OPEN && socket != null;
    }

    /**
     * Performs the opening handshake and blocks until the socket is open.
     *
     * <p>Returns immediately if already open; concurrent callers share one handshake. On failure the
     * connection is disposed.
     *
     * @throws ChatWebSocketException.HandshakeFailed if the handshake fails, times out, or the socket
     *         closes first
     */
    public void connect() {
        synchronized (this) {
            if (state == ConnectionState.OPEN) {
                return;
            }
            if (state == ConnectionState.CLOSED) {
                throw new ChatWebSocketException.HandshakeFailed("Connection is closed");
            }
            if (!handshakeStarted) {
                handshakeStarted = true;
                startHandshake();
            }
        }

        Duration timeout = config.handshakeTimeout();
        try {
            opened.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw handshakeFailed("WebSocket handshake timed out after " + timeout.toMillis() + "ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            throw handshakeFailed(messageOf(cause, "WebSocket connection failed"), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw handshakeFailed("Interrupted while connecting", e);
        }
    }

    private void startHandshake() {
        log.debug("Connecting to {} for conversation {} turn {}", url, conversationId, turnId);

        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(Protocol.H_AUTHORIZATION, Protocol.BEARER_PREFIX + credential);
        headers.put(config.integrationIdHeader(), config.integrationId());
        TransportRequest request = new TransportRequest(url, headers, config.handshakeTimeout());

        CompletableFuture<TransportSocket> handshake;
        try {
            handshake = transport.connect(request, new InboundListener());
        } catch (RuntimeException e) {
            opened.completeExceptionally(e);
            return;
        }
        handshake.whenComplete((s, error) -> {
            if (error != null) {
                opened.completeExceptionally(unwrap(error));
                return;
            }
            onOpen(s);
        });
    }

    private void onOpen(TransportSocket s) {
        synchronized (this) {
            if (state != ConnectionState.CONNECTING) {
                // disposed, timed out or closed by the peer while the handshake was in flight
                s.close(CloseCodes.NORMAL_CLOSURE, "");
                opened.completeExceptionally(new IllegalStateException("WebSocket closed during connection setup"));
                return;
            }
            socket = s;
            state = ConnectionState.OPEN;
        }
        log.debug("Connected for conversation {} turn {}", conversationId, turnId);
        opened.complete(null);
    }

    private ChatWebSocketException.HandshakeFailed handshakeFailed(String message, Throwable cause) {
        log.error("Connection error for conversation {} turn {}: {}", conversationId, turnId, message);
        close();
        return new ChatWebSocketException.HandshakeFailed(message, cause);
    }

    @Override
    public RequestHandle send(Map<String, ?> body, CancellationToken token) {
        Objects.requireNonNull(body, "body");
        Objects.requireNonNull(token, "token");

        ActiveRequest request;
        ActiveRequest previous;
        TransportSocket s;
        synchronized (this) {
            s = socket;
            if (s == null || state != ConnectionState.OPEN) {
                throw new IllegalStateException("WebSocket is not connected");
            }
            request = new ActiveRequest(config.eventExecutor());
            previous = activeRequest.getAndSet(request);
        }
        // settled outside the monitor: completion callbacks may call back into the registry
        if (previous != null) {
            previous.handleError(new ChatWebSocketException.Superseded());
        }

        Registration cancellation = token.onCancellationRequested(() -> {
            if (activeRequest.compareAndSet(request, null)) {
                log.debug("Request cancelled for conversation {} turn {}", conversationId, turnId);
                request.handleError(new ChatWebSocketException.Cancelled());
            }
        });
        request.settlement().whenComplete((ignored, error) -> cancellation.close());
        if (request.isSettled()) {
            return request;
        }

        String message;
        try {
            message = json.writeString(envelope(body));
        } catch (JsonException e) {
            activeRequest.compareAndSet(request, null);
            request.handleError(new ChatWebSocketException.InvalidRequest("Failed to encode request", e));
            return request;
        }

        log.debug("Sending request for conversation {} turn {}", conversationId, turnId);
        s.sendText(message).whenComplete((ignored, error) -> {
            if (error != null) {
                Throwable cause = unwrap(error);
                log.error("Failed to send request for conversation {} turn {}: {}", conversationId, turnId, cause.toString());
                request.handleError(new ChatWebSocketException.TransportFailure(messageOf(cause, "WebSocket send failed"), cause));
            }
        });
        return request;
    }

    static Map<String, Object> envelope(Map<String, ?> body) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put(Protocol.F_TYPE, Protocol.TYPE_RESPONSE_CREATE);
        message.putAll(body);
        message.put(Protocol.F_TYPE, Protocol.TYPE_RESPONSE_CREATE);
        message.remove(Protocol.F_STREAM);
        return message;
    }

    /**
     * Registers a one-shot listener for disposal. Runs immediately if already disposed.
     *
     * @return a registration that detaches the listener
     */
    public Registration onDispose(Runnable listener) {
        Objects.requireNonNull(listener, "listener");
        disposeListeners.add(listener);
        if (disposed.get() && disposeListeners.remove(listener)) {
            listener.run();
            return Registration.noop();
        }
        return () -> disposeListeners.remove(listener);
    }

    @Override
    public void close() {
        if (!disposed.compareAndSet(false, true)) {
            return;
        }

        ActiveRequest current = activeRequest.getAndSet(null);
        if (current != null) {
            current.handleError(new ChatWebSocketException.Disposed());
        }

        TransportSocket s;
        synchronized (this) {
            s = socket;
            socket = null;
            state = ConnectionState.CLOSED;
        }
        if (s != null) {
            try {
                s.close(CloseCodes.NORMAL_CLOSURE, "");
            } catch (RuntimeException e) {
                log.debug("Ignoring failure closing socket for conversation {} turn {}: {}", conversationId, turnId, e.toString());
            }
        }
        opened.completeExceptionally(new IllegalStateException("Connection disposed during connection setup"));

        for (Runnable listener : disposeListeners) {
            if (disposeListeners.remove(listener)) {
                listener.run();
            }
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable t = error;
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    private static String messageOf(Throwable t, String fallback) {
        String m = t.getMessage();
        return m == null || m.isBlank() ? fallback : m;
    }

    /**
     * Protocol state machine for inbound socket notifications.
     */
    private final class InboundListener implements TransportListener {

        @Override
        public void onText(String text) {
            ServerEvent event;
            try {
                event = ServerEvent.of(json.readObject(text));
            } catch (JsonException | IllegalArgumentException e) {
                log.error("Failed to parse message for conversation {} turn {}", conversationId, turnId);
                return;
            }
            ActiveRequest current = activeRequest.get();
            if (current != null) {
                current.handleEvent(event);
            }
        }

        @Override
        public void onClose(int code, String reason) {
            boolean wasConnecting;
            synchronized (WebSocketConnection.this) {
                wasConnecting = state == ConnectionState.CONNECTING;
                state = ConnectionState.CLOSED;
                socket = null;
            }
            if (wasConnecting) {
                log.debug("Connection closed during setup for conversation {} turn {}", conversationId, turnId);
                opened.completeExceptionally(new IllegalStateException("WebSocket closed during connection setup"));
            } else {
                log.debug("Connection closed for conversation {} turn {} (code: {})", conversationId, turnId, CloseCodes.format(code, reason));
            }

            ActiveRequest current = activeRequest.getAndSet(null);
            if (current != null) {
                current.handleConnectionClose(code, reason);
            }
            close();
        }

        @Override
        public void onError(Throwable error) {
            String message = messageOf(error, "WebSocket error");
            log.error("Error for conversation {} turn {}: {}", conversationId, turnId, message);
            ActiveRequest current = activeRequest.get();
            if (current != null) {
                current.handleError(new ChatWebSocketException.TransportFailure(message, error));
            }
        }
    }
}
