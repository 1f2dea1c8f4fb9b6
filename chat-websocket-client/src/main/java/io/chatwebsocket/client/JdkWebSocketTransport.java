package io.chatwebsocket.client;

import io.chatwebsocket.core.CloseCodes;

import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Transport implementation using {@link java.net.http.WebSocket}.
 */
public final class JdkWebSocketTransport implements WebSocketTransport {
    private final HttpClient http;

    /**
     * Creates a new transport.
     *
     * @param http the JDK HttpClient to use
     */
    public JdkWebSocketTransport(HttpClient http) {
        this.http = Objects.requireNonNull(http, "http");
    }

    @Override
    public CompletableFuture<TransportSocket> connect(TransportRequest request, TransportListener listener) {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(listener, "listener");

        WebSocket.Builder builder = http.newWebSocketBuilder();
        if (request.timeout() != null) {
            builder.connectTimeout(request.timeout());
        }
        for (Map.Entry<String, String> entry : request.headers().entrySet()) {
            if (entry.getKey() != null && entry.getValue() != null) {
                builder.header(entry.getKey(), entry.getValue());
            }
        }
        return builder.buildAsync(request.url(), new ListenerAdapter(listener))
                .thenApply(JdkSocket::new);
    }

    /**
     * Reassembles fragmented text messages and keeps exactly one message requested at a time.
     */
    private static final class ListenerAdapter implements WebSocket.Listener {
        private final TransportListener listener;
        private final StringBuilder text = new StringBuilder();
        private final AtomicBoolean terminated = new AtomicBoolean();

        private ListenerAdapter(TransportListener listener) {
            this.listener = listener;
        }

        @Override
        public void onOpen(WebSocket webSocket) {
            webSocket.request(1);
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            text.append(data);
            if (last) {
                String message = text.toString();
                text.setLength(0);
                listener.onText(message);
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onBinary(WebSocket webSocket, ByteBuffer data, boolean last) {
            // binary frames carry nothing for this protocol
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            if (terminated.compareAndSet(false, true)) {
                listener.onClose(statusCode, reason);
            }
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            listener.onError(error);
            // The JDK never calls onClose after onError.
            if (terminated.compareAndSet(false, true)) {
                listener.onClose(CloseCodes.ABNORMAL_CLOSURE, "");
            }
        }
    }

    private static final class JdkSocket implements TransportSocket {
        private final WebSocket ws;
        private CompletableFuture<Void> lastWrite = CompletableFuture.completedFuture(null);

        private JdkSocket(WebSocket ws) {
            this.ws = ws;
        }

        @Override
        public synchronized CompletableFuture<Void> sendText(String text) {
            // java.net.http.WebSocket rejects a send while the previous one is still pending.
            CompletableFuture<Void> write = lastWrite
                    .handle((ignored, error) -> null)
                    .thenCompose(ignored -> ws.sendText(text, true))
                    .thenApply(ignored -> null);
            lastWrite = write;
            return write;
        }

        @Override
        public void close(int code, String reason) {
            if (ws.isOutputClosed()) {
                return;
            }
            try {
                ws.sendClose(code, reason == null ? "" : reason)
                        .whenComplete((ignored, error) -> {
                            if (error != null) {
                                ws.abort();
                            }
                        });
            } catch (IllegalStateException e) {
                ws.abort();
            }
        }
    }
}
