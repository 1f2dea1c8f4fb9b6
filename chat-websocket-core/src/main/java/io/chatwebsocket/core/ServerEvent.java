package io.chatwebsocket.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Typed inbound events of a response stream.
 *
 * <p>Every inbound frame is a JSON object carrying a {@code type} discriminator. Two types drive the
 * request lifecycle: {@code error} fails the request and {@code response.completed} finishes it. All other
 * types are passed through untouched as {@link Other}.
 */
public sealed interface ServerEvent permits ServerEvent.Error, ServerEvent.Completed, ServerEvent.Other {

    /**
     * The {@code type} discriminator of the frame.
     */
    String type();

    /**
     * The full decoded frame, including {@code type}.
     */
    Map<String, Object> payload();

    /**
     * Classifies a decoded frame.
     *
     * @param payload the decoded JSON object
     * @return the typed event
     * @throws IllegalArgumentException if the frame carries no string {@code type}
     */
    static ServerEvent of(Map<String, ?> payload) {
        Objects.requireNonNull(payload, "payload");
        Object type = payload.get(Protocol.F_TYPE);
        if (!(type instanceof String name) || name.isEmpty()) {
            throw new IllegalArgumentException("frame has no type discriminator");
        }
        Map<String, Object> copy = Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        switch (name) {
            case Protocol.TYPE_ERROR:
                return new Error(textOrNull(copy.get(Protocol.F_MESSAGE)), textOrNull(copy.get(Protocol.F_CODE)), copy);
            case Protocol.TYPE_RESPONSE_COMPLETED:
                return new Completed(copy);
            default:
                return new Other(name, copy);
        }
    }

    private static String textOrNull(Object value) {
        if (value == null) return null;
        String s = String.valueOf(value);
        return s.isEmpty() ? null : s;
    }

    /**
     * A server-reported failure.
     *
     * @param message the error message (may be null)
     * @param code the machine-readable error code (may be null)
     * @param payload the full frame
     */
    record Error(String message, String code, Map<String, Object> payload) implements ServerEvent {
        public Error {
            Objects.requireNonNull(payload, "payload");
        }

        @Override
        public String type() {
            return Protocol.TYPE_ERROR;
        }
    }

    /**
     * The final event of a successful response.
     *
     * @param payload the full frame
     */
    record Completed(Map<String, Object> payload) implements ServerEvent {
        public Completed {
            Objects.requireNonNull(payload, "payload");
        }

        @Override
        public String type() {
            return Protocol.TYPE_RESPONSE_COMPLETED;
        }
    }

    /**
     * Any other event (deltas, item updates, progress). Opaque to this library.
     *
     * @param type the discriminator
     * @param payload the full frame
     */
    record Other(String type, Map<String, Object> payload) implements ServerEvent {
        public Other {
            Objects.requireNonNull(type, "type");
            Objects.requireNonNull(payload, "payload");
        }
    }
}
