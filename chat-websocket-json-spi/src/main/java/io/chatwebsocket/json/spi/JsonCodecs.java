package io.chatwebsocket.json.spi;

import java.util.Iterator;
import java.util.Objects;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Discovers a {@link JsonCodec} through {@link ServiceLoader}.
 */
public final class JsonCodecs {
    private JsonCodecs() {}

    /**
     * Returns the codec of the first registered provider on the given class loader.
     */
    public static Optional<JsonCodec> discover(ClassLoader cl) {
        Objects.requireNonNull(cl, "cl");
        Iterator<JsonCodecProvider> it = ServiceLoader.load(JsonCodecProvider.class, cl).iterator();
        while (it.hasNext()) {
            JsonCodec codec = it.next().codec();
            if (codec != null) {
                return Optional.of(codec);
            }
        }
        return Optional.empty();
    }

    /**
     * Discovers a codec on the context class loader.
     *
     * @throws IllegalStateException if no provider is registered
     */
    public static JsonCodec discover() {
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        if (cl == null) {
            cl = JsonCodecs.class.getClassLoader();
        }
        return discover(cl).orElseThrow(() -> new IllegalStateException(
                "No JsonCodecProvider found; add chat-websocket-json-jackson to the classpath"));
    }
}
