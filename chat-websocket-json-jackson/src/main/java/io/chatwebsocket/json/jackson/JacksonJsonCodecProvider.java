package io.chatwebsocket.json.jackson;

import io.chatwebsocket.json.spi.JsonCodec;
import io.chatwebsocket.json.spi.JsonCodecProvider;

/**
 * ServiceLoader provider for {@link JacksonJsonCodec}.
 */
public final class JacksonJsonCodecProvider implements JsonCodecProvider {
    @Override
    public JsonCodec codec() {
        return new JacksonJsonCodec();
    }
}
