package io.chatwebsocket.json.spi;

/**
 * {@link java.util.ServiceLoader} hook for {@link JsonCodec} implementations.
 */
public interface JsonCodecProvider {

    JsonCodec codec();
}
