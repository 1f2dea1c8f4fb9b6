package io.chatwebsocket.json.spi;

import java.util.Map;

/**
 * Minimal JSON codec used for socket frames.
 * Implementations wrap specific JSON libraries (Jackson, Gson, Moshi, etc.).
 *
 * <p>Frames are JSON objects in both directions, so the codec works on plain maps rather than
 * exposing a tree model.
 */
public interface JsonCodec {

    /**
     * Serializes an object to a JSON string.
     * @param value the object to serialize
     * @return JSON string
     * @throws JsonException if serialization fails
     */
    String writeString(Object value) throws JsonException;

    /**
     * Deserializes a JSON object.
     * @param json JSON string (must be an object)
     * @return the object's members in document order
     * @throws JsonException if the text is not valid JSON or not an object
     */
    Map<String, Object> readObject(String json) throws JsonException;
}
