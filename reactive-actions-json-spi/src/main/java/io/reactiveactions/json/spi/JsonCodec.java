package io.reactiveactions.json.spi;

import java.util.List;

/**
 * JSON codec used to write response payloads and decode request bodies.
 * Implementations wrap a specific JSON library.
 */
public interface JsonCodec {

    /**
     * Serializes an object to JSON bytes.
     * @throws JsonException if serialization fails
     */
    byte[] writeBytes(Object value) throws JsonException;

    /**
     * Deserializes JSON bytes to a typed object.
     * @throws JsonException if the bytes are not valid JSON for {@code type}
     */
    <T> T readValue(byte[] data, Class<T> type) throws JsonException;

    /**
     * Deserializes a JSON array to a list of typed objects.
     * @throws JsonException if the bytes are not a valid JSON array of {@code elementType}
     */
    <T> List<T> readList(byte[] data, Class<T> elementType) throws JsonException;
}
