package io.avalonrest.json.spi;

import java.lang.reflect.Type;

/**
 * Minimal JSON codec interface providing serialization, tree parsing and binding.
 * Implementations wrap specific JSON libraries.
 *
 * <p>Serialized output uses camelCase property names. Binding matches property names
 * case-insensitively and ignores unknown properties.
 */
public interface JsonCodec {

    // ===== Serialization =====

    /**
     * Serializes an object to a JSON byte array.
     * @param value the object to serialize
     * @return JSON bytes
     * @throws JsonException if serialization fails
     */
    byte[] writeBytes(Object value) throws JsonException;

    /**
     * Serializes an object to a JSON string.
     * @param value the object to serialize
     * @return JSON string
     * @throws JsonException if serialization fails
     */
    String writeString(Object value) throws JsonException;

    // ===== Deserialization =====

    /**
     * Deserializes JSON bytes to an object of the given (possibly generic) type.
     * @throws JsonException if the input is malformed or cannot be bound
     */
    <T> T readValue(byte[] data, Type type) throws JsonException;

    /**
     * Deserializes a JSON string to an object of the given (possibly generic) type.
     * @throws JsonException if the input is malformed or cannot be bound
     */
    <T> T readValue(String json, Type type) throws JsonException;

    /**
     * Parses JSON bytes into a navigable tree.
     * @throws JsonException if the input is malformed
     */
    JsonNode readTree(byte[] data) throws JsonException;

    /**
     * Parses a JSON string into a navigable tree.
     * @throws JsonException if the input is malformed
     */
    JsonNode readTree(String json) throws JsonException;

    // ===== Binding =====

    /**
     * Binds an already parsed tree to the given type.
     * @throws JsonException if the tree does not fit the type
     */
    <T> T convert(JsonNode node, Type type) throws JsonException;
}
