package io.avalonrest.json.spi;

import java.util.Iterator;
import java.util.Map;

/**
 * Read-only view of a parsed JSON document. Represents any JSON value (object, array,
 * string, number, boolean, null) without exposing the underlying JSON library.
 *
 * <p>Handler parameters declared with this type receive the parsed request body as-is.
 */
public interface JsonNode {

    /**
     * Returns the node type.
     */
    JsonNodeType getNodeType();

    default boolean isObject() {
        return getNodeType() == JsonNodeType.OBJECT;
    }

    default boolean isArray() {
        return getNodeType() == JsonNodeType.ARRAY;
    }

    default boolean isTextual() {
        return getNodeType() == JsonNodeType.STRING;
    }

    default boolean isNumber() {
        return getNodeType() == JsonNodeType.NUMBER;
    }

    default boolean isBoolean() {
        return getNodeType() == JsonNodeType.BOOLEAN;
    }

    default boolean isNull() {
        return getNodeType() == JsonNodeType.NULL;
    }

    /**
     * Gets a field by name from an object node.
     * Returns null if this is not an object or the field doesn't exist.
     */
    JsonNode get(String fieldName);

    /**
     * Gets an element by index from an array node.
     * Returns null if this is not an array or index is out of bounds.
     */
    JsonNode get(int index);

    boolean has(String fieldName);

    /**
     * Number of fields (objects) or elements (arrays); 0 for scalars.
     */
    int size();

    /**
     * Text value for text nodes, the string representation for other scalars.
     */
    String asText();

    long asLong();

    boolean asBoolean();

    Iterator<String> fieldNames();

    Iterator<Map.Entry<String, JsonNode>> fields();

    Iterator<JsonNode> elements();

    /**
     * Returns the compact JSON text of this node.
     */
    String toJson();
}
