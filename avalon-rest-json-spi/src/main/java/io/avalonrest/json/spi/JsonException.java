package io.avalonrest.json.spi;

/**
 * Base exception for JSON serialization and deserialization errors.
 *
 * <p>Messages produced by codecs for malformed input carry only a location summary
 * (line and column), never the offending text.
 */
public class JsonException extends Exception {
    public JsonException(String message) {
        super(message);
    }

    public JsonException(String message, Throwable cause) {
        super(message, cause);
    }

    public JsonException(Throwable cause) {
        super(cause);
    }
}
