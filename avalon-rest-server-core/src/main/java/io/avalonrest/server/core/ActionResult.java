package io.avalonrest.server.core;

import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of a handler method.
 *
 * <p>Handlers may return one of these variants or any other object, which is treated as
 * {@code Value(200, object)}. A {@code null} or {@code void} return answers 200 with {@code {}}.
 */
public sealed interface ActionResult
        permits ActionResult.Status, ActionResult.Value, ActionResult.Content, ActionResult.File, ActionResult.StreamFile {

    int status();

    /**
     * Status with an empty JSON object body (no body for 204 and 304).
     */
    record Status(int status) implements ActionResult {}

    /**
     * Status with a value serialized as JSON; a {@link String} value is written as plain text.
     */
    record Value(int status, Object value) implements ActionResult {}

    /**
     * Raw text written verbatim with an explicit content type.
     */
    record Content(int status, String content, String contentType, Charset charset) implements ActionResult {
        public Content {
            content = content == null ? "" : content;
            contentType = contentType == null ? "text/plain" : contentType;
            charset = charset == null ? StandardCharsets.UTF_8 : charset;
        }
    }

    /**
     * In-memory file sent as an attachment.
     */
    record File(byte[] bytes, String contentType, String fileName) implements ActionResult {
        public File {
            Objects.requireNonNull(bytes, "bytes");
        }

        @Override
        public int status() {
            return 200;
        }
    }

    /**
     * Streamed file, either as an attachment or inline. The stream is closed after writing.
     */
    record StreamFile(InputStream stream, String contentType, String fileName, boolean attachment) implements ActionResult {
        public StreamFile {
            Objects.requireNonNull(stream, "stream");
        }

        @Override
        public int status() {
            return 200;
        }
    }

    static ActionResult ok(Object value) {
        return new Value(200, value);
    }

    static ActionResult error(int status, String message) {
        return new Value(status, Map.of("error", message != null ? message : reasonPhrase(status)));
    }

    /** Fallback error text for exceptions raised without a message. */
    static String reasonPhrase(int status) {
        switch (status) {
            case 400:
                return "Bad request";
            case 401:
                return "Unauthorized";
            case 403:
                return "Forbidden";
            case 404:
                return "Not found";
            case 413:
                return "Request entity too large";
            case 429:
                return "Too many requests";
            default:
                return status >= 500 ? "Internal server error" : "Request failed";
        }
    }

    /**
     * Maps whatever a handler returned to a result variant.
     */
    static ActionResult of(Object returned) {
        if (returned instanceof ActionResult r) return r;
        if (returned == null) return new Value(200, Map.of());
        return new Value(200, returned);
    }
}
