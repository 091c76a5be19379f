package io.avalonrest.core;

import java.util.Locale;
import java.util.Optional;

/**
 * HTTP verbs understood by the dispatcher.
 */
public enum HttpMethod {
    GET,
    POST,
    PUT,
    DELETE,
    PATCH,
    HEAD,
    OPTIONS;

    /**
     * Parses a request-line verb, case-insensitively.
     */
    public static Optional<HttpMethod> parse(String value) {
        if (value == null || value.isBlank()) return Optional.empty();
        try {
            return Optional.of(valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
