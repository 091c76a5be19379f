package io.avalonrest.server.core.security;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * Request budget for paths starting with {@code pathPrefix}.
 *
 * @param pathPrefix lowercase path prefix; empty for the default limit
 * @param maxRequests requests allowed per window
 * @param window trailing window length
 * @param description label used in logs
 */
public record EndpointLimit(String pathPrefix, int maxRequests, Duration window, String description) {

    public EndpointLimit {
        Objects.requireNonNull(window, "window");
        if (maxRequests <= 0) throw new IllegalArgumentException("maxRequests must be positive");
        if (window.isNegative() || window.isZero()) throw new IllegalArgumentException("window must be positive");
        pathPrefix = pathPrefix == null ? "" : pathPrefix.trim().toLowerCase(Locale.ROOT);
        description = description == null ? "" : description;
    }
}
