package io.avalonrest.server.core.security;

import java.time.Duration;
import java.time.Instant;

/**
 * Read-only view of a client's standing, computed without consuming a request.
 *
 * @param allowed whether a request would currently be admitted
 * @param whitelisted the address is whitelisted
 * @param blacklisted the address is blacklisted
 * @param blocked the address is temporarily blocked
 * @param currentRequests requests counted in the current window
 * @param maxRequests budget of the matched endpoint
 * @param remainingRequests {@code max(0, maxRequests - currentRequests)}
 * @param window window of the matched endpoint
 * @param resetTime when the oldest counted request leaves the window, null when none are counted
 * @param blockedUntil end of the active block, null when not blocked
 * @param blockReason reason of the active block, null when not blocked
 * @param message short human-readable summary
 */
public record RateLimitStatus(
        boolean allowed,
        boolean whitelisted,
        boolean blacklisted,
        boolean blocked,
        int currentRequests,
        int maxRequests,
        int remainingRequests,
        Duration window,
        Instant resetTime,
        Instant blockedUntil,
        String blockReason,
        String message) {
}
