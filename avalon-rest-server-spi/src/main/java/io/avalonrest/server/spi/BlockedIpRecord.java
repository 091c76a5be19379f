package io.avalonrest.server.spi;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * A temporary block placed on a client address.
 *
 * @param ip the blocked address
 * @param blockedAt when the block was placed or last refreshed
 * @param blockedUntil when the block lifts
 * @param reason human-readable cause
 * @param violationCount cumulative violations of the address when the block was placed
 */
public record BlockedIpRecord(String ip, Instant blockedAt, Instant blockedUntil, String reason, int violationCount) {

    public BlockedIpRecord {
        Objects.requireNonNull(ip, "ip");
        Objects.requireNonNull(blockedAt, "blockedAt");
        Objects.requireNonNull(blockedUntil, "blockedUntil");
        reason = reason == null ? "" : reason;
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(blockedUntil);
    }

    /**
     * Time left until the block lifts, never negative.
     */
    public Duration remaining(Instant now) {
        Duration d = Duration.between(now, blockedUntil);
        return d.isNegative() ? Duration.ZERO : d;
    }
}
