package io.avalonrest.server.core.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

/**
 * Security event log. Events go to the {@code io.avalonrest.security} logger so the logging
 * backend can route them to a dedicated file.
 */
public final class SecurityLogger {

    public static final String LOGGER_NAME = "io.avalonrest.security";

    private static final Logger LOG = LoggerFactory.getLogger(LOGGER_NAME);

    private SecurityLogger() {}

    public static void rateLimitViolation(String identifier, String endpoint, String ip, int current, int max) {
        LOG.warn("RATE_LIMIT_VIOLATION ip={} endpoint={} identifier={} requests={}/{}",
                ip, endpoint, identifier, current, max);
    }

    public static void ipBlocked(String ip, String reason, Instant blockedUntil, int violations) {
        LOG.warn("IP_BLOCKED ip={} until={} violations={} reason={}", ip, blockedUntil, violations, reason);
    }

    public static void ipUnblocked(String ip, String reason) {
        LOG.info("IP_UNBLOCKED ip={} reason={}", ip, reason);
    }

    public static void suspiciousActivity(String activity, String ip, String endpoint) {
        LOG.warn("SUSPICIOUS_ACTIVITY ip={} endpoint={} activity={}", ip, endpoint, activity);
    }

    public static void authenticationFailure(String reason, String ip, String endpoint) {
        LOG.info("AUTH_FAILURE ip={} endpoint={} reason={}", ip, endpoint, reason);
    }

    public static void whitelistChanged(String ip, String action) {
        LOG.info("WHITELIST_{} ip={}", action, ip);
    }

    public static void blacklistChanged(String ip, String action) {
        LOG.warn("BLACKLIST_{} ip={}", action, ip);
    }
}
