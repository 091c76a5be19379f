package io.avalonrest.server.core.security;

import io.avalonrest.server.spi.BlockedIpRecord;

import java.util.List;

/**
 * Snapshot of limiter state for administrative endpoints.
 */
public record RateLimitStatistics(
        int activeClients,
        int blockedIps,
        int whitelistedIps,
        int blacklistedIps,
        int configuredEndpoints,
        List<BlockedIpRecord> blockedIpsList) {

    public RateLimitStatistics {
        blockedIpsList = blockedIpsList == null ? List.of() : List.copyOf(blockedIpsList);
    }
}
