package io.avalonrest.server.core.security;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Rate limiter settings.
 *
 * <pre>{@code
 * RateLimitConfig config = RateLimitConfig.builder()
 *     .defaultLimit(100, Duration.ofMinutes(1))
 *     .endpoint("/api/auth/user", 5, Duration.ofMinutes(1), "User login")
 *     .whitelist("127.0.0.1")
 *     .build();
 * }</pre>
 */
public final class RateLimitConfig {

    private final int defaultMaxRequests;
    private final Duration defaultWindow;
    private final Duration blockDuration;
    private final int maxViolationsBeforeBlock;
    private final Duration maxBlockDuration;
    private final Duration inactivityTimeout;
    private final Duration violationMemory;
    private final Duration windowSweepInterval;
    private final Duration blockSweepInterval;
    private final List<EndpointLimit> endpointLimits; // longest prefix first
    private final Set<String> whitelist;
    private final Set<String> blacklist;

    private RateLimitConfig(Builder b) {
        this.defaultMaxRequests = b.defaultMaxRequests > 0 ? b.defaultMaxRequests : 100;
        this.defaultWindow = b.defaultWindow != null ? b.defaultWindow : Duration.ofMinutes(1);
        this.blockDuration = b.blockDuration != null ? b.blockDuration : Duration.ofMinutes(15);
        this.maxViolationsBeforeBlock = b.maxViolationsBeforeBlock > 0 ? b.maxViolationsBeforeBlock : 3;
        this.maxBlockDuration = b.maxBlockDuration != null ? b.maxBlockDuration : Duration.ofDays(3);
        this.inactivityTimeout = b.inactivityTimeout != null ? b.inactivityTimeout : Duration.ofHours(1);
        this.violationMemory = b.violationMemory != null ? b.violationMemory : Duration.ofHours(24);
        this.windowSweepInterval = b.windowSweepInterval != null ? b.windowSweepInterval : Duration.ofMinutes(10);
        this.blockSweepInterval = b.blockSweepInterval != null ? b.blockSweepInterval : Duration.ofMinutes(5);
        List<EndpointLimit> limits = new ArrayList<>(b.endpointLimits);
        limits.sort(Comparator.comparingInt((EndpointLimit l) -> l.pathPrefix().length()).reversed());
        this.endpointLimits = List.copyOf(limits);
        this.whitelist = Set.copyOf(b.whitelist);
        this.blacklist = Set.copyOf(b.blacklist);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Defaults with the stock endpoint table: tight limits on authentication endpoints, uploads
     * and a general budget for {@code /api/}.
     */
    public static RateLimitConfig defaults() {
        return defaultEndpoints(builder()).build();
    }

    /**
     * Adds the stock endpoint table to {@code builder}.
     */
    public static Builder defaultEndpoints(Builder builder) {
        return builder
                .endpoint("/api/auth/store", 5, Duration.ofMinutes(1), "Store login")
                .endpoint("/api/auth/user", 5, Duration.ofMinutes(1), "User login")
                .endpoint("/api/auth/register-user", 3, Duration.ofMinutes(5), "User registration")
                .endpoint("/api/auth/register-store", 3, Duration.ofMinutes(5), "Store registration")
                .endpoint("/api/auth/forgot-password", 3, Duration.ofMinutes(10), "Password recovery")
                .endpoint("/api/auth/reset-password", 5, Duration.ofMinutes(10), "Password reset")
                .endpoint("/api/upload", 10, Duration.ofMinutes(1), "File upload")
                .endpoint("/api/", 100, Duration.ofMinutes(1), "General API");
    }

    /**
     * Longest configured prefix of {@code path} (case-insensitive, trailing slash ignored), else the default limit.
     */
    public EndpointLimit limitFor(String path) {
        if (path != null && !path.isEmpty()) {
            String p = stripTrailingSlash(path.toLowerCase(Locale.ROOT));
            for (EndpointLimit limit : endpointLimits) {
                if (!limit.pathPrefix().isEmpty() && p.startsWith(stripTrailingSlash(limit.pathPrefix()))) {
                    return limit;
                }
            }
        }
        return new EndpointLimit("", defaultMaxRequests, defaultWindow, "Default limit");
    }

    /**
     * Block length for an address with {@code violations} cumulative violations:
     * up to 3 the base duration, up to 5 twice that, up to 10 one hour, up to 20 six hours,
     * up to 50 one day, beyond that the maximum. Never longer than the maximum.
     */
    public Duration blockDurationFor(int violations) {
        Duration d;
        if (violations <= 3) d = blockDuration;
        else if (violations <= 5) d = blockDuration.multipliedBy(2);
        else if (violations <= 10) d = Duration.ofHours(1);
        else if (violations <= 20) d = Duration.ofHours(6);
        else if (violations <= 50) d = Duration.ofDays(1);
        else d = maxBlockDuration;
        return d.compareTo(maxBlockDuration) > 0 ? maxBlockDuration : d;
    }

    private static String stripTrailingSlash(String s) {
        return s.length() > 1 && s.endsWith("/") ? s.substring(0, s.length() - 1) : s;
    }

    public int defaultMaxRequests() {
        return defaultMaxRequests;
    }

    public Duration defaultWindow() {
        return defaultWindow;
    }

    public Duration blockDuration() {
        return blockDuration;
    }

    public int maxViolationsBeforeBlock() {
        return maxViolationsBeforeBlock;
    }

    public Duration maxBlockDuration() {
        return maxBlockDuration;
    }

    public Duration inactivityTimeout() {
        return inactivityTimeout;
    }

    public Duration violationMemory() {
        return violationMemory;
    }

    public Duration windowSweepInterval() {
        return windowSweepInterval;
    }

    public Duration blockSweepInterval() {
        return blockSweepInterval;
    }

    public List<EndpointLimit> endpointLimits() {
        return endpointLimits;
    }

    public Set<String> whitelist() {
        return whitelist;
    }

    public Set<String> blacklist() {
        return blacklist;
    }

    /**
     * Builder for {@link RateLimitConfig}. Unset values take the documented defaults.
     */
    public static final class Builder {
        private int defaultMaxRequests;
        private Duration defaultWindow;
        private Duration blockDuration;
        private int maxViolationsBeforeBlock;
        private Duration maxBlockDuration;
        private Duration inactivityTimeout;
        private Duration violationMemory;
        private Duration windowSweepInterval;
        private Duration blockSweepInterval;
        private final List<EndpointLimit> endpointLimits = new ArrayList<>();
        private final Set<String> whitelist = new LinkedHashSet<>();
        private final Set<String> blacklist = new LinkedHashSet<>();

        private Builder() {
        }

        /** Limit for paths matching no endpoint prefix. Default: 100 per minute. */
        public Builder defaultLimit(int maxRequests, Duration window) {
            this.defaultMaxRequests = maxRequests;
            this.defaultWindow = window;
            return this;
        }

        /** Base block duration. Default: 15 minutes. */
        public Builder blockDuration(Duration blockDuration) {
            this.blockDuration = blockDuration;
            return this;
        }

        /** Violations of one client window that trigger a block. Default: 3. */
        public Builder maxViolationsBeforeBlock(int maxViolationsBeforeBlock) {
            this.maxViolationsBeforeBlock = maxViolationsBeforeBlock;
            return this;
        }

        /** Upper bound for escalated blocks. Default: 3 days. */
        public Builder maxBlockDuration(Duration maxBlockDuration) {
            this.maxBlockDuration = maxBlockDuration;
            return this;
        }

        /** Idle time after which a client window is evicted. Default: 1 hour. */
        public Builder inactivityTimeout(Duration inactivityTimeout) {
            this.inactivityTimeout = inactivityTimeout;
            return this;
        }

        /** How long cumulative per-address violations are remembered without new ones. Default: 24 hours. */
        public Builder violationMemory(Duration violationMemory) {
            this.violationMemory = violationMemory;
            return this;
        }

        /** Interval of the inactive-window sweep. Default: 10 minutes. */
        public Builder windowSweepInterval(Duration windowSweepInterval) {
            this.windowSweepInterval = windowSweepInterval;
            return this;
        }

        /** Interval of the expired-block sweep. Default: 5 minutes. */
        public Builder blockSweepInterval(Duration blockSweepInterval) {
            this.blockSweepInterval = blockSweepInterval;
            return this;
        }

        public Builder endpoint(String pathPrefix, int maxRequests, Duration window, String description) {
            endpointLimits.add(new EndpointLimit(pathPrefix, maxRequests, window, description));
            return this;
        }

        public Builder whitelist(String... ips) {
            for (String ip : ips) {
                if (ip != null && !ip.isBlank()) whitelist.add(ip.trim());
            }
            return this;
        }

        public Builder blacklist(String... ips) {
            for (String ip : ips) {
                if (ip != null && !ip.isBlank()) blacklist.add(ip.trim());
            }
            return this;
        }

        public RateLimitConfig build() {
            return new RateLimitConfig(this);
        }
    }
}
