package io.avalonrest.server.core.security;

import io.avalonrest.server.spi.BlockRecordStore;
import io.avalonrest.server.spi.BlockedIpRecord;
import io.avalonrest.server.spi.ClientKey;
import io.avalonrest.server.spi.RateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Sliding-window rate limiter with escalating temporary address blocks.
 *
 * <p>Each client identity gets one window per matched {@link EndpointLimit}. A request is checked
 * in this order: blacklist (reject), whitelist (admit), temporary block (reject), window. When a
 * window is full the request is a violation; once a window collects
 * {@link RateLimitConfig#maxViolationsBeforeBlock()} violations the address is blocked for a
 * duration that grows with the address's cumulative violations, and the window is dropped.
 *
 * <p>Windows are locked individually, so unrelated clients never contend. Call {@link #start()}
 * to load persisted blocks and schedule the background sweeps, and {@link #close()} to stop them.
 */
public final class SlidingWindowRateLimiter implements RateLimiter, AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(SlidingWindowRateLimiter.class);

    private final RateLimitConfig config;
    private final IpBlockList blockList;
    private final Clock clock;
    private final ConcurrentMap<String, ClientWindow> windows = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, ViolationHistory> violations = new ConcurrentHashMap<>();
    private final Set<String> whitelist = ConcurrentHashMap.newKeySet();
    private final Set<String> blacklist = ConcurrentHashMap.newKeySet();
    private ScheduledExecutorService scheduler;

    public SlidingWindowRateLimiter(RateLimitConfig config, BlockRecordStore store) {
        this(config, store, Clock.systemUTC());
    }

    public SlidingWindowRateLimiter(RateLimitConfig config, BlockRecordStore store, Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.blockList = new IpBlockList(store, clock);
        whitelist.addAll(config.whitelist());
        blacklist.addAll(config.blacklist());
    }

    /**
     * Loads persisted blocks and schedules the expired-block and inactive-window sweeps.
     */
    public synchronized SlidingWindowRateLimiter start() {
        if (scheduler != null) return this;
        loadBlocks();
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "avalon-rest-rate-limit-sweeper");
            t.setDaemon(true);
            return t;
        });
        long blockMillis = config.blockSweepInterval().toMillis();
        long windowMillis = config.windowSweepInterval().toMillis();
        scheduler.scheduleAtFixedRate(this::sweepBlocksQuietly, blockMillis, blockMillis, TimeUnit.MILLISECONDS);
        scheduler.scheduleAtFixedRate(this::sweepWindowsQuietly, windowMillis, windowMillis, TimeUnit.MILLISECONDS);
        LOG.info("Rate limiter started: {} endpoint limits, {} whitelisted, {} blacklisted",
                config.endpointLimits().size(), whitelist.size(), blacklist.size());
        return this;
    }

    /**
     * Reloads non-expired blocks from the store and seeds the violation history from them.
     */
    public int loadBlocks() {
        int loaded = blockList.load();
        Instant now = clock.instant();
        for (BlockedIpRecord r : blockList.all()) {
            violations.computeIfAbsent(r.ip(), ip -> new ViolationHistory()).seed(r.violationCount(), now);
        }
        return loaded;
    }

    @Override
    public synchronized void close() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
        }
    }

    @Override
    public Result tryAcquire(ClientKey client, String path) {
        if (client == null || !client.hasIp()) {
            SecurityLogger.suspiciousActivity("Request without identifiable client address", "unknown", path);
            return new Result.Rejected(Reason.UNIDENTIFIED);
        }
        String ip = client.ip();
        if (blacklist.contains(ip)) {
            return new Result.Rejected(Reason.BLACKLISTED);
        }
        if (whitelist.contains(ip)) {
            return new Result.Allowed();
        }
        EndpointLimit limit = config.limitFor(path);
        Instant now = clock.instant();
        Optional<BlockedIpRecord> block = blockList.find(ip);
        if (block.isPresent()) {
            return new Result.Rejected(Reason.BLOCKED, Optional.of(roundUp(block.get().remaining(now))),
                    limit.maxRequests(), limit.window());
        }

        String key = windowKey(client, limit);
        while (true) {
            ClientWindow window = windows.computeIfAbsent(key, k -> new ClientWindow(now));
            synchronized (window) {
                if (window.evicted) continue; // removed by a sweep or a block while we waited
                window.purge(now, limit.window());
                window.lastSeen = now;
                if (window.timestamps.size() < limit.maxRequests()) {
                    window.timestamps.addLast(now);
                    return new Result.Allowed();
                }
                window.violationCount++;
                SecurityLogger.rateLimitViolation(client.identifier(), path, ip,
                        window.timestamps.size() + 1, limit.maxRequests());
                int total = violations.computeIfAbsent(ip, k -> new ViolationHistory()).increment(now);
                if (window.violationCount >= config.maxViolationsBeforeBlock()) {
                    Duration duration = config.blockDurationFor(total);
                    String reason = String.format("Rate limit exceeded %d times on %s (%d requests per %ds)",
                            window.violationCount, limit.description().isEmpty() ? path : limit.description(),
                            limit.maxRequests(), limit.window().toSeconds());
                    blockList.block(ip, duration, reason, total);
                    window.evicted = true;
                    windows.remove(key, window);
                    return new Result.Rejected(Reason.BLOCKED, Optional.of(roundUp(duration)),
                            limit.maxRequests(), limit.window());
                }
                Duration retryAfter = Duration.between(now, window.timestamps.peekFirst().plus(limit.window()));
                return new Result.Rejected(Reason.LIMIT_EXCEEDED, Optional.of(roundUp(retryAfter)),
                        limit.maxRequests(), limit.window());
            }
        }
    }

    /**
     * Current standing of {@code client} for {@code path}. Does not count as a request.
     */
    public RateLimitStatus status(ClientKey client, String path) {
        EndpointLimit limit = config.limitFor(path);
        if (client == null || !client.hasIp()) {
            return new RateLimitStatus(false, false, false, false, 0, limit.maxRequests(), 0, limit.window(),
                    null, null, null, "Client address could not be determined");
        }
        String ip = client.ip();
        if (blacklist.contains(ip)) {
            return new RateLimitStatus(false, false, true, false, 0, limit.maxRequests(), 0, limit.window(),
                    null, null, "Blacklisted", "Address is blacklisted");
        }
        if (whitelist.contains(ip)) {
            return new RateLimitStatus(true, true, false, false, 0, limit.maxRequests(), limit.maxRequests(),
                    limit.window(), null, null, null, "Address is whitelisted");
        }
        Optional<BlockedIpRecord> block = blockList.find(ip);
        if (block.isPresent()) {
            BlockedIpRecord r = block.get();
            return new RateLimitStatus(false, false, false, true, 0, limit.maxRequests(), 0, limit.window(),
                    null, r.blockedUntil(), r.reason(), "Address is temporarily blocked until " + r.blockedUntil());
        }
        Instant now = clock.instant();
        int current = 0;
        Instant reset = null;
        ClientWindow window = windows.get(windowKey(client, limit));
        if (window != null) {
            synchronized (window) {
                window.purge(now, limit.window());
                current = window.timestamps.size();
                Instant oldest = window.timestamps.peekFirst();
                reset = oldest == null ? null : oldest.plus(limit.window());
            }
        }
        int remaining = Math.max(0, limit.maxRequests() - current);
        String message = remaining > 0
                ? remaining + " requests remaining"
                : "Rate limit exceeded: " + limit.maxRequests() + " requests per " + limit.window().toSeconds() + "s";
        return new RateLimitStatus(remaining > 0, false, false, false, current, limit.maxRequests(), remaining,
                limit.window(), reset, null, null, message);
    }

    /**
     * Whitelists {@code ip} and lifts any block on it.
     */
    public void addToWhitelist(String ip) {
        whitelist.add(requireIp(ip));
        blockList.unblock(ip, "Added to whitelist");
        SecurityLogger.whitelistChanged(ip, "ADD");
    }

    public boolean removeFromWhitelist(String ip) {
        boolean removed = whitelist.remove(ip);
        if (removed) SecurityLogger.whitelistChanged(ip, "REMOVE");
        return removed;
    }

    public void addToBlacklist(String ip) {
        blacklist.add(requireIp(ip));
        SecurityLogger.blacklistChanged(ip, "ADD");
    }

    /**
     * Removes {@code ip} from the blacklist and lifts any temporary block on it.
     */
    public boolean removeFromBlacklist(String ip) {
        boolean removed = blacklist.remove(ip);
        if (removed) {
            blockList.unblock(ip, "Removed from blacklist");
            SecurityLogger.blacklistChanged(ip, "REMOVE");
        }
        return removed;
    }

    /**
     * Lifts a temporary block. The address's violation history is kept.
     */
    public boolean unblock(String ip) {
        return blockList.unblock(ip, "Manual unblock");
    }

    public boolean isWhitelisted(String ip) {
        return ip != null && whitelist.contains(ip);
    }

    public boolean isBlacklisted(String ip) {
        return ip != null && blacklist.contains(ip);
    }

    public List<BlockedIpRecord> blockedIps() {
        return blockList.all();
    }

    public RateLimitStatistics statistics() {
        List<BlockedIpRecord> blocked = blockList.all();
        return new RateLimitStatistics(windows.size(), blocked.size(), whitelist.size(), blacklist.size(),
                config.endpointLimits().size(), blocked);
    }

    /**
     * Cumulative violations remembered for {@code ip}.
     */
    public int violationCount(String ip) {
        ViolationHistory h = violations.get(ip);
        return h == null ? 0 : h.count();
    }

    public RateLimitConfig config() {
        return config;
    }

    /**
     * Drops windows idle for longer than the inactivity timeout and violation histories older
     * than the violation memory.
     *
     * @return the number of windows removed
     */
    public int sweepInactiveWindows() {
        Instant now = clock.instant();
        Instant windowCutoff = now.minus(config.inactivityTimeout());
        int removed = 0;
        for (Map.Entry<String, ClientWindow> e : new ArrayList<>(windows.entrySet())) {
            ClientWindow w = e.getValue();
            synchronized (w) {
                if (w.lastSeen.isBefore(windowCutoff) && windows.remove(e.getKey(), w)) {
                    w.evicted = true;
                    removed++;
                }
            }
        }
        Instant violationCutoff = now.minus(config.violationMemory());
        for (Map.Entry<String, ViolationHistory> e : new ArrayList<>(violations.entrySet())) {
            if (e.getValue().lastViolationBefore(violationCutoff) && !blockList.isBlocked(e.getKey())) {
                violations.remove(e.getKey(), e.getValue());
            }
        }
        if (removed > 0) LOG.debug("Evicted {} inactive rate limit windows", removed);
        return removed;
    }

    /**
     * Drops expired blocks.
     *
     * @return the number removed
     */
    public int sweepExpiredBlocks() {
        return blockList.sweepExpired();
    }

    private void sweepBlocksQuietly() {
        try {
            sweepExpiredBlocks();
        } catch (RuntimeException e) {
            LOG.error("Expired block sweep failed", e);
        }
    }

    private void sweepWindowsQuietly() {
        try {
            sweepInactiveWindows();
        } catch (RuntimeException e) {
            LOG.error("Inactive window sweep failed", e);
        }
    }

    private static String windowKey(ClientKey client, EndpointLimit limit) {
        return client.identifier() + "|" + limit.pathPrefix();
    }

    private static String requireIp(String ip) {
        if (ip == null || ip.isBlank()) throw new IllegalArgumentException("ip must not be blank");
        return ip.trim();
    }

    // whole seconds, at least one
    private static Duration roundUp(Duration d) {
        long seconds = d.getSeconds() + (d.getNano() > 0 ? 1 : 0);
        return Duration.ofSeconds(Math.max(1, seconds));
    }

    private static final class ClientWindow {
        final Deque<Instant> timestamps = new ArrayDeque<>();
        int violationCount;
        Instant lastSeen;
        boolean evicted;

        ClientWindow(Instant created) {
            this.lastSeen = created;
        }

        void purge(Instant now, Duration window) {
            Instant cutoff = now.minus(window);
            while (!timestamps.isEmpty() && !timestamps.peekFirst().isAfter(cutoff)) {
                timestamps.pollFirst();
            }
        }
    }

    private static final class ViolationHistory {
        private int count;
        private Instant lastViolation = Instant.EPOCH;

        synchronized int increment(Instant now) {
            count++;
            lastViolation = now;
            return count;
        }

        synchronized void seed(int persisted, Instant now) {
            if (persisted > count) count = persisted;
            lastViolation = now;
        }

        synchronized int count() {
            return count;
        }

        synchronized boolean lastViolationBefore(Instant cutoff) {
            return lastViolation.isBefore(cutoff);
        }
    }
}
