package io.avalonrest.server.core.security;

import io.avalonrest.server.core.MutableClock;
import io.avalonrest.server.spi.BlockedIpRecord;
import io.avalonrest.server.spi.ClientKey;
import io.avalonrest.server.spi.RateLimiter;
import io.avalonrest.server.spi.RateLimiter.Result;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class SlidingWindowRateLimiterTest {

    private static final String PATH = "/api/orders";
    private static final ClientKey CLIENT = new ClientKey("203.0.113.5", "curl/8.0", null);

    private final MutableClock clock = new MutableClock();
    private final InMemoryBlockRecordStore store = new InMemoryBlockRecordStore();

    private SlidingWindowRateLimiter limiter(RateLimitConfig.Builder builder) {
        return new SlidingWindowRateLimiter(builder.build(), store, clock);
    }

    private static RateLimitConfig.Builder threePerMinute() {
        return RateLimitConfig.builder().defaultLimit(3, Duration.ofSeconds(60));
    }

    @Test
    void slidingWindowAdmitsAgainAfterOldestRequestLeaves() {
        SlidingWindowRateLimiter limiter = limiter(threePerMinute());

        for (int i = 0; i < 3; i++) {
            assertThat(limiter.tryAcquire(CLIENT, PATH)).isInstanceOf(Result.Allowed.class);
            clock.advance(Duration.ofSeconds(1));
        }
        Result fourth = limiter.tryAcquire(CLIENT, PATH);
        assertThat(fourth).isInstanceOf(Result.Rejected.class);
        Result.Rejected rejected = (Result.Rejected) fourth;
        assertThat(rejected.reason()).isEqualTo(RateLimiter.Reason.LIMIT_EXCEEDED);
        assertThat(rejected.retryAfter()).contains(Duration.ofSeconds(57));
        assertThat(rejected.limit()).isEqualTo(3);
        assertThat(rejected.window()).isEqualTo(Duration.ofSeconds(60));

        clock.advance(Duration.ofSeconds(58)); // 61s after the first request
        assertThat(limiter.tryAcquire(CLIENT, PATH)).isInstanceOf(Result.Allowed.class);
    }

    @Test
    void identitiesAreCountedSeparately() {
        SlidingWindowRateLimiter limiter = limiter(threePerMinute());
        ClientKey withToken = new ClientKey(CLIENT.ip(), CLIENT.userAgent(), "token-abcdefghijk");
        for (int i = 0; i < 3; i++) {
            limiter.tryAcquire(CLIENT, PATH);
        }
        assertThat(limiter.tryAcquire(CLIENT, PATH)).isInstanceOf(Result.Rejected.class);
        assertThat(limiter.tryAcquire(withToken, PATH)).isInstanceOf(Result.Allowed.class);
    }

    @Test
    void endpointLimitsAreIndependent() {
        SlidingWindowRateLimiter limiter = limiter(threePerMinute()
                .endpoint("/api/auth/user", 1, Duration.ofMinutes(1), "login"));
        assertThat(limiter.tryAcquire(CLIENT, "/api/auth/user")).isInstanceOf(Result.Allowed.class);
        assertThat(limiter.tryAcquire(CLIENT, "/api/auth/user")).isInstanceOf(Result.Rejected.class);
        assertThat(limiter.tryAcquire(CLIENT, PATH)).isInstanceOf(Result.Allowed.class);
    }

    @Test
    void repeatedViolationsBlockAndEscalate() {
        SlidingWindowRateLimiter limiter = limiter(threePerMinute());

        exhaustAndViolate(limiter, 3);
        List<BlockedIpRecord> blocked = limiter.blockedIps();
        assertThat(blocked).hasSize(1);
        BlockedIpRecord first = blocked.get(0);
        assertThat(first.ip()).isEqualTo(CLIENT.ip());
        assertThat(first.violationCount()).isEqualTo(3);
        assertThat(Duration.between(first.blockedAt(), first.blockedUntil())).isEqualTo(Duration.ofMinutes(15));
        assertThat(store.load()).containsExactly(first);

        Result whileBlocked = limiter.tryAcquire(CLIENT, PATH);
        assertThat(whileBlocked).isInstanceOfSatisfying(Result.Rejected.class,
                r -> assertThat(r.reason()).isEqualTo(RateLimiter.Reason.BLOCKED));

        assertThat(limiter.unblock(CLIENT.ip())).isTrue();
        assertThat(limiter.violationCount(CLIENT.ip())).isEqualTo(3);

        exhaustAndViolate(limiter, 3);
        BlockedIpRecord second = limiter.blockedIps().get(0);
        assertThat(second.violationCount()).isEqualTo(6);
        assertThat(Duration.between(second.blockedAt(), second.blockedUntil())).isEqualTo(Duration.ofHours(1));
    }

    @Test
    void blockExpires() {
        SlidingWindowRateLimiter limiter = limiter(threePerMinute());
        exhaustAndViolate(limiter, 3);
        assertThat(limiter.blockedIps()).hasSize(1);

        clock.advance(Duration.ofMinutes(15));
        assertThat(limiter.tryAcquire(CLIENT, PATH)).isInstanceOf(Result.Allowed.class);
        assertThat(limiter.blockedIps()).isEmpty();
        assertThat(store.load()).isEmpty();
    }

    @Test
    void whitelistedAddressIsNeverBlocked() {
        SlidingWindowRateLimiter limiter = limiter(threePerMinute().whitelist(CLIENT.ip()));
        for (int i = 0; i < 50; i++) {
            assertThat(limiter.tryAcquire(CLIENT, PATH)).isInstanceOf(Result.Allowed.class);
        }
        assertThat(limiter.blockedIps()).isEmpty();
        assertThat(limiter.violationCount(CLIENT.ip())).isZero();
    }

    @Test
    void whitelistingLiftsExistingBlock() {
        SlidingWindowRateLimiter limiter = limiter(threePerMinute());
        exhaustAndViolate(limiter, 3);
        limiter.addToWhitelist(CLIENT.ip());
        assertThat(limiter.blockedIps()).isEmpty();
        assertThat(limiter.tryAcquire(CLIENT, PATH)).isInstanceOf(Result.Allowed.class);
        assertThat(limiter.removeFromWhitelist(CLIENT.ip())).isTrue();
    }

    @Test
    void blacklistOverridesWhitelist() {
        SlidingWindowRateLimiter limiter = limiter(threePerMinute().whitelist(CLIENT.ip()));
        limiter.addToBlacklist(CLIENT.ip());
        assertThat(limiter.tryAcquire(CLIENT, PATH)).isInstanceOfSatisfying(Result.Rejected.class,
                r -> assertThat(r.reason()).isEqualTo(RateLimiter.Reason.BLACKLISTED));
        assertThat(limiter.removeFromBlacklist(CLIENT.ip())).isTrue();
        assertThat(limiter.tryAcquire(CLIENT, PATH)).isInstanceOf(Result.Allowed.class);
    }

    @Test
    void clientWithoutAddressIsRejected() {
        SlidingWindowRateLimiter limiter = limiter(threePerMinute());
        assertThat(limiter.tryAcquire(new ClientKey("unknown", null, null), PATH)).isInstanceOfSatisfying(Result.Rejected.class,
                r -> assertThat(r.reason()).isEqualTo(RateLimiter.Reason.UNIDENTIFIED));
    }

    @Test
    void statusDoesNotConsume() {
        SlidingWindowRateLimiter limiter = limiter(threePerMinute());
        limiter.tryAcquire(CLIENT, PATH);
        RateLimitStatus status = limiter.status(CLIENT, PATH);
        assertThat(status.allowed()).isTrue();
        assertThat(status.currentRequests()).isEqualTo(1);
        assertThat(status.remainingRequests()).isEqualTo(2);
        assertThat(status.resetTime()).isEqualTo(clock.instant().plusSeconds(60));
        assertThat(limiter.status(CLIENT, PATH).currentRequests()).isEqualTo(1);
    }

    @Test
    void sweepEvictsInactiveWindowsAndForgetsOldViolations() {
        SlidingWindowRateLimiter limiter = limiter(threePerMinute().maxViolationsBeforeBlock(10));
        exhaustAndViolate(limiter, 1);
        assertThat(limiter.statistics().activeClients()).isEqualTo(1);
        assertThat(limiter.violationCount(CLIENT.ip())).isEqualTo(1);

        clock.advance(Duration.ofHours(2));
        assertThat(limiter.sweepInactiveWindows()).isEqualTo(1);
        assertThat(limiter.statistics().activeClients()).isZero();
        assertThat(limiter.violationCount(CLIENT.ip())).isEqualTo(1);

        clock.advance(Duration.ofHours(23));
        limiter.sweepInactiveWindows();
        assertThat(limiter.violationCount(CLIENT.ip())).isZero();
    }

    @Test
    void concurrentSweepsNeverLoseCountedRequests() throws Exception {
        SlidingWindowRateLimiter limiter = limiter(RateLimitConfig.builder()
                .defaultLimit(50, Duration.ofHours(1))
                .inactivityTimeout(Duration.ofMinutes(1))
                .maxViolationsBeforeBlock(10_000));
        AtomicInteger allowed = new AtomicInteger();
        AtomicBoolean running = new AtomicBoolean(true);
        ExecutorService pool = Executors.newFixedThreadPool(9);
        try {
            Future<?> sweeper = pool.submit(() -> {
                while (running.get()) limiter.sweepInactiveWindows();
            });
            List<Future<?>> clients = new ArrayList<>();
            for (int t = 0; t < 8; t++) {
                clients.add(pool.submit(() -> {
                    for (int i = 0; i < 25; i++) {
                        if (limiter.tryAcquire(CLIENT, PATH) instanceof Result.Allowed) allowed.incrementAndGet();
                    }
                }));
            }
            for (Future<?> f : clients) f.get(10, TimeUnit.SECONDS);
            running.set(false);
            sweeper.get(10, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        assertThat(allowed.get()).isEqualTo(50);
        assertThat(limiter.status(CLIENT, PATH).currentRequests()).isEqualTo(50);
    }

    @Test
    void freshWindowSurvivesImmediateSweep() {
        SlidingWindowRateLimiter limiter = limiter(threePerMinute());
        limiter.tryAcquire(CLIENT, PATH);

        assertThat(limiter.sweepInactiveWindows()).isZero();
        assertThat(limiter.statistics().activeClients()).isEqualTo(1);
    }

    @Test
    void persistedBlocksAreReloadedAndSeedViolations() {
        Instant now = clock.instant();
        InMemoryBlockRecordStore persisted = new InMemoryBlockRecordStore(List.of(
                new BlockedIpRecord("198.51.100.1", now.minusSeconds(60), now.plusSeconds(600), "earlier", 7),
                new BlockedIpRecord("198.51.100.2", now.minusSeconds(600), now.minusSeconds(1), "expired", 2)));
        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(RateLimitConfig.builder().build(), persisted, clock);

        assertThat(limiter.loadBlocks()).isEqualTo(1);
        assertThat(limiter.violationCount("198.51.100.1")).isEqualTo(7);
        assertThat(limiter.tryAcquire(new ClientKey("198.51.100.2", null, null), PATH)).isInstanceOf(Result.Allowed.class);
        assertThat(limiter.tryAcquire(new ClientKey("198.51.100.1", null, null), PATH)).isInstanceOf(Result.Rejected.class);
        assertThat(limiter.statistics().blockedIps()).isEqualTo(1);
    }

    private void exhaustAndViolate(SlidingWindowRateLimiter limiter, int violations) {
        for (int i = 0; i < 3; i++) {
            assertThat(limiter.tryAcquire(CLIENT, PATH)).isInstanceOf(Result.Allowed.class);
        }
        for (int i = 0; i < violations; i++) {
            assertThat(limiter.tryAcquire(CLIENT, PATH)).isInstanceOf(Result.Rejected.class);
        }
    }
}
