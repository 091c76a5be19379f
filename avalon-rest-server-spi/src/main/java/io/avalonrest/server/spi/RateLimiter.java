package io.avalonrest.server.spi;

import java.time.Duration;
import java.util.Optional;

/**
 * Rate limiting SPI.
 *
 * <p>Implementations decide whether a request from a client may proceed. When a request is
 * rejected the dispatcher answers 429 Too Many Requests, with a {@code Retry-After} header when
 * the result carries one.
 */
public interface RateLimiter {

    /**
     * Check if a request should be allowed.
     *
     * @param client the client identity
     * @param path the request path (without query string)
     * @return result indicating whether the request is allowed
     */
    Result tryAcquire(ClientKey client, String path);

    /**
     * Why a request was rejected.
     */
    enum Reason {
        /** The client address is permanently excluded. */
        BLACKLISTED,
        /** The client address is temporarily blocked after repeated violations. */
        BLOCKED,
        /** The trailing window for the matched endpoint is full. */
        LIMIT_EXCEEDED,
        /** No client address could be resolved. */
        UNIDENTIFIED
    }

    /**
     * Result of a rate limit check.
     */
    sealed interface Result permits Result.Allowed, Result.Rejected {

        /**
         * Request is allowed to proceed.
         */
        record Allowed() implements Result {}

        /**
         * Request is rejected.
         *
         * @param reason the rejection reason
         * @param retryAfter optional duration after which the client may retry
         * @param limit the request budget of the matched endpoint, 0 if not applicable
         * @param window the window of the matched endpoint, {@link Duration#ZERO} if not applicable
         */
        record Rejected(Reason reason, Optional<Duration> retryAfter, int limit, Duration window) implements Result {
            public Rejected {
                java.util.Objects.requireNonNull(reason, "reason");
                retryAfter = retryAfter == null ? Optional.empty() : retryAfter;
                window = window == null ? Duration.ZERO : window;
            }

            public Rejected(Reason reason) {
                this(reason, Optional.empty(), 0, Duration.ZERO);
            }

            public Rejected(Reason reason, Duration retryAfter) {
                this(reason, Optional.ofNullable(retryAfter), 0, Duration.ZERO);
            }
        }
    }

    /**
     * No-op rate limiter that allows all requests.
     */
    static RateLimiter permitAll() {
        return (client, path) -> new Result.Allowed();
    }
}
