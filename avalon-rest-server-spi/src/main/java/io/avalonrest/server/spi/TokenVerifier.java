package io.avalonrest.server.spi;

import java.util.Optional;

/**
 * Verifies bearer tokens. Issuing tokens is outside this library.
 */
@FunctionalInterface
public interface TokenVerifier {

    /**
     * @param token the raw token taken from {@code Authorization: Bearer <token>}
     * @return the verified identity, or empty when the token is invalid or expired
     */
    Optional<VerifiedIdentity> verify(String token);

    /**
     * Verifier that rejects every token; routes requiring authorization always answer 401.
     */
    static TokenVerifier rejectAll() {
        return token -> Optional.empty();
    }
}
