package io.avalonrest.server.core.security;

import io.avalonrest.core.AvalonRestException;
import io.avalonrest.core.Headers;
import io.avalonrest.core.Protocol;
import io.avalonrest.server.core.routing.AuthRequirement;
import io.avalonrest.server.spi.TokenVerifier;
import io.avalonrest.server.spi.VerifiedIdentity;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Enforces an {@link AuthRequirement} against the {@code Authorization} header.
 */
public final class RequestAuthorizer {

    private final TokenVerifier verifier;

    public RequestAuthorizer(TokenVerifier verifier) {
        this.verifier = Objects.requireNonNull(verifier, "verifier");
    }

    /**
     * @return the verified identity, or empty when the route needs none
     * @throws AvalonRestException.Unauthenticated when the scheme is unsupported or the token is missing or invalid
     * @throws AvalonRestException.Forbidden when the identity lacks every required role
     */
    public Optional<VerifiedIdentity> authorize(AuthRequirement requirement, Map<String, List<String>> headers,
                                                String clientIp, String path) {
        if (!requirement.required()) return Optional.empty();
        if (!Protocol.SCHEME_BEARER.equalsIgnoreCase(requirement.scheme())) {
            SecurityLogger.authenticationFailure("Unsupported scheme " + requirement.scheme(), clientIp, path);
            throw new AvalonRestException.Unauthenticated("Unauthorized: Unsupported authentication scheme");
        }
        String token = bearerToken(headers).orElse(null);
        if (token == null) {
            SecurityLogger.authenticationFailure("Missing bearer token", clientIp, path);
            throw new AvalonRestException.Unauthenticated("Unauthorized: Missing or invalid token");
        }
        VerifiedIdentity identity = verifier.verify(token).orElse(null);
        if (identity == null) {
            SecurityLogger.authenticationFailure("Invalid or expired token", clientIp, path);
            throw new AvalonRestException.Unauthenticated("Unauthorized: Invalid or expired token");
        }
        if (!identity.hasAnyRole(requirement.roles())) {
            SecurityLogger.authenticationFailure("Insufficient role for " + identity.name(), clientIp, path);
            throw new AvalonRestException.Forbidden("Forbidden: Insufficient role");
        }
        return Optional.of(identity);
    }

    /**
     * The token of an {@code Authorization: Bearer <token>} header, if present and non-empty.
     */
    public static Optional<String> bearerToken(Map<String, List<String>> headers) {
        Optional<String> auth = Headers.firstNonBlank(headers, Protocol.H_AUTHORIZATION);
        if (auth.isEmpty()) return Optional.empty();
        String v = auth.get().trim();
        String prefix = Protocol.SCHEME_BEARER.toLowerCase(Locale.ROOT) + " ";
        if (v.length() <= prefix.length() || !v.toLowerCase(Locale.ROOT).startsWith(prefix)) return Optional.empty();
        String token = v.substring(prefix.length()).trim();
        return token.isEmpty() ? Optional.empty() : Optional.of(token);
    }
}
