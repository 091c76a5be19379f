package io.avalonrest.server.spi;

import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Identity established from a verified credential.
 *
 * @param name subject name
 * @param roles roles held by the subject (compared case-sensitively)
 * @param claims additional claims, may be empty
 */
public record VerifiedIdentity(String name, Set<String> roles, Map<String, String> claims) {

    public VerifiedIdentity {
        Objects.requireNonNull(name, "name");
        roles = roles == null ? Set.of() : Set.copyOf(roles);
        claims = claims == null ? Map.of() : Map.copyOf(claims);
    }

    public VerifiedIdentity(String name, Set<String> roles) {
        this(name, roles, Map.of());
    }

    public boolean hasRole(String role) {
        return roles.contains(role);
    }

    /**
     * True if {@code required} is empty or at least one of its roles is held.
     */
    public boolean hasAnyRole(Collection<String> required) {
        if (required == null || required.isEmpty()) return true;
        for (String r : required) {
            if (roles.contains(r)) return true;
        }
        return false;
    }
}
