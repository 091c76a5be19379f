package io.avalonrest.example;

import io.avalonrest.server.spi.TokenVerifier;
import io.avalonrest.server.spi.VerifiedIdentity;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Fixed token table for the sample application.
 *
 * <p>Entries are read from properties of the form {@code auth.token.<token>=<name>:<Role>,<Role>}.
 */
final class StaticTokenVerifier implements TokenVerifier {

    static final String PREFIX = "auth.token.";

    private final Map<String, VerifiedIdentity> tokens;

    StaticTokenVerifier(Map<String, VerifiedIdentity> tokens) {
        this.tokens = Map.copyOf(tokens);
    }

    static StaticTokenVerifier fromProperties(Properties props) {
        Map<String, VerifiedIdentity> tokens = new LinkedHashMap<>();
        for (String key : props.stringPropertyNames()) {
            if (!key.startsWith(PREFIX)) continue;
            String token = key.substring(PREFIX.length());
            String value = props.getProperty(key).trim();
            int colon = value.indexOf(':');
            String name = colon < 0 ? value : value.substring(0, colon).trim();
            Set<String> roles = colon < 0 ? Set.of() : Arrays.stream(value.substring(colon + 1).split(","))
                    .map(String::trim)
                    .filter(r -> !r.isEmpty())
                    .collect(Collectors.toCollection(LinkedHashSet::new));
            tokens.put(token, new VerifiedIdentity(name, roles));
        }
        return new StaticTokenVerifier(tokens);
    }

    @Override
    public Optional<VerifiedIdentity> verify(String token) {
        return Optional.ofNullable(tokens.get(token));
    }

    int size() {
        return tokens.size();
    }
}
