package io.avalonrest.core;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Minimal helpers for case-insensitive header lookup.
 */
public final class Headers {
    private Headers() {}

    public static Optional<String> firstValue(Map<String, ? extends Iterable<String>> headers, String name) {
        if (headers == null || name == null) return Optional.empty();
        String target = name.toLowerCase(Locale.ROOT);

        for (Map.Entry<String, ? extends Iterable<String>> e : headers.entrySet()) {
            if (e.getKey() == null) continue;
            if (e.getKey().toLowerCase(Locale.ROOT).equals(target)) {
                Iterable<String> vals = e.getValue();
                if (vals == null) return Optional.empty();
                for (String v : vals) {
                    if (v != null) return Optional.of(v);
                }
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the first non-blank value of {@code name}, trimmed.
     */
    public static Optional<String> firstNonBlank(Map<String, ? extends Iterable<String>> headers, String name) {
        return firstValue(headers, name).map(String::trim).filter(v -> !v.isEmpty());
    }

    public static boolean contains(Map<String, ? extends Iterable<String>> headers, String name) {
        if (headers == null || name == null) return false;
        for (String key : headers.keySet()) {
            if (key != null && key.equalsIgnoreCase(name)) return true;
        }
        return false;
    }

    /**
     * Returns the media type of a {@code Content-Type} value, lowercased and without parameters.
     */
    public static String mediaType(String contentType) {
        if (contentType == null) return "";
        int semi = contentType.indexOf(';');
        String base = semi >= 0 ? contentType.substring(0, semi) : contentType;
        return base.trim().toLowerCase(Locale.ROOT);
    }

    public static boolean isTrue(Optional<String> v) {
        return v.isPresent() && Protocol.BOOL_TRUE.equalsIgnoreCase(v.get().trim());
    }
}
