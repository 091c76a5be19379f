package io.avalonrest.server.core;

import io.avalonrest.core.AvalonRestException;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Parser for {@code key=value&...} text, used for query strings and urlencoded form bodies.
 *
 * <p>Keys are looked up case-insensitively; a repeated key keeps its last value.
 */
public final class QueryString {

    private QueryString() {}

    public static Map<String, String> parse(URI uri) {
        return parse(uri.getRawQuery());
    }

    /**
     * @throws AvalonRestException.BadInput if a percent escape is malformed
     */
    public static Map<String, String> parse(String raw) {
        if (raw == null || raw.isEmpty()) return Map.of();
        Map<String, String> out = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        for (String part : raw.split("&")) {
            if (part.isEmpty()) continue;
            int eq = part.indexOf('=');
            if (eq < 0) {
                out.put(decode(part), "");
            } else {
                String k = decode(part.substring(0, eq));
                String v = decode(part.substring(eq + 1));
                out.put(k, v);
            }
        }
        return Collections.unmodifiableMap(out);
    }

    private static String decode(String s) {
        try {
            return URLDecoder.decode(s, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new AvalonRestException.BadInput("Malformed percent-encoding in '" + s + "'");
        }
    }
}
