package io.avalonrest.server.core.routing;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Path normalization shared by prefixes, templates and request paths.
 */
public final class RoutePaths {

    private RoutePaths() {}

    /**
     * Splits a path into lowercase segments, ignoring leading, trailing and repeated slashes.
     */
    public static List<String> segments(String path) {
        List<String> out = new ArrayList<>();
        if (path == null) return out;
        for (String s : path.split("/")) {
            if (!s.isEmpty()) out.add(s.toLowerCase(Locale.ROOT));
        }
        return out;
    }

    /**
     * Lowercase path without leading or trailing slashes.
     */
    public static String normalize(String path) {
        return String.join("/", segments(path));
    }
}
