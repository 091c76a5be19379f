package io.avalonrest.server.core.routing;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A handler method's path pattern: literal segments and {@code {name}} placeholders.
 *
 * <p>A template only matches sub-paths with exactly as many segments as it has.
 */
public final class RouteTemplate {

    private final String text;
    private final List<Segment> segments;
    private final int literalCount;

    private RouteTemplate(String text, List<Segment> segments) {
        this.text = text;
        this.segments = segments;
        int literals = 0;
        for (Segment s : segments) {
            if (!s.placeholder()) literals++;
        }
        this.literalCount = literals;
    }

    public static RouteTemplate parse(String path) {
        List<Segment> segments = new ArrayList<>();
        if (path != null) {
            for (String raw : path.split("/")) {
                if (raw.isEmpty()) continue;
                if (raw.length() > 2 && raw.startsWith("{") && raw.endsWith("}")) {
                    segments.add(new Segment(raw.substring(1, raw.length() - 1), true));
                } else {
                    segments.add(new Segment(raw, false));
                }
            }
        }
        StringBuilder text = new StringBuilder();
        for (Segment s : segments) {
            text.append('/').append(s.placeholder() ? "{" + s.text() + "}" : s.text());
        }
        return new RouteTemplate(text.length() == 0 ? "/" : text.toString(), List.copyOf(segments));
    }

    /**
     * Matches request segments positionally.
     *
     * @return captured placeholder values by name, or empty if the template does not match
     */
    public Optional<Map<String, String>> match(List<String> requestSegments) {
        if (requestSegments.size() != segments.size()) return Optional.empty();
        Map<String, String> captures = new LinkedHashMap<>();
        for (int i = 0; i < segments.size(); i++) {
            Segment s = segments.get(i);
            String actual = requestSegments.get(i);
            if (s.placeholder()) {
                captures.put(s.text(), actual);
            } else if (!s.text().equalsIgnoreCase(actual)) {
                return Optional.empty();
            }
        }
        return Optional.of(Collections.unmodifiableMap(captures));
    }

    public int size() {
        return segments.size();
    }

    public int literalCount() {
        return literalCount;
    }

    public List<Segment> segments() {
        return segments;
    }

    @Override
    public String toString() {
        return text;
    }

    /**
     * @param text literal text, or the placeholder name
     */
    public record Segment(String text, boolean placeholder) {}
}
