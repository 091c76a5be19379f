package io.avalonrest.httpserver;

import io.avalonrest.server.core.RequestDispatcher;
import io.avalonrest.server.core.response.CorsPolicy;
import io.avalonrest.server.core.security.RateLimitConfig;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;

/**
 * Server settings read from {@code avalon-rest.properties}.
 *
 * <p>Durations accept ISO-8601 ({@code PT15M}) or a number with a {@code ms}, {@code s},
 * {@code m}, {@code h} or {@code d} suffix. Rate limit endpoints are declared as
 * {@code rate-limit.endpoint.<n>.path}, {@code .max-requests}, {@code .window} and
 * {@code .description}; when none are declared the stock endpoint table applies.
 */
public final class ServerSettings {

    public static final String RESOURCE = "avalon-rest.properties";

    private final Properties props;

    private ServerSettings(Properties props) {
        this.props = props;
    }

    public static ServerSettings load(Properties props) {
        Objects.requireNonNull(props, "props");
        Properties copy = new Properties();
        copy.putAll(props);
        return new ServerSettings(copy);
    }

    /**
     * Loads {@link #RESOURCE} from the classpath. A missing resource yields all defaults.
     */
    public static ServerSettings fromClasspath() {
        return fromClasspath(RESOURCE);
    }

    public static ServerSettings fromClasspath(String resource) {
        Properties props = new Properties();
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        if (cl == null) cl = ServerSettings.class.getClassLoader();
        try (InputStream in = cl.getResourceAsStream(resource)) {
            if (in != null) props.load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + resource, e);
        }
        return new ServerSettings(props);
    }

    public int port() {
        return intValue("server.port", AvalonRestServer.DEFAULT_PORT);
    }

    public String host() {
        return string("server.host", null);
    }

    /**
     * Reverse proxies whose client-address headers are believed ({@code server.trusted-proxies},
     * comma-separated). Empty by default.
     */
    public String[] trustedProxies() {
        return list("server.trusted-proxies");
    }

    public long maxBodySize() {
        int mb = intValue("server.max-body-size-mb", -1);
        return mb > 0 ? mb * 1024L * 1024L : RequestDispatcher.DEFAULT_MAX_BODY_SIZE;
    }

    public boolean relaxedCspForDocs() {
        return Boolean.parseBoolean(string("security.relaxed-csp-for-docs", "true"));
    }

    public Path blockListFile() {
        return Path.of(string("block-list.file", "logs/blocked-ips.json"));
    }

    public CorsPolicy corsPolicy() {
        CorsPolicy defaults = CorsPolicy.defaults();
        return CorsPolicy.builder()
                .allowOrigin(string("cors.allow-origin", defaults.allowOrigin()))
                .allowMethods(string("cors.allow-methods", defaults.allowMethods()))
                .allowHeaders(string("cors.allow-headers", defaults.allowHeaders()))
                .allowCredentials(Boolean.parseBoolean(string("cors.allow-credentials", String.valueOf(defaults.allowCredentials()))))
                .build();
    }

    public RateLimitConfig rateLimitConfig() {
        RateLimitConfig d = RateLimitConfig.defaults();
        RateLimitConfig.Builder b = RateLimitConfig.builder()
                .defaultLimit(intValue("rate-limit.default.max-requests", d.defaultMaxRequests()),
                        duration("rate-limit.default.window", d.defaultWindow()))
                .blockDuration(duration("rate-limit.block-duration", d.blockDuration()))
                .maxViolationsBeforeBlock(intValue("rate-limit.max-violations-before-block", d.maxViolationsBeforeBlock()))
                .maxBlockDuration(duration("rate-limit.max-block-duration", d.maxBlockDuration()))
                .inactivityTimeout(duration("rate-limit.inactivity-timeout", d.inactivityTimeout()))
                .violationMemory(duration("rate-limit.violation-memory", d.violationMemory()))
                .windowSweepInterval(duration("rate-limit.window-sweep-interval", d.windowSweepInterval()))
                .blockSweepInterval(duration("rate-limit.block-sweep-interval", d.blockSweepInterval()))
                .whitelist(list("rate-limit.whitelist"))
                .blacklist(list("rate-limit.blacklist"));

        boolean any = false;
        for (int i = 0; ; i++) {
            String prefix = "rate-limit.endpoint." + i + ".";
            String path = string(prefix + "path", null);
            if (path == null) break;
            any = true;
            b.endpoint(path,
                    intValue(prefix + "max-requests", d.defaultMaxRequests()),
                    duration(prefix + "window", d.defaultWindow()),
                    string(prefix + "description", path));
        }
        if (!any) {
            RateLimitConfig.defaultEndpoints(b);
        }
        return b.build();
    }

    private String string(String key, String fallback) {
        String v = props.getProperty(key);
        return v == null || v.isBlank() ? fallback : v.trim();
    }

    private int intValue(String key, int fallback) {
        String v = string(key, null);
        if (v == null) return fallback;
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + v, e);
        }
    }

    private String[] list(String key) {
        String v = string(key, null);
        if (v == null) return new String[0];
        return Arrays.stream(v.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toArray(String[]::new);
    }

    private Duration duration(String key, Duration fallback) {
        String v = string(key, null);
        if (v == null) return fallback;
        try {
            return parseDuration(v);
        } catch (IllegalArgumentException | DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid duration for " + key + ": " + v, e);
        }
    }

    static Duration parseDuration(String value) {
        String v = value.trim().toLowerCase(Locale.ROOT);
        if (v.startsWith("p")) {
            return Duration.parse(v.toUpperCase(Locale.ROOT));
        }
        int i = 0;
        while (i < v.length() && Character.isDigit(v.charAt(i))) i++;
        if (i == 0) throw new IllegalArgumentException("missing amount");
        long amount = Long.parseLong(v.substring(0, i));
        String unit = v.substring(i).trim();
        switch (unit) {
            case "ms":
                return Duration.ofMillis(amount);
            case "":
            case "s":
                return Duration.ofSeconds(amount);
            case "m":
                return Duration.ofMinutes(amount);
            case "h":
                return Duration.ofHours(amount);
            case "d":
                return Duration.ofDays(amount);
            default:
                throw new IllegalArgumentException("unknown unit: " + unit);
        }
    }
}
