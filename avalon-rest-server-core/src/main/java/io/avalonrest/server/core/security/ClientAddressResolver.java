package io.avalonrest.server.core.security;

import io.avalonrest.core.Headers;
import io.avalonrest.core.Protocol;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Resolves the client address of a request, honouring common proxy headers sent by trusted proxies.
 *
 * <p>Proxy headers are read only when the socket peer is one of the trusted proxy addresses;
 * any other peer is identified by its socket address. Headers are consulted in order: {@code CF-Connecting-IP}, {@code True-Client-IP},
 * {@code X-Real-IP}, {@code X-Forwarded-For} (first entry), {@code X-Client-IP}, {@code Forwarded}
 * ({@code for=}). Only syntactically valid IPv4 or IPv6 literals are accepted. Without one the
 * socket address is used, and {@value #UNKNOWN} when that is missing too.
 */
public final class ClientAddressResolver {

    public static final String UNKNOWN = "unknown";

    private static final List<String> PROXY_HEADERS = List.of(
            Protocol.H_CF_CONNECTING_IP,
            Protocol.H_TRUE_CLIENT_IP,
            Protocol.H_X_REAL_IP,
            Protocol.H_X_FORWARDED_FOR,
            Protocol.H_X_CLIENT_IP);

    private static final Pattern IPV4 = Pattern.compile(
            "((25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)\\.){3}(25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)");
    private static final Pattern IPV6_CHARS = Pattern.compile("[0-9a-fA-F:.]+(%[0-9A-Za-z]+)?");

    private ClientAddressResolver() {}

    /**
     * @param trustedProxies socket addresses whose proxy headers are believed; empty trusts none
     */
    public static String resolve(Map<String, List<String>> headers, String remoteAddress, Set<String> trustedProxies) {
        String peer = remoteAddress == null ? null : stripBrackets(remoteAddress.trim());
        String socket = peer != null && isIpLiteral(peer) ? peer : UNKNOWN;
        if (socket.equals(UNKNOWN) || !trustedProxies.contains(socket.toLowerCase(Locale.ROOT))) {
            return socket;
        }
        for (String name : PROXY_HEADERS) {
            Optional<String> v = Headers.firstNonBlank(headers, name);
            if (v.isPresent()) {
                String candidate = firstEntry(v.get());
                if (isIpLiteral(candidate)) return candidate;
            }
        }
        Optional<String> forwarded = Headers.firstNonBlank(headers, Protocol.H_FORWARDED);
        if (forwarded.isPresent()) {
            String candidate = forwardedFor(forwarded.get());
            if (candidate != null && isIpLiteral(candidate)) return candidate;
        }
        return socket;
    }

    /**
     * Normalizes a configured proxy list for {@link #resolve}: trimmed, brackets removed, lowercased.
     *
     * @throws IllegalArgumentException if an entry is not an IP literal
     */
    public static Set<String> trustedProxies(Collection<String> addresses) {
        Set<String> out = new LinkedHashSet<>();
        for (String a : addresses) {
            if (a == null || a.isBlank()) continue;
            String ip = stripBrackets(a.trim());
            if (!isIpLiteral(ip)) {
                throw new IllegalArgumentException("Trusted proxy is not an IP address: " + a);
            }
            out.add(ip.toLowerCase(Locale.ROOT));
        }
        return Set.copyOf(out);
    }

    /**
     * True for a dotted-quad IPv4 address or an IPv6 address in any standard textual form.
     */
    public static boolean isIpLiteral(String s) {
        if (s == null || s.isEmpty()) return false;
        if (IPV4.matcher(s).matches()) return true;
        if (s.indexOf(':') < 0 || !IPV6_CHARS.matcher(s).matches()) return false;
        return isIpv6(s);
    }

    private static boolean isIpv6(String s) {
        int pct = s.indexOf('%');
        String addr = pct >= 0 ? s.substring(0, pct) : s;
        int doubleColon = addr.indexOf("::");
        if (doubleColon >= 0 && addr.indexOf("::", doubleColon + 1) >= 0) return false;
        String[] groups = addr.split(":", -1);
        int words = 0;
        for (int i = 0; i < groups.length; i++) {
            String g = groups[i];
            if (g.isEmpty()) continue;
            if (i == groups.length - 1 && g.indexOf('.') >= 0) {
                if (!IPV4.matcher(g).matches()) return false;
                words += 2;
            } else if (g.length() > 4 || g.indexOf('.') >= 0) {
                return false;
            } else {
                words++;
            }
        }
        if (doubleColon >= 0) return words < 8;
        return words == 8 && !addr.startsWith(":") && !addr.endsWith(":");
    }

    private static String firstEntry(String value) {
        int comma = value.indexOf(',');
        return stripBrackets((comma >= 0 ? value.substring(0, comma) : value).trim());
    }

    private static String forwardedFor(String value) {
        String first = value.split(",", 2)[0];
        for (String pair : first.split(";")) {
            String p = pair.trim();
            if (p.toLowerCase(Locale.ROOT).startsWith("for=")) {
                String v = p.substring(4).trim();
                if (v.length() >= 2 && v.startsWith("\"") && v.endsWith("\"")) v = v.substring(1, v.length() - 1);
                if (v.startsWith("[")) {
                    int close = v.indexOf(']');
                    return close > 0 ? v.substring(1, close) : null;
                }
                int colon = v.indexOf(':');
                if (colon >= 0 && v.indexOf(':', colon + 1) < 0) v = v.substring(0, colon);
                return v;
            }
        }
        return null;
    }

    private static String stripBrackets(String s) {
        return s.length() >= 2 && s.startsWith("[") && s.endsWith("]") ? s.substring(1, s.length() - 1) : s;
    }
}
