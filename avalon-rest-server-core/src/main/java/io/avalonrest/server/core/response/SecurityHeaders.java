package io.avalonrest.server.core.response;

import io.avalonrest.core.Protocol;
import io.avalonrest.server.core.ServerResponse;

import java.util.Locale;

/**
 * Hardening headers added to every response. Paths under {@code /docs} and {@code /swagger}
 * get a content security policy that lets API documentation pages load their scripts.
 */
public final class SecurityHeaders {

    public static final String STRICT_CSP = "default-src 'self'";

    public static final String DOCS_CSP = "default-src 'self'; "
            + "script-src 'self' 'unsafe-inline' 'unsafe-eval' https://unpkg.com https://cdn.jsdelivr.net; "
            + "style-src 'self' 'unsafe-inline' https://unpkg.com https://cdn.jsdelivr.net; "
            + "img-src 'self' data: https: http:; "
            + "font-src 'self' data: https://unpkg.com; "
            + "connect-src 'self' https://unpkg.com;";

    private final boolean relaxedCspForDocs;

    public SecurityHeaders(boolean relaxedCspForDocs) {
        this.relaxedCspForDocs = relaxedCspForDocs;
    }

    public static SecurityHeaders defaults() {
        return new SecurityHeaders(true);
    }

    public ServerResponse apply(ServerResponse response, String path) {
        response.headerIfAbsent(Protocol.H_CONTENT_TYPE_OPTIONS, "nosniff");
        response.headerIfAbsent(Protocol.H_FRAME_OPTIONS, "DENY");
        response.headerIfAbsent(Protocol.H_XSS_PROTECTION, "1; mode=block");
        response.headerIfAbsent(Protocol.H_STRICT_TRANSPORT_SECURITY, "max-age=31536000; includeSubDomains");
        response.headerIfAbsent(Protocol.H_REFERRER_POLICY, "no-referrer");
        response.headerIfAbsent(Protocol.H_PERMISSIONS_POLICY, "geolocation=(), microphone=()");
        response.headerIfAbsent(Protocol.H_CONTENT_SECURITY_POLICY, isDocsPath(path) ? DOCS_CSP : STRICT_CSP);
        return response;
    }

    boolean isDocsPath(String path) {
        if (!relaxedCspForDocs || path == null) return false;
        String p = path.toLowerCase(Locale.ROOT);
        return p.startsWith("/docs") || p.startsWith("/swagger");
    }
}
