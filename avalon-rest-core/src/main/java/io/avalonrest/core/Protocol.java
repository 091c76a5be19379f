package io.avalonrest.core;

/**
 * Wire constants (header names, content types and well-known values).
 *
 * <p>This module contains no HTTP server bindings. It only models concerns shared by the
 * dispatcher, the parameter binder and the hosts that put them on a socket.
 */
public final class Protocol {
    private Protocol() {}

    // Request headers
    public static final String H_AUTHORIZATION = "Authorization";
    public static final String H_CONTENT_TYPE = "Content-Type";
    public static final String H_CONTENT_LENGTH = "Content-Length";
    public static final String H_USER_AGENT = "User-Agent";

    // Proxy headers carrying the real client address, in trust order
    public static final String H_CF_CONNECTING_IP = "CF-Connecting-IP";
    public static final String H_TRUE_CLIENT_IP = "True-Client-IP";
    public static final String H_X_REAL_IP = "X-Real-IP";
    public static final String H_X_FORWARDED_FOR = "X-Forwarded-For";
    public static final String H_X_CLIENT_IP = "X-Client-IP";
    public static final String H_FORWARDED = "Forwarded";

    // Response headers
    public static final String H_RETRY_AFTER = "Retry-After";
    public static final String H_CONTENT_DISPOSITION = "Content-Disposition";
    public static final String H_CACHE_CONTROL = "Cache-Control";

    // CORS
    public static final String H_ALLOW_ORIGIN = "Access-Control-Allow-Origin";
    public static final String H_ALLOW_METHODS = "Access-Control-Allow-Methods";
    public static final String H_ALLOW_HEADERS = "Access-Control-Allow-Headers";
    public static final String H_ALLOW_CREDENTIALS = "Access-Control-Allow-Credentials";

    // Security
    public static final String H_CONTENT_TYPE_OPTIONS = "X-Content-Type-Options";
    public static final String H_FRAME_OPTIONS = "X-Frame-Options";
    public static final String H_XSS_PROTECTION = "X-XSS-Protection";
    public static final String H_STRICT_TRANSPORT_SECURITY = "Strict-Transport-Security";
    public static final String H_REFERRER_POLICY = "Referrer-Policy";
    public static final String H_PERMISSIONS_POLICY = "Permissions-Policy";
    public static final String H_CONTENT_SECURITY_POLICY = "Content-Security-Policy";

    // Content types
    public static final String CT_JSON = "application/json";
    public static final String CT_FORM_URLENCODED = "application/x-www-form-urlencoded";
    public static final String CT_MULTIPART_FORM_DATA = "multipart/form-data";
    public static final String CT_TEXT_PLAIN = "text/plain";
    public static final String CT_OCTET_STREAM = "application/octet-stream";

    /** Authentication scheme accepted in the {@code Authorization} header. */
    public static final String SCHEME_BEARER = "Bearer";

    /** Canonical boolean textual value for true. */
    public static final String BOOL_TRUE = "true";
}
