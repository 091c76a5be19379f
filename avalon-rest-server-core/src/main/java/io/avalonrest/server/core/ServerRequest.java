package io.avalonrest.server.core;

import io.avalonrest.core.Headers;
import io.avalonrest.core.HttpMethod;

import java.io.InputStream;
import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Host-neutral request abstraction.
 */
public final class ServerRequest {
    private final HttpMethod method;
    private final URI uri;
    private final Map<String, List<String>> headers;
    private final InputStream body; // may be null
    private final String remoteAddress; // may be null

    public ServerRequest(HttpMethod method, URI uri, Map<String, List<String>> headers, InputStream body) {
        this(method, uri, headers, body, null);
    }

    public ServerRequest(HttpMethod method, URI uri, Map<String, List<String>> headers, InputStream body, String remoteAddress) {
        this.method = Objects.requireNonNull(method, "method");
        this.uri = Objects.requireNonNull(uri, "uri");
        this.headers = Objects.requireNonNull(headers, "headers");
        this.body = body;
        this.remoteAddress = remoteAddress;
    }

    public HttpMethod method() {
        return method;
    }

    public URI uri() {
        return uri;
    }

    /**
     * Decoded request path, {@code /} when the URI has none.
     */
    public String path() {
        String p = uri.getPath();
        return p == null || p.isEmpty() ? "/" : p;
    }

    public Map<String, List<String>> headers() {
        return headers;
    }

    public Optional<String> header(String name) {
        return Headers.firstValue(headers, name);
    }

    public InputStream body() {
        return body;
    }

    /**
     * Socket peer address as seen by the host, without port.
     */
    public String remoteAddress() {
        return remoteAddress;
    }
}
