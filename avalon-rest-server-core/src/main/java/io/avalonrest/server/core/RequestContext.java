package io.avalonrest.server.core;

import io.avalonrest.core.HttpMethod;
import io.avalonrest.server.spi.VerifiedIdentity;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Request-scoped state shared by the dispatcher, the parameter resolver and the handler.
 *
 * <p>Instances are confined to the task serving one request.
 */
public final class RequestContext {
    private final ServerRequest request;
    private final String clientIp;
    private final Map<String, String> query;
    private final Map<String, List<String>> responseHeaders = new LinkedHashMap<>();
    private final Map<String, Object> attributes = new HashMap<>();
    private Map<String, String> routeParams = Map.of();
    private VerifiedIdentity identity;

    public RequestContext(ServerRequest request, String clientIp) {
        this.request = Objects.requireNonNull(request, "request");
        this.clientIp = clientIp;
        this.query = QueryString.parse(request.uri());
    }

    public ServerRequest request() {
        return request;
    }

    public HttpMethod method() {
        return request.method();
    }

    public String path() {
        return request.path();
    }

    public Optional<String> header(String name) {
        return request.header(name);
    }

    /**
     * Query parameters, keyed case-insensitively.
     */
    public Map<String, String> query() {
        return query;
    }

    public Optional<String> queryParam(String name) {
        return Optional.ofNullable(query.get(name));
    }

    /**
     * Client address after proxy-header resolution; {@code unknown} when none could be determined.
     */
    public String clientIp() {
        return clientIp;
    }

    /**
     * Values captured by the matched path template, keyed case-insensitively.
     */
    public Map<String, String> routeParams() {
        return routeParams;
    }

    void routeParams(Map<String, String> params) {
        Map<String, String> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        copy.putAll(params);
        this.routeParams = Collections.unmodifiableMap(copy);
    }

    public Optional<VerifiedIdentity> identity() {
        return Optional.ofNullable(identity);
    }

    public boolean isAuthenticated() {
        return identity != null;
    }

    void identity(VerifiedIdentity identity) {
        this.identity = identity;
    }

    /**
     * Adds a header to the eventual response. Headers set here take precedence over the
     * default security headers of the same name.
     */
    public RequestContext responseHeader(String name, String value) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
        responseHeaders.computeIfAbsent(name, k -> new ArrayList<>()).add(value);
        return this;
    }

    public Map<String, List<String>> responseHeaders() {
        return responseHeaders;
    }

    @SuppressWarnings("unchecked")
    public <T> Optional<T> attribute(String name) {
        return Optional.ofNullable((T) attributes.get(name));
    }

    public RequestContext attribute(String name, Object value) {
        if (value == null) {
            attributes.remove(name);
        } else {
            attributes.put(name, value);
        }
        return this;
    }
}
