package io.avalonrest.server.core.response;

import io.avalonrest.core.Protocol;
import io.avalonrest.server.core.ServerResponse;

/**
 * CORS headers added to every response.
 */
public final class CorsPolicy {

    private static final CorsPolicy DEFAULTS = builder().build();

    private final String allowOrigin;
    private final String allowMethods;
    private final String allowHeaders;
    private final boolean allowCredentials;

    private CorsPolicy(Builder b) {
        this.allowOrigin = b.allowOrigin != null ? b.allowOrigin : "*";
        this.allowMethods = b.allowMethods != null ? b.allowMethods : "GET, POST, PUT, DELETE, OPTIONS";
        this.allowHeaders = b.allowHeaders != null ? b.allowHeaders : "Content-Type, Authorization";
        this.allowCredentials = b.allowCredentials != null ? b.allowCredentials : true;
    }

    public static CorsPolicy defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Adds the CORS headers not already present on {@code response}.
     */
    public ServerResponse apply(ServerResponse response) {
        response.headerIfAbsent(Protocol.H_ALLOW_ORIGIN, allowOrigin);
        response.headerIfAbsent(Protocol.H_ALLOW_METHODS, allowMethods);
        response.headerIfAbsent(Protocol.H_ALLOW_HEADERS, allowHeaders);
        if (allowCredentials) response.headerIfAbsent(Protocol.H_ALLOW_CREDENTIALS, Protocol.BOOL_TRUE);
        return response;
    }

    public String allowOrigin() {
        return allowOrigin;
    }

    public String allowMethods() {
        return allowMethods;
    }

    public String allowHeaders() {
        return allowHeaders;
    }

    public boolean allowCredentials() {
        return allowCredentials;
    }

    public static final class Builder {
        private String allowOrigin;
        private String allowMethods;
        private String allowHeaders;
        private Boolean allowCredentials;

        private Builder() {
        }

        public Builder allowOrigin(String allowOrigin) {
            this.allowOrigin = allowOrigin;
            return this;
        }

        public Builder allowMethods(String allowMethods) {
            this.allowMethods = allowMethods;
            return this;
        }

        public Builder allowHeaders(String allowHeaders) {
            this.allowHeaders = allowHeaders;
            return this;
        }

        public Builder allowCredentials(boolean allowCredentials) {
            this.allowCredentials = allowCredentials;
            return this;
        }

        public CorsPolicy build() {
            return new CorsPolicy(this);
        }
    }
}
