package io.avalonrest.server.core;

import io.avalonrest.core.AvalonRestException;
import io.avalonrest.core.HttpMethod;
import io.avalonrest.core.Protocol;
import io.avalonrest.json.spi.JsonCodec;
import io.avalonrest.json.spi.JsonCodecs;
import io.avalonrest.server.core.binding.ParameterResolver;
import io.avalonrest.server.core.binding.RequestSnapshot;
import io.avalonrest.server.core.response.CorsPolicy;
import io.avalonrest.server.core.response.ResponseWriter;
import io.avalonrest.server.core.response.SecurityHeaders;
import io.avalonrest.server.core.routing.ControllerMatch;
import io.avalonrest.server.core.routing.HandlerMethod;
import io.avalonrest.server.core.routing.RouteMatch;
import io.avalonrest.server.core.routing.RouteRegistry;
import io.avalonrest.server.core.security.ClientAddressResolver;
import io.avalonrest.server.core.security.RequestAuthorizer;
import io.avalonrest.server.spi.BodySizeLimiter;
import io.avalonrest.server.spi.ClientKey;
import io.avalonrest.server.spi.RateLimiter;
import io.avalonrest.server.spi.TokenVerifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.reflect.InvocationTargetException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;

/**
 * Host-neutral request pipeline: rate limit, size check, CORS preflight, routing,
 * authorization, parameter binding, handler invocation and response writing.
 *
 * <p>Use {@link #builder(RouteRegistry)} to create instances:
 * <pre>{@code
 * RequestDispatcher dispatcher = RequestDispatcher.builder(routes)
 *     .rateLimiter(new SlidingWindowRateLimiter(RateLimitConfig.defaults(), store).start())
 *     .tokenVerifier(verifier)
 *     .maxBodySizeMb(10)
 *     .build();
 * }</pre>
 *
 * <p>Instances are thread-safe; each call to {@link #handle} is confined to its calling thread.
 */
public final class RequestDispatcher {

    private static final Logger LOG = LoggerFactory.getLogger(RequestDispatcher.class);
    private static final Logger ACCESS = LoggerFactory.getLogger("io.avalonrest.access");

    /** Default request body limit: 10 MB. */
    public static final long DEFAULT_MAX_BODY_SIZE = 10L * 1024 * 1024;

    private static final double MB = 1024.0 * 1024.0;

    private final RouteRegistry routes;
    private final RateLimiter rateLimiter;
    private final RequestAuthorizer authorizer;
    private final ParameterResolver resolver;
    private final ResponseWriter writer;
    private final long maxBodySize;
    private final Set<String> trustedProxies;

    public static Builder builder(RouteRegistry routes) {
        return new Builder(routes);
    }

    private RequestDispatcher(Builder b) {
        this.routes = Objects.requireNonNull(b.routes, "routes");
        JsonCodec codec = b.codec != null ? b.codec : JsonCodecs.load();
        this.rateLimiter = b.rateLimiter != null ? b.rateLimiter : RateLimiter.permitAll();
        this.authorizer = new RequestAuthorizer(b.tokenVerifier != null ? b.tokenVerifier : TokenVerifier.rejectAll());
        this.resolver = new ParameterResolver(codec);
        this.writer = new ResponseWriter(codec,
                b.cors != null ? b.cors : CorsPolicy.defaults(),
                new SecurityHeaders(b.relaxedCspForDocs == null || b.relaxedCspForDocs));
        this.maxBodySize = b.maxBodySize > 0 ? b.maxBodySize : DEFAULT_MAX_BODY_SIZE;
        this.trustedProxies = ClientAddressResolver.trustedProxies(b.trustedProxies);
    }

    public RouteRegistry routes() {
        return routes;
    }

    public long maxBodySize() {
        return maxBodySize;
    }

    /**
     * Handles one request. Never throws; every failure becomes an error response.
     */
    public ServerResponse handle(ServerRequest req) {
        long start = System.nanoTime();
        String path = req.path();
        String clientIp = ClientAddressResolver.resolve(req.headers(), req.remoteAddress(), trustedProxies);
        ServerResponse resp;
        try {
            resp = dispatch(req, path, clientIp);
        } catch (AvalonRestException.PayloadTooLarge e) {
            resp = payloadTooLarge(e.maxBytes(), e.receivedBytes(), path);
        } catch (AvalonRestException e) {
            resp = writer.error(e.status(), e.getMessage(), path);
        } catch (Exception e) {
            LOG.error("Unhandled error serving {} {}", req.method(), path, e);
            resp = writer.error(500, "Internal server error", path);
        }
        if (ACCESS.isInfoEnabled()) {
            ACCESS.info("{} {} {} {}ms {}", req.method(), path, resp.status(),
                    (System.nanoTime() - start) / 1_000_000, clientIp);
        }
        return resp;
    }

    private ServerResponse dispatch(ServerRequest req, String path, String clientIp) throws Exception {
        ClientKey key = new ClientKey(clientIp,
                req.header(Protocol.H_USER_AGENT).orElse(null),
                RequestAuthorizer.bearerToken(req.headers()).orElse(null));
        RateLimiter.Result limit = rateLimiter.tryAcquire(key, path);
        if (limit instanceof RateLimiter.Result.Rejected rejected) {
            return tooManyRequests(rejected, path);
        }

        Optional<String> declared = req.header(Protocol.H_CONTENT_LENGTH);
        if (declared.isPresent()) {
            long length = parseLength(declared.get());
            if (length > maxBodySize) return payloadTooLarge(maxBodySize, length, path);
        }

        if (req.method() == HttpMethod.OPTIONS) {
            return writer.preflight(path);
        }

        RequestContext ctx = new RequestContext(req, clientIp);
        Optional<ControllerMatch> controller = routes.findController(path);
        if (controller.isEmpty()) {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("error", "Controller not found");
            body.put("requestedPath", path);
            body.put("availableRoutes", routes.routes());
            return writer.write(new ActionResult.Value(404, body), Map.of(), path);
        }
        ControllerMatch cm = controller.get();
        Optional<RouteMatch> route = cm.entry().findMethod(req.method(), cm.subPath());
        if (route.isEmpty()) {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("error", "Route not found");
            body.put("subPath", cm.subPath());
            body.put("method", req.method().name());
            return writer.write(new ActionResult.Value(404, body), Map.of(), path);
        }
        RouteMatch match = route.get();
        HandlerMethod handler = match.handler();

        authorizer.authorize(handler.auth(), req.headers(), clientIp, path).ifPresent(ctx::identity);
        ctx.routeParams(match.routeParams());

        byte[] body = readBody(req);
        RequestSnapshot snapshot = resolver.snapshot(body, req.header(Protocol.H_CONTENT_TYPE).orElse(null),
                handler.parameters());
        Object[] args = resolver.resolve(handler.parameters(), ctx, snapshot);

        Object instance = match.entry().factory().get();
        if (instance instanceof ControllerBase base) {
            base.bind(ctx);
        }
        Object returned = invoke(handler, instance, args);
        return writer.write(ActionResult.of(returned), ctx.responseHeaders(), path);
    }

    private byte[] readBody(ServerRequest req) {
        if (req.body() == null) return new byte[0];
        try {
            return BodySizeLimiter.readAll(req.body(), maxBodySize);
        } catch (BodySizeLimiter.PayloadTooLargeException e) {
            throw new AvalonRestException.PayloadTooLarge(e.maxBytes(), e.bytesRead());
        } catch (IOException e) {
            throw new AvalonRestException.BadInput("Failed to read request body", e);
        }
    }

    private static Object invoke(HandlerMethod handler, Object instance, Object[] args) throws Exception {
        Object returned;
        try {
            returned = handler.method().invoke(instance, args);
        } catch (InvocationTargetException e) {
            throw unwrap(e.getCause());
        }
        if (returned instanceof CompletionStage<?> stage) {
            try {
                returned = stage.toCompletableFuture().get();
            } catch (ExecutionException e) {
                throw unwrap(e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw e;
            }
        }
        return returned;
    }

    private static Exception unwrap(Throwable t) {
        while ((t instanceof CompletionException || t instanceof ExecutionException
                || t instanceof InvocationTargetException) && t.getCause() != null) {
            t = t.getCause();
        }
        if (t instanceof Exception e) return e;
        if (t instanceof Error err) throw err;
        return new RuntimeException(t);
    }

    private ServerResponse tooManyRequests(RateLimiter.Result.Rejected rejected, String path) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", "Too many requests");
        body.put("message", switch (rejected.reason()) {
            case BLACKLISTED -> "Access denied";
            case BLOCKED -> "Your address is temporarily blocked due to repeated rate limit violations";
            case UNIDENTIFIED -> "Client address could not be determined";
            case LIMIT_EXCEEDED -> "Rate limit exceeded. Please try again later.";
        });
        long retryAfter = rejected.retryAfter().map(d -> Math.max(1, d.getSeconds())).orElse(0L);
        body.put("retryAfter", retryAfter);
        body.put("limit", rejected.limit());
        body.put("window", rejected.window().getSeconds());
        ServerResponse resp = writer.write(new ActionResult.Value(429, body), Map.of(), path);
        if (retryAfter > 0) resp.header(Protocol.H_RETRY_AFTER, Long.toString(retryAfter));
        return resp;
    }

    private ServerResponse payloadTooLarge(long maxBytes, long receivedBytes, String path) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", "Request entity too large");
        body.put("maxAllowedSizeMB", megabytes(maxBytes));
        body.put("receivedSizeMB", receivedBytes < 0 ? null : megabytes(receivedBytes));
        body.put("suggestion", "Split your request into smaller chunks or contact support");
        return writer.write(new ActionResult.Value(413, body), Map.of(), path);
    }

    private static double megabytes(long bytes) {
        return Math.round(bytes / MB * 100.0) / 100.0;
    }

    private static long parseLength(String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new AvalonRestException.BadInput("Invalid Content-Length: " + value);
        }
    }

    /**
     * Builder for {@link RequestDispatcher}.
     */
    public static final class Builder {
        private final RouteRegistry routes;
        private JsonCodec codec;
        private RateLimiter rateLimiter;
        private TokenVerifier tokenVerifier;
        private CorsPolicy cors;
        private Boolean relaxedCspForDocs;
        private long maxBodySize;
        private final List<String> trustedProxies = new ArrayList<>();

        private Builder(RouteRegistry routes) {
            this.routes = Objects.requireNonNull(routes, "routes");
        }

        /** JSON codec. Default: the highest-priority provider found by {@link JsonCodecs#load()}. */
        public Builder codec(JsonCodec codec) {
            this.codec = codec;
            return this;
        }

        /** Rate limiter. Default: {@link RateLimiter#permitAll()}. */
        public Builder rateLimiter(RateLimiter rateLimiter) {
            this.rateLimiter = rateLimiter;
            return this;
        }

        /** Bearer token verifier. Default: {@link TokenVerifier#rejectAll()}. */
        public Builder tokenVerifier(TokenVerifier tokenVerifier) {
            this.tokenVerifier = tokenVerifier;
            return this;
        }

        /** CORS headers. Default: {@link CorsPolicy#defaults()}. */
        public Builder cors(CorsPolicy cors) {
            this.cors = cors;
            return this;
        }

        /** Whether {@code /docs} and {@code /swagger} paths get a relaxed CSP. Default: true. */
        public Builder relaxedCspForDocs(boolean relaxedCspForDocs) {
            this.relaxedCspForDocs = relaxedCspForDocs;
            return this;
        }

        /** Maximum request body size in bytes. Default: {@link #DEFAULT_MAX_BODY_SIZE}. */
        public Builder maxBodySize(long maxBodySize) {
            this.maxBodySize = maxBodySize;
            return this;
        }

        /**
         * Socket addresses of reverse proxies whose client-address headers are believed.
         * Default: none, so every client is identified by its socket address.
         */
        public Builder trustedProxies(String... addresses) {
            this.trustedProxies.addAll(Arrays.asList(addresses));
            return this;
        }

        public Builder maxBodySizeMb(int megabytes) {
            this.maxBodySize = megabytes * 1024L * 1024L;
            return this;
        }

        public RequestDispatcher build() {
            return new RequestDispatcher(this);
        }
    }
}
