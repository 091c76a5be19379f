package io.avalonrest.server.core;

import io.avalonrest.core.AvalonRestException;
import io.avalonrest.core.HttpMethod;
import io.avalonrest.json.jackson.JacksonJsonCodec;
import io.avalonrest.json.spi.JsonException;
import io.avalonrest.json.spi.JsonNode;
import io.avalonrest.server.core.annotation.Authorize;
import io.avalonrest.server.core.annotation.Controller;
import io.avalonrest.server.core.annotation.FromBody;
import io.avalonrest.server.core.annotation.FromFile;
import io.avalonrest.server.core.annotation.FromForm;
import io.avalonrest.server.core.annotation.FromHeader;
import io.avalonrest.server.core.annotation.FromQuery;
import io.avalonrest.server.core.annotation.Route;
import io.avalonrest.server.core.multipart.FormFile;
import io.avalonrest.server.core.routing.RouteRegistry;
import io.avalonrest.server.core.security.InMemoryBlockRecordStore;
import io.avalonrest.server.core.security.RateLimitConfig;
import io.avalonrest.server.core.security.SlidingWindowRateLimiter;
import io.avalonrest.server.spi.TokenVerifier;
import io.avalonrest.server.spi.VerifiedIdentity;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

import static org.assertj.core.api.Assertions.assertThat;

class RequestDispatcherTest {

    public static class Signup {
        public String name;
        public int age;
        public boolean newsletter;
        public double score;
    }

    @Controller
    static class UserController extends ControllerBase {
        @Route(path = "info")
        public Map<String, Object> info() {
            return Map.of("name", "guest", "authenticated", context().isAuthenticated());
        }

        @Route(path = "{id}")
        public Map<String, Object> byId(int id, @FromQuery String expand, @FromHeader(name = "X-Trace") Optional<String> trace) {
            context().responseHeader("X-Trace", trace.orElse("none"));
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("id", id);
            out.put("expand", expand);
            return out;
        }

        @Route(method = HttpMethod.POST, path = "signup")
        public ActionResult signup(@FromBody Signup signup) {
            return created(signup);
        }

        @Route(path = "broken")
        public void broken() {
            throw new IllegalStateException("connection string leaked");
        }

        @Route(path = "invalid")
        public void invalid() {
            throw new AvalonRestException.BadInput("Name is required");
        }

        @Route(path = "ip")
        public Map<String, Object> ip() {
            return Map.of("ip", context().clientIp());
        }

        @Route(path = "silent")
        public void silent() {
            throw new AvalonRestException.BadInput(null);
        }

        @Route(path = "silent-missing")
        public void silentMissing() {
            throw new AvalonRestException.NotFound(null);
        }

        @Route(path = "later")
        public CompletionStage<String> later() {
            return CompletableFuture.supplyAsync(() -> "done");
        }

        @Route(path = "later-broken")
        public CompletionStage<String> laterBroken() {
            return CompletableFuture.failedFuture(new AvalonRestException.Forbidden("Not yours"));
        }

        @Route(path = "whoami")
        @Authorize
        public Map<String, Object> whoami() {
            return Map.of("name", user().orElseThrow().name());
        }
    }

    @Controller(route = "api/user")
    @Authorize(roles = "Admin")
    static class GuardedUserController {
        @Route(path = "info")
        public Map<String, Object> info() {
            return Map.of("name", "admin view");
        }
    }

    @Controller(route = "api/legacy")
    @Authorize(scheme = "Basic")
    static class LegacyController {
        @Route
        public String index() {
            return "legacy";
        }
    }

    @Controller
    static class UploadController {
        @Route(method = HttpMethod.POST)
        public Map<String, Object> upload(@FromFile FormFile file, @FromForm String description) {
            return Map.of("fileName", file.fileName(), "size", file.size(), "description", description);
        }
    }

    private static final TokenVerifier TOKENS = token -> {
        switch (token) {
            case "admin-token":
                return Optional.of(new VerifiedIdentity("alice", Set.of("Admin")));
            case "user-token":
                return Optional.of(new VerifiedIdentity("bob", Set.of("User")));
            default:
                return Optional.empty();
        }
    };

    private final JacksonJsonCodec codec = new JacksonJsonCodec();

    private static RequestDispatcher dispatcher(Class<?>... types) {
        RouteRegistry.Builder routes = RouteRegistry.builder();
        for (Class<?> type : types) {
            register(routes, type);
        }
        return RequestDispatcher.builder(routes.build()).tokenVerifier(TOKENS).maxBodySizeMb(1).build();
    }

    private static <T> void register(RouteRegistry.Builder routes, Class<T> type) {
        routes.register(type, () -> type.cast(newInstance(type)));
    }

    private static Object newInstance(Class<?> type) {
        try {
            var ctor = type.getDeclaredConstructor();
            ctor.setAccessible(true);
            return ctor.newInstance();
        } catch (ReflectiveOperationException e) {
            throw new IllegalStateException(e);
        }
    }

    private static ServerRequest request(HttpMethod method, String path, Map<String, List<String>> headers, byte[] body) {
        return new ServerRequest(method, URI.create("http://localhost" + path), headers,
                body == null ? null : new ByteArrayInputStream(body), "192.0.2.50");
    }

    private static Map<String, List<String>> headers(String... kv) {
        Map<String, List<String>> out = new LinkedHashMap<>();
        for (int i = 0; i < kv.length; i += 2) {
            out.put(kv[i], List.of(kv[i + 1]));
        }
        return out;
    }

    private static String text(ServerResponse resp) {
        if (resp.body() instanceof ResponseBody.Bytes b) return new String(b.bytes(), StandardCharsets.UTF_8);
        return "";
    }

    private JsonNode json(ServerResponse resp) throws JsonException {
        return codec.readTree(text(resp));
    }

    @Test
    void anonymousRouteAnswersWithoutCredential() throws JsonException {
        ServerResponse resp = dispatcher(UserController.class).handle(request(HttpMethod.GET, "/api/user/info", Map.of(), null));
        assertThat(resp.status()).isEqualTo(200);
        assertThat(json(resp).get("name").asText()).isEqualTo("guest");
        assertThat(json(resp).get("authenticated").asBoolean()).isFalse();
    }

    @Test
    void guardedRouteChecksCredentialAndRole() throws JsonException {
        RequestDispatcher d = dispatcher(GuardedUserController.class);

        ServerResponse none = d.handle(request(HttpMethod.GET, "/api/user/info", Map.of(), null));
        assertThat(none.status()).isEqualTo(401);
        assertThat(json(none).get("error").asText()).isEqualTo("Unauthorized: Missing or invalid token");

        ServerResponse invalid = d.handle(request(HttpMethod.GET, "/api/user/info", headers("Authorization", "Bearer forged"), null));
        assertThat(invalid.status()).isEqualTo(401);

        ServerResponse user = d.handle(request(HttpMethod.GET, "/api/user/info", headers("Authorization", "Bearer user-token"), null));
        assertThat(user.status()).isEqualTo(403);
        assertThat(json(user).get("error").asText()).isEqualTo("Forbidden: Insufficient role");

        ServerResponse admin = d.handle(request(HttpMethod.GET, "/api/user/info", headers("authorization", "bearer admin-token"), null));
        assertThat(admin.status()).isEqualTo(200);
        assertThat(json(admin).get("name").asText()).isEqualTo("admin view");
    }

    @Test
    void identityIsAvailableToHandler() throws JsonException {
        ServerResponse resp = dispatcher(UserController.class)
                .handle(request(HttpMethod.GET, "/api/user/whoami", headers("Authorization", "Bearer user-token"), null));
        assertThat(resp.status()).isEqualTo(200);
        assertThat(json(resp).get("name").asText()).isEqualTo("bob");
    }

    @Test
    void unsupportedSchemeIsUnauthorized() throws JsonException {
        ServerResponse resp = dispatcher(LegacyController.class)
                .handle(request(HttpMethod.GET, "/api/legacy", headers("Authorization", "Bearer admin-token"), null));
        assertThat(resp.status()).isEqualTo(401);
        assertThat(json(resp).get("error").asText()).isEqualTo("Unauthorized: Unsupported authentication scheme");
    }

    @Test
    void routeQueryAndHeaderValuesAreBound() throws JsonException {
        ServerResponse resp = dispatcher(UserController.class)
                .handle(request(HttpMethod.GET, "/api/user/42?expand=orders", headers("X-Trace", "t-9"), null));
        assertThat(resp.status()).isEqualTo(200);
        assertThat(json(resp).get("id").asLong()).isEqualTo(42);
        assertThat(json(resp).get("expand").asText()).isEqualTo("orders");
        assertThat(resp.firstHeader("X-Trace")).contains("t-9");
    }

    @Test
    void unconvertibleRouteValueIsBadRequest() throws JsonException {
        ServerResponse resp = dispatcher(UserController.class).handle(request(HttpMethod.GET, "/api/user/abc", Map.of(), null));
        assertThat(resp.status()).isEqualTo(400);
        assertThat(json(resp).get("error").asText()).contains("abc").contains("id");
    }

    @Test
    void bodyRoundTrips() throws JsonException {
        Signup signup = new Signup();
        signup.name = "Ada";
        signup.age = 36;
        signup.newsletter = true;
        signup.score = 9.5;
        byte[] body = codec.writeBytes(signup);

        ServerResponse resp = dispatcher(UserController.class).handle(request(HttpMethod.POST, "/api/user/signup",
                headers("Content-Type", "application/json"), body));

        assertThat(resp.status()).isEqualTo(201);
        Signup echoed = codec.readValue(text(resp), Signup.class);
        assertThat(echoed).usingRecursiveComparison().isEqualTo(signup);
    }

    @Test
    void malformedJsonIsBadRequestWithoutInternals() throws JsonException {
        ServerResponse resp = dispatcher(UserController.class).handle(request(HttpMethod.POST, "/api/user/signup",
                headers("Content-Type", "application/json"), "{\"name\":".getBytes(StandardCharsets.UTF_8)));
        assertThat(resp.status()).isEqualTo(400);
        assertThat(json(resp).get("error").asText()).startsWith("Invalid JSON format").doesNotContain("com.fasterxml");
    }

    @Test
    void handlerFaultsAreClassified() throws JsonException {
        RequestDispatcher d = dispatcher(UserController.class);

        ServerResponse broken = d.handle(request(HttpMethod.GET, "/api/user/broken", Map.of(), null));
        assertThat(broken.status()).isEqualTo(500);
        assertThat(json(broken).get("error").asText()).isEqualTo("Internal server error");

        ServerResponse invalid = d.handle(request(HttpMethod.GET, "/api/user/invalid", Map.of(), null));
        assertThat(invalid.status()).isEqualTo(400);
        assertThat(json(invalid).get("error").asText()).isEqualTo("Name is required");
    }

    @Test
    void faultsWithoutMessageKeepTheirStatus() throws JsonException {
        RequestDispatcher d = dispatcher(UserController.class);

        ServerResponse bad = d.handle(request(HttpMethod.GET, "/api/user/silent", Map.of(), null));
        assertThat(bad.status()).isEqualTo(400);
        assertThat(json(bad).get("error").asText()).isEqualTo("Bad request");

        ServerResponse missing = d.handle(request(HttpMethod.GET, "/api/user/silent-missing", Map.of(), null));
        assertThat(missing.status()).isEqualTo(404);
        assertThat(json(missing).get("error").asText()).isEqualTo("Not found");
    }

    @Test
    void asyncResultsAreAwaited() throws JsonException {
        RequestDispatcher d = dispatcher(UserController.class);
        assertThat(text(d.handle(request(HttpMethod.GET, "/api/user/later", Map.of(), null)))).isEqualTo("done");

        ServerResponse failed = d.handle(request(HttpMethod.GET, "/api/user/later-broken", Map.of(), null));
        assertThat(failed.status()).isEqualTo(403);
        assertThat(json(failed).get("error").asText()).isEqualTo("Not yours");
    }

    @Test
    void unknownPathsAreNotFound() throws JsonException {
        RequestDispatcher d = dispatcher(UserController.class, UploadController.class);

        ServerResponse noController = d.handle(request(HttpMethod.GET, "/api/orders", Map.of(), null));
        assertThat(noController.status()).isEqualTo(404);
        JsonNode body = json(noController);
        assertThat(body.get("error").asText()).isEqualTo("Controller not found");
        assertThat(body.get("requestedPath").asText()).isEqualTo("/api/orders");
        assertThat(body.get("availableRoutes").size()).isEqualTo(2);

        ServerResponse noMethod = d.handle(request(HttpMethod.DELETE, "/api/user/info", Map.of(), null));
        assertThat(noMethod.status()).isEqualTo(404);
        assertThat(json(noMethod).get("error").asText()).isEqualTo("Route not found");
        assertThat(json(noMethod).get("subPath").asText()).isEqualTo("/info");
        assertThat(json(noMethod).get("method").asText()).isEqualTo("DELETE");
    }

    @Test
    void preflightShortCircuits() {
        ServerResponse resp = dispatcher(UserController.class).handle(request(HttpMethod.OPTIONS, "/anything", Map.of(), null));
        assertThat(resp.status()).isEqualTo(204);
        assertThat(resp.body()).isInstanceOf(ResponseBody.Empty.class);
        assertThat(resp.firstHeader("Access-Control-Allow-Methods")).contains("GET, POST, PUT, DELETE, OPTIONS");
        assertThat(resp.firstHeader("Access-Control-Allow-Credentials")).contains("true");
    }

    @Test
    void everyResponseCarriesSecurityHeaders() {
        ServerResponse resp = dispatcher(UserController.class).handle(request(HttpMethod.GET, "/api/nothing", Map.of(), null));
        assertThat(resp.firstHeader("X-Frame-Options")).contains("DENY");
        assertThat(resp.firstHeader("Strict-Transport-Security")).contains("max-age=31536000; includeSubDomains");
        assertThat(resp.firstHeader("Referrer-Policy")).contains("no-referrer");
    }

    @Test
    void declaredOversizeIsRejectedUpFront() throws JsonException {
        ServerResponse resp = dispatcher(UserController.class).handle(request(HttpMethod.POST, "/api/user/signup",
                headers("Content-Length", Long.toString(3L * 1024 * 1024)), null));
        assertThat(resp.status()).isEqualTo(413);
        JsonNode body = json(resp);
        assertThat(body.get("error").asText()).isEqualTo("Request entity too large");
        assertThat(body.get("maxAllowedSizeMB").asText()).isEqualTo("1.0");
        assertThat(body.get("receivedSizeMB").asText()).isEqualTo("3.0");
    }

    @Test
    void underReportedBodyIsStillRejected() throws JsonException {
        byte[] huge = new byte[2 * 1024 * 1024];
        ServerResponse resp = dispatcher(UserController.class).handle(request(HttpMethod.POST, "/api/user/signup",
                headers("Content-Type", "application/json", "Content-Length", "10"), huge));
        assertThat(resp.status()).isEqualTo(413);
        assertThat(json(resp).get("suggestion").asText()).startsWith("Split your request");
    }

    @Test
    void multipartUploadIsBound() throws JsonException {
        MultipartBody body = new MultipartBody("----form7")
                .text("description", "holiday")
                .file("file", "beach.jpg", "image/jpeg", new byte[]{(byte) 0xFF, (byte) 0xD8, 1, 2, 3});
        ServerResponse resp = dispatcher(UploadController.class).handle(request(HttpMethod.POST, "/api/upload",
                headers("Content-Type", body.contentType()), body.build()));
        assertThat(resp.status()).isEqualTo(200);
        JsonNode doc = json(resp);
        assertThat(doc.get("fileName").asText()).isEqualTo("beach.jpg");
        assertThat(doc.get("size").asLong()).isEqualTo(5);
        assertThat(doc.get("description").asText()).isEqualTo("holiday");
    }

    @Test
    void rateLimitedRequestsGet429() throws JsonException {
        MutableClock clock = new MutableClock();
        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(
                RateLimitConfig.builder().defaultLimit(3, Duration.ofSeconds(60)).build(),
                new InMemoryBlockRecordStore(), clock);
        RequestDispatcher d = RequestDispatcher.builder(RouteRegistry.builder()
                        .register(UserController.class, UserController::new).build())
                .rateLimiter(limiter)
                .build();

        for (int i = 0; i < 3; i++) {
            assertThat(d.handle(request(HttpMethod.GET, "/api/user/info", Map.of(), null)).status()).isEqualTo(200);
        }
        ServerResponse limited = d.handle(request(HttpMethod.GET, "/api/user/info", Map.of(), null));
        assertThat(limited.status()).isEqualTo(429);
        assertThat(limited.firstHeader("Retry-After")).contains("60");
        JsonNode body = json(limited);
        assertThat(body.get("error").asText()).isEqualTo("Too many requests");
        assertThat(body.get("retryAfter").asLong()).isEqualTo(60);
        assertThat(body.get("limit").asLong()).isEqualTo(3);
        assertThat(body.get("window").asLong()).isEqualTo(60);

        clock.advance(Duration.ofSeconds(61));
        assertThat(d.handle(request(HttpMethod.GET, "/api/user/info", Map.of(), null)).status()).isEqualTo(200);
    }

    @Test
    void forwardedForFromUntrustedPeerCannotClaimWhitelistedAddress() {
        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(
                RateLimitConfig.builder().defaultLimit(1, Duration.ofSeconds(60)).whitelist("127.0.0.1").build(),
                new InMemoryBlockRecordStore(), new MutableClock());
        RequestDispatcher d = RequestDispatcher.builder(RouteRegistry.builder()
                        .register(UserController.class, UserController::new).build())
                .rateLimiter(limiter)
                .build();
        Map<String, List<String>> spoofed = headers("X-Forwarded-For", "127.0.0.1");

        assertThat(d.handle(request(HttpMethod.GET, "/api/user/info", spoofed, null)).status()).isEqualTo(200);
        assertThat(d.handle(request(HttpMethod.GET, "/api/user/info", spoofed, null)).status()).isEqualTo(429);
    }

    @Test
    void forwardedForFromTrustedProxyIdentifiesClient() throws JsonException {
        RequestDispatcher d = RequestDispatcher.builder(RouteRegistry.builder()
                        .register(UserController.class, UserController::new).build())
                .trustedProxies("192.0.2.50")
                .build();

        ServerResponse resp = d.handle(request(HttpMethod.GET, "/api/user/ip", headers("X-Forwarded-For", "198.51.100.4"), null));
        assertThat(json(resp).get("ip").asText()).isEqualTo("198.51.100.4");

        RequestDispatcher direct = dispatcher(UserController.class);
        ServerResponse untrusted = direct.handle(request(HttpMethod.GET, "/api/user/ip", headers("X-Forwarded-For", "198.51.100.4"), null));
        assertThat(json(untrusted).get("ip").asText()).isEqualTo("192.0.2.50");
    }
}
