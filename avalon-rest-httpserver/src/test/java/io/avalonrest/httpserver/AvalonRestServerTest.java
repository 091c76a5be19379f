package io.avalonrest.httpserver;

import io.avalonrest.core.HttpMethod;
import io.avalonrest.json.jackson.JacksonJsonCodec;
import io.avalonrest.server.core.ActionResult;
import io.avalonrest.server.core.ControllerBase;
import io.avalonrest.server.core.RequestDispatcher;
import io.avalonrest.server.core.annotation.Controller;
import io.avalonrest.server.core.annotation.FromBody;
import io.avalonrest.server.core.annotation.Route;
import io.avalonrest.server.core.routing.RouteRegistry;
import io.avalonrest.server.core.security.InMemoryBlockRecordStore;
import io.avalonrest.server.core.security.RateLimitConfig;
import io.avalonrest.server.core.security.SlidingWindowRateLimiter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AvalonRestServerTest {

    public static class Note {
        public String text;
    }

    @Controller
    public static class NotesController extends ControllerBase {
        @Route(path = "ping")
        public Map<String, Object> ping() {
            return Map.of("pong", true);
        }

        @Route(method = HttpMethod.POST)
        public ActionResult create(@FromBody Note note) {
            return created(Map.of("text", note.text));
        }

        @Route(path = "download")
        public ActionResult download() {
            byte[] data = new byte[200_000];
            return stream(new ByteArrayInputStream(data), "application/octet-stream", "data.bin", false);
        }

        @Route(path = "nothing")
        public ActionResult nothing() {
            return noContent();
        }
    }

    private final HttpClient client = HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).connectTimeout(Duration.ofSeconds(5)).build();
    private AvalonRestServer server;

    @BeforeEach
    void start() {
        RouteRegistry routes = RouteRegistry.builder()
                .register(NotesController.class, NotesController::new)
                .build();
        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(
                RateLimitConfig.builder().defaultLimit(5, Duration.ofMinutes(1)).build(),
                new InMemoryBlockRecordStore());
        RequestDispatcher dispatcher = RequestDispatcher.builder(routes)
                .codec(new JacksonJsonCodec())
                .rateLimiter(limiter)
                .build();
        server = AvalonRestServer.builder().host("127.0.0.1").port(0).dispatcher(dispatcher).build().start();
    }

    @AfterEach
    void stop() {
        server.close();
    }

    private URI uri(String path) {
        return URI.create("http://127.0.0.1:" + server.port() + path);
    }

    @Test
    void servesJsonWithSecurityAndCorsHeaders() throws Exception {
        HttpResponse<String> res = client.send(HttpRequest.newBuilder(uri("/api/notes/ping")).GET().build(),
                HttpResponse.BodyHandlers.ofString());

        assertThat(res.statusCode()).isEqualTo(200);
        assertThat(res.body()).isEqualTo("{\"pong\":true}");
        assertThat(res.headers().firstValue("Content-Type")).hasValue("application/json; charset=utf-8");
        assertThat(res.headers().firstValue("X-Frame-Options")).hasValue("DENY");
        assertThat(res.headers().firstValue("Access-Control-Allow-Origin")).hasValue("*");
    }

    @Test
    void bindsPostedJson() throws Exception {
        HttpRequest req = HttpRequest.newBuilder(uri("/api/notes"))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString("{\"text\":\"hello\"}"))
                .build();

        HttpResponse<String> res = client.send(req, HttpResponse.BodyHandlers.ofString());

        assertThat(res.statusCode()).isEqualTo(201);
        assertThat(res.body()).isEqualTo("{\"text\":\"hello\"}");
    }

    @Test
    void streamsLargeBodiesChunked() throws Exception {
        HttpResponse<byte[]> res = client.send(HttpRequest.newBuilder(uri("/api/notes/download")).GET().build(),
                HttpResponse.BodyHandlers.ofByteArray());

        assertThat(res.statusCode()).isEqualTo(200);
        assertThat(res.body()).hasSize(200_000);
        assertThat(res.headers().firstValue("Content-Disposition")).hasValue("inline; filename=\"data.bin\"");
    }

    @Test
    void noContentHasNoBody() throws Exception {
        HttpResponse<String> res = client.send(HttpRequest.newBuilder(uri("/api/notes/nothing")).GET().build(),
                HttpResponse.BodyHandlers.ofString());

        assertThat(res.statusCode()).isEqualTo(204);
        assertThat(res.body()).isEmpty();
    }

    @Test
    void unknownControllerIs404() throws Exception {
        HttpResponse<String> res = client.send(HttpRequest.newBuilder(uri("/api/ghost")).GET().build(),
                HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));

        assertThat(res.statusCode()).isEqualTo(404);
        assertThat(res.body()).contains("\"error\":\"Controller not found\"");
    }

    @Test
    void unsupportedVerbIs405() throws Exception {
        HttpRequest req = HttpRequest.newBuilder(uri("/api/notes/ping"))
                .method("TRACE", HttpRequest.BodyPublishers.noBody())
                .build();

        HttpResponse<String> res = client.send(req, HttpResponse.BodyHandlers.ofString());

        assertThat(res.statusCode()).isEqualTo(405);
        assertThat(res.body()).isEqualTo("{\"error\":\"Method not allowed\"}");
    }

    @Test
    void rateLimitRejectsWithRetryAfter() throws Exception {
        HttpRequest req = HttpRequest.newBuilder(uri("/api/notes/ping")).GET().build();
        for (int i = 0; i < 5; i++) {
            assertThat(client.send(req, HttpResponse.BodyHandlers.discarding()).statusCode()).isEqualTo(200);
        }

        HttpResponse<String> res = client.send(req, HttpResponse.BodyHandlers.ofString());

        assertThat(res.statusCode()).isEqualTo(429);
        assertThat(res.headers().firstValue("Retry-After")).isPresent();
        assertThat(res.body()).contains("\"error\":\"Too many requests\"");
    }

    @Test
    void startingTwiceFails() {
        assertThatThrownBy(server::start).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void portIsUnavailableAfterStop() {
        server.stop();
        assertThat(server.isRunning()).isFalse();
        assertThatThrownBy(server::port).isInstanceOf(IllegalStateException.class);
    }
}
