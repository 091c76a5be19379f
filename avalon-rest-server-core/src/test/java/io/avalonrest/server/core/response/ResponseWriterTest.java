package io.avalonrest.server.core.response;

import io.avalonrest.json.jackson.JacksonJsonCodec;
import io.avalonrest.json.spi.JsonCodec;
import io.avalonrest.json.spi.JsonException;
import io.avalonrest.json.spi.JsonNode;
import io.avalonrest.server.core.ActionResult;
import io.avalonrest.server.core.ResponseBody;
import io.avalonrest.server.core.ServerResponse;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ResponseWriterTest {

    record Profile(String displayName, Instant joinedAt) {}

    static final class FailingCodec implements JsonCodec {
        @Override
        public byte[] writeBytes(Object value) throws JsonException {
            throw new JsonException("boom");
        }

        @Override
        public String writeString(Object value) throws JsonException {
            throw new JsonException("boom");
        }

        @Override
        public <T> T readValue(byte[] data, Type type) throws JsonException {
            throw new JsonException("boom");
        }

        @Override
        public <T> T readValue(String json, Type type) throws JsonException {
            throw new JsonException("boom");
        }

        @Override
        public JsonNode readTree(byte[] data) throws JsonException {
            throw new JsonException("boom");
        }

        @Override
        public JsonNode readTree(String json) throws JsonException {
            throw new JsonException("boom");
        }

        @Override
        public <T> T convert(JsonNode node, Type type) throws JsonException {
            throw new JsonException("boom");
        }
    }

    private final JacksonJsonCodec codec = new JacksonJsonCodec();
    private final ResponseWriter writer = new ResponseWriter(codec, CorsPolicy.defaults(), SecurityHeaders.defaults());

    private static String text(ServerResponse resp) {
        return new String(((ResponseBody.Bytes) resp.body()).bytes(), StandardCharsets.UTF_8);
    }

    @Test
    void valuesSerializeAsCamelCaseJson() throws JsonException {
        ServerResponse resp = writer.write(ActionResult.ok(new Profile("Ada", Instant.parse("2024-01-02T03:04:05Z"))),
                Map.of(), "/api/user");
        assertThat(resp.status()).isEqualTo(200);
        assertThat(resp.firstHeader("content-type")).contains("application/json; charset=utf-8");
        JsonNode doc = codec.readTree(text(resp));
        assertThat(doc.get("displayName").asText()).isEqualTo("Ada");
        assertThat(doc.get("joinedAt").asText()).isEqualTo("2024-01-02T03:04:05Z");
    }

    @Test
    void nullValueAndStatusOnlyWriteEmptyObject() {
        assertThat(text(writer.write(ActionResult.of(null), Map.of(), "/"))).isEqualTo("{}");
        assertThat(text(writer.write(new ActionResult.Status(202), Map.of(), "/"))).isEqualTo("{}");
        assertThat(writer.write(new ActionResult.Status(204), Map.of(), "/").body()).isInstanceOf(ResponseBody.Empty.class);
    }

    @Test
    void stringsAreTextAndBytesAreOctetStream() {
        ServerResponse txt = writer.write(ActionResult.ok("pong"), Map.of(), "/");
        assertThat(text(txt)).isEqualTo("pong");
        assertThat(txt.firstHeader("Content-Type")).contains("text/plain; charset=utf-8");

        ServerResponse bin = writer.write(ActionResult.ok(new byte[]{1, 2}), Map.of(), "/");
        assertThat(bin.firstHeader("Content-Type")).contains("application/octet-stream");
    }

    @Test
    void contentIsWrittenVerbatim() {
        ServerResponse resp = writer.write(new ActionResult.Content(201, "<p>hi</p>", "text/html", null), Map.of(), "/");
        assertThat(resp.status()).isEqualTo(201);
        assertThat(text(resp)).isEqualTo("<p>hi</p>");
        assertThat(resp.firstHeader("Content-Type")).contains("text/html; charset=utf-8");
    }

    @Test
    void filesCarryDisposition() {
        ServerResponse file = writer.write(new ActionResult.File(new byte[]{9}, "application/pdf", "report \"q1\".pdf"), Map.of(), "/");
        assertThat(file.firstHeader("Content-Disposition")).contains("attachment; filename=\"report q1.pdf\"");

        ServerResponse inline = writer.write(new ActionResult.StreamFile(new ByteArrayInputStream(new byte[3]), "image/png", "a.png", false),
                Map.of(), "/");
        assertThat(inline.body()).isInstanceOfSatisfying(ResponseBody.Stream.class, s -> assertThat(s.length()).isEqualTo(-1));
        assertThat(inline.firstHeader("Content-Disposition")).contains("inline; filename=\"a.png\"");
    }

    @Test
    void defaultHeadersDoNotOverrideHandlerHeaders() {
        ServerResponse resp = writer.write(ActionResult.ok(Map.of()),
                Map.of("X-Frame-Options", List.of("SAMEORIGIN"), "X-Request-Id", List.of("r-1")), "/api/x");
        assertThat(resp.headers().get("X-Frame-Options")).containsExactly("SAMEORIGIN");
        assertThat(resp.firstHeader("X-Request-Id")).contains("r-1");
        assertThat(resp.firstHeader("X-Content-Type-Options")).contains("nosniff");
        assertThat(resp.firstHeader("Access-Control-Allow-Origin")).contains("*");
        assertThat(resp.firstHeader("Content-Security-Policy")).contains(SecurityHeaders.STRICT_CSP);
    }

    @Test
    void docsPathsGetRelaxedPolicy() {
        assertThat(writer.preflight("/docs/index.html").firstHeader("Content-Security-Policy")).contains(SecurityHeaders.DOCS_CSP);
        ResponseWriter strict = new ResponseWriter(codec, CorsPolicy.defaults(), new SecurityHeaders(false));
        assertThat(strict.preflight("/swagger").firstHeader("Content-Security-Policy")).contains(SecurityHeaders.STRICT_CSP);
    }

    @Test
    void serializationFailureDegradesTo500() {
        JsonCodec failing = new FailingCodec();
        ServerResponse resp = new ResponseWriter(failing, CorsPolicy.defaults(), SecurityHeaders.defaults())
                .write(ActionResult.ok(Map.of("a", 1)), Map.of(), "/");
        assertThat(resp.status()).isEqualTo(500);
        assertThat(text(resp)).isEqualTo("{\"error\":\"Internal server error\"}");
    }
}
