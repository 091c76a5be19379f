package io.avalonrest.server.core.response;

import io.avalonrest.core.Protocol;
import io.avalonrest.json.spi.JsonCodec;
import io.avalonrest.json.spi.JsonException;
import io.avalonrest.server.core.ActionResult;
import io.avalonrest.server.core.ResponseBody;
import io.avalonrest.server.core.ServerResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Maps handler results to host-neutral responses.
 *
 * <p>Payloads are dispatched by shape: raw content is written verbatim, files become
 * attachments, streams are copied by the host, strings are plain text and everything else is
 * serialized as JSON. Every response gets the CORS and security headers that the handler did not
 * set itself.
 */
public final class ResponseWriter {

    private static final Logger LOG = LoggerFactory.getLogger(ResponseWriter.class);

    private static final byte[] INTERNAL_ERROR =
            "{\"error\":\"Internal server error\"}".getBytes(StandardCharsets.UTF_8);
    private static final String JSON_UTF8 = Protocol.CT_JSON + "; charset=utf-8";
    private static final String TEXT_UTF8 = Protocol.CT_TEXT_PLAIN + "; charset=utf-8";

    private final JsonCodec codec;
    private final CorsPolicy cors;
    private final SecurityHeaders securityHeaders;

    public ResponseWriter(JsonCodec codec, CorsPolicy cors, SecurityHeaders securityHeaders) {
        this.codec = Objects.requireNonNull(codec, "codec");
        this.cors = Objects.requireNonNull(cors, "cors");
        this.securityHeaders = Objects.requireNonNull(securityHeaders, "securityHeaders");
    }

    /**
     * Builds the response for {@code result}.
     *
     * @param extraHeaders headers set by the handler; they win over the default headers
     * @param path request path, selects the content security policy
     */
    public ServerResponse write(ActionResult result, Map<String, List<String>> extraHeaders, String path) {
        ServerResponse response;
        try {
            response = render(result);
        } catch (JsonException | RuntimeException e) {
            LOG.error("Failed to serialize response of status {}", result.status(), e);
            response = new ServerResponse(500, new ResponseBody.Bytes(INTERNAL_ERROR))
                    .header(Protocol.H_CONTENT_TYPE, JSON_UTF8);
            return decorate(response, Map.of(), path);
        }
        return decorate(response, extraHeaders, path);
    }

    /**
     * JSON error response {@code {"error": message}}.
     */
    public ServerResponse error(int status, String message, String path) {
        return write(ActionResult.error(status, message), Map.of(), path);
    }

    /**
     * Empty response carrying only the default headers, used for CORS preflight.
     */
    public ServerResponse preflight(String path) {
        return decorate(new ServerResponse(204, new ResponseBody.Empty()), Map.of(), path);
    }

    private ServerResponse decorate(ServerResponse response, Map<String, List<String>> extraHeaders, String path) {
        if (extraHeaders != null) {
            for (Map.Entry<String, List<String>> e : extraHeaders.entrySet()) {
                for (String v : e.getValue()) response.header(e.getKey(), v);
            }
        }
        securityHeaders.apply(response, path);
        cors.apply(response);
        return response;
    }

    private ServerResponse render(ActionResult result) throws JsonException {
        if (result instanceof ActionResult.Status s) {
            if (s.status() == 204 || s.status() == 304) {
                return new ServerResponse(s.status(), new ResponseBody.Empty());
            }
            return json(s.status(), Map.of());
        }
        if (result instanceof ActionResult.Content c) {
            return new ServerResponse(c.status(), new ResponseBody.Bytes(c.content().getBytes(c.charset())))
                    .header(Protocol.H_CONTENT_TYPE, c.contentType() + "; charset=" + c.charset().name().toLowerCase(Locale.ROOT));
        }
        if (result instanceof ActionResult.File f) {
            return new ServerResponse(200, new ResponseBody.Bytes(f.bytes()))
                    .header(Protocol.H_CONTENT_TYPE, f.contentType() != null ? f.contentType() : Protocol.CT_OCTET_STREAM)
                    .header(Protocol.H_CONTENT_DISPOSITION, disposition(true, f.fileName()));
        }
        if (result instanceof ActionResult.StreamFile sf) {
            return new ServerResponse(200, new ResponseBody.Stream(sf.stream(), -1))
                    .header(Protocol.H_CONTENT_TYPE, sf.contentType() != null ? sf.contentType() : Protocol.CT_OCTET_STREAM)
                    .header(Protocol.H_CONTENT_DISPOSITION, disposition(sf.attachment(), sf.fileName()));
        }
        ActionResult.Value v = (ActionResult.Value) result;
        Object value = v.value();
        if (value instanceof InputStream in) {
            return new ServerResponse(v.status(), new ResponseBody.Stream(in, -1))
                    .header(Protocol.H_CONTENT_TYPE, Protocol.CT_OCTET_STREAM);
        }
        if (value instanceof byte[] bytes) {
            return new ServerResponse(v.status(), new ResponseBody.Bytes(bytes))
                    .header(Protocol.H_CONTENT_TYPE, Protocol.CT_OCTET_STREAM);
        }
        if (value instanceof CharSequence text) {
            return new ServerResponse(v.status(), new ResponseBody.Bytes(text.toString().getBytes(StandardCharsets.UTF_8)))
                    .header(Protocol.H_CONTENT_TYPE, TEXT_UTF8);
        }
        return json(v.status(), value == null ? Map.of() : value);
    }

    private ServerResponse json(int status, Object value) throws JsonException {
        return new ServerResponse(status, new ResponseBody.Bytes(codec.writeBytes(value)))
                .header(Protocol.H_CONTENT_TYPE, JSON_UTF8);
    }

    static String disposition(boolean attachment, String fileName) {
        String type = attachment ? "attachment" : "inline";
        if (fileName == null || fileName.isBlank()) return type;
        String safe = fileName.replace("\\", "").replace("\"", "").replace("\r", "").replace("\n", "");
        return type + "; filename=\"" + safe + "\"";
    }
}
