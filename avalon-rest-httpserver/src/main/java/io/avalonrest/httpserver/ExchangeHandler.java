package io.avalonrest.httpserver;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import io.avalonrest.core.HttpMethod;
import io.avalonrest.core.Protocol;
import io.avalonrest.server.core.RequestDispatcher;
import io.avalonrest.server.core.ResponseBody;
import io.avalonrest.server.core.ServerRequest;
import io.avalonrest.server.core.ServerResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Bridges {@link HttpExchange} to the host-neutral {@link RequestDispatcher}.
 */
final class ExchangeHandler implements HttpHandler {

    private static final Logger LOG = LoggerFactory.getLogger(ExchangeHandler.class);

    static final int COPY_BUFFER_SIZE = 81920;

    private static final byte[] INTERNAL_ERROR =
            "{\"error\":\"Internal server error\"}".getBytes(StandardCharsets.UTF_8);
    private static final byte[] METHOD_NOT_ALLOWED =
            "{\"error\":\"Method not allowed\"}".getBytes(StandardCharsets.UTF_8);

    private final RequestDispatcher dispatcher;

    ExchangeHandler(RequestDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @Override
    public void handle(HttpExchange exchange) {
        boolean headersSent = false;
        try {
            Optional<HttpMethod> method = HttpMethod.parse(exchange.getRequestMethod());
            if (method.isEmpty()) {
                exchange.getResponseHeaders().add(Protocol.H_CONTENT_TYPE, Protocol.CT_JSON);
                exchange.sendResponseHeaders(405, METHOD_NOT_ALLOWED.length);
                headersSent = true;
                exchange.getResponseBody().write(METHOD_NOT_ALLOWED);
                return;
            }
            ServerResponse response = dispatcher.handle(toServerRequest(exchange, method.get()));
            headersSent = true;
            write(exchange, method.get(), response);
        } catch (Exception e) {
            LOG.error("Failed to serve {} {}", exchange.getRequestMethod(), exchange.getRequestURI(), e);
            if (!headersSent) {
                sendInternalError(exchange);
            }
        } finally {
            exchange.close();
        }
    }

    private static ServerRequest toServerRequest(HttpExchange exchange, HttpMethod method) {
        Map<String, List<String>> headers = new LinkedHashMap<>();
        exchange.getRequestHeaders().forEach((name, values) -> headers.put(name, List.copyOf(values)));
        InetSocketAddress remote = exchange.getRemoteAddress();
        String remoteAddress = remote == null || remote.getAddress() == null ? null : remote.getAddress().getHostAddress();
        URI uri = exchange.getRequestURI();
        return new ServerRequest(method, uri, headers, exchange.getRequestBody(), remoteAddress);
    }

    private static void write(HttpExchange exchange, HttpMethod method, ServerResponse response) throws IOException {
        response.headers().forEach((name, values) -> {
            for (String v : values) exchange.getResponseHeaders().add(name, v);
        });
        int status = response.status();
        ResponseBody body = response.body();
        boolean noBody = method == HttpMethod.HEAD || status == 204 || status == 304;

        if (body instanceof ResponseBody.Stream stream) {
            try (InputStream in = stream.input()) {
                if (noBody) {
                    exchange.sendResponseHeaders(status, -1);
                    return;
                }
                // 0 selects chunked encoding
                exchange.sendResponseHeaders(status, stream.length() > 0 ? stream.length() : 0);
                OutputStream out = exchange.getResponseBody();
                byte[] buf = new byte[COPY_BUFFER_SIZE];
                int r;
                while ((r = in.read(buf)) >= 0) {
                    out.write(buf, 0, r);
                }
                out.flush();
            }
            return;
        }
        byte[] bytes = body instanceof ResponseBody.Bytes b ? b.bytes() : null;
        if (noBody || bytes == null || bytes.length == 0) {
            exchange.sendResponseHeaders(status, -1);
            return;
        }
        exchange.sendResponseHeaders(status, bytes.length);
        OutputStream out = exchange.getResponseBody();
        out.write(bytes);
        out.flush();
    }

    private static void sendInternalError(HttpExchange exchange) {
        try {
            exchange.getResponseHeaders().set(Protocol.H_CONTENT_TYPE, Protocol.CT_JSON);
            exchange.sendResponseHeaders(500, INTERNAL_ERROR.length);
            exchange.getResponseBody().write(INTERNAL_ERROR);
        } catch (IOException e) {
            LOG.debug("Could not send error response, closing connection", e);
        }
    }
}
