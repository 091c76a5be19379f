package io.avalonrest.httpserver;

import com.sun.net.httpserver.HttpServer;
import io.avalonrest.server.core.RequestDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.concurrent.ExecutorService;

/**
 * Puts a {@link RequestDispatcher} on a socket using the JDK's built-in HTTP server.
 *
 * <pre>{@code
 * try (AvalonRestServer server = AvalonRestServer.builder()
 *         .port(8080)
 *         .dispatcher(dispatcher)
 *         .build()
 *         .start()) {
 *     ...
 * }
 * }</pre>
 */
public final class AvalonRestServer implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(AvalonRestServer.class);

    public static final int DEFAULT_PORT = 8080;

    private final String host;
    private final int requestedPort;
    private final int backlog;
    private final int stopDelaySeconds;
    private final RequestDispatcher dispatcher;
    private final ExecutorService executor;
    private final boolean ownsExecutor;

    private HttpServer server;

    private AvalonRestServer(Builder b) {
        this.host = b.host;
        this.requestedPort = b.port;
        this.backlog = b.backlog;
        this.stopDelaySeconds = b.stopDelaySeconds;
        this.dispatcher = Objects.requireNonNull(b.dispatcher, "dispatcher");
        this.ownsExecutor = b.executor == null;
        this.executor = b.executor != null ? b.executor : VirtualThreads.newExecutor("avalon-rest-http");
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Binds and starts accepting connections.
     *
     * @throws UncheckedIOException when the address cannot be bound
     */
    public synchronized AvalonRestServer start() {
        if (server != null) {
            throw new IllegalStateException("server already started");
        }
        InetSocketAddress address = host == null ? new InetSocketAddress(requestedPort) : new InetSocketAddress(host, requestedPort);
        try {
            server = HttpServer.create(address, backlog);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to bind " + address, e);
        }
        server.createContext("/", new ExchangeHandler(dispatcher));
        server.setExecutor(executor);
        server.start();
        LOG.info("Listening on {}:{}", host == null ? "*" : host, port());
        return this;
    }

    /**
     * Actual bound port, useful when started with port 0.
     */
    public synchronized int port() {
        if (server == null) {
            throw new IllegalStateException("server not started");
        }
        return server.getAddress().getPort();
    }

    public synchronized boolean isRunning() {
        return server != null;
    }

    public synchronized void stop() {
        if (server == null) return;
        server.stop(stopDelaySeconds);
        server = null;
        if (ownsExecutor) {
            executor.shutdownNow();
        }
        LOG.info("Stopped");
    }

    @Override
    public void close() {
        stop();
    }

    public static final class Builder {
        private String host;
        private int port = DEFAULT_PORT;
        private int backlog;
        private int stopDelaySeconds = 1;
        private RequestDispatcher dispatcher;
        private ExecutorService executor;

        private Builder() {
        }

        /** Bind address; all interfaces when unset. */
        public Builder host(String host) {
            this.host = host;
            return this;
        }

        /** Listen port; {@code 0} picks an ephemeral one. */
        public Builder port(int port) {
            if (port < 0 || port > 65535) throw new IllegalArgumentException("port out of range: " + port);
            this.port = port;
            return this;
        }

        public Builder backlog(int backlog) {
            this.backlog = Math.max(0, backlog);
            return this;
        }

        public Builder stopDelaySeconds(int seconds) {
            this.stopDelaySeconds = Math.max(0, seconds);
            return this;
        }

        public Builder dispatcher(RequestDispatcher dispatcher) {
            this.dispatcher = dispatcher;
            return this;
        }

        /**
         * Executor running exchanges. A caller-supplied executor is not shut down on stop.
         */
        public Builder executor(ExecutorService executor) {
            this.executor = executor;
            return this;
        }

        public AvalonRestServer build() {
            return new AvalonRestServer(this);
        }
    }
}
