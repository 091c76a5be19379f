package io.avalonrest.example;

import io.avalonrest.httpserver.AvalonRestServer;
import io.avalonrest.httpserver.ServerSettings;
import io.avalonrest.json.spi.JsonCodec;
import io.avalonrest.json.spi.JsonCodecs;
import io.avalonrest.server.core.RequestDispatcher;
import io.avalonrest.server.core.routing.RouteRegistry;
import io.avalonrest.server.core.security.JsonFileBlockRecordStore;
import io.avalonrest.server.core.security.SlidingWindowRateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.Properties;
import java.util.concurrent.CountDownLatch;

/**
 * Sample application wiring the dispatcher, the rate limiter and the JDK host together.
 */
public final class ExampleApplication implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ExampleApplication.class);

    private final SlidingWindowRateLimiter limiter;
    private final AvalonRestServer server;

    private ExampleApplication(SlidingWindowRateLimiter limiter, AvalonRestServer server) {
        this.limiter = limiter;
        this.server = server;
    }

    /**
     * Builds and starts the application.
     *
     * @param props contents of {@code avalon-rest.properties}, including the {@code auth.token.*} table
     * @param uploads directory holding uploaded files
     */
    public static ExampleApplication start(Properties props, Path uploads) throws IOException {
        ServerSettings settings = ServerSettings.load(props);
        JsonCodec codec = JsonCodecs.load();

        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(
                settings.rateLimitConfig(),
                new JsonFileBlockRecordStore(settings.blockListFile(), codec));
        limiter.start();

        FileStore files = new FileStore(uploads);
        UserController.Directory users = new UserController.Directory();
        RouteRegistry routes = RouteRegistry.builder()
                .register(UserController.class, () -> new UserController(users))
                .register(AdminController.class, () -> new AdminController(limiter))
                .register(FileController.class, () -> new FileController(files))
                .register(UploadController.class, () -> new UploadController(files))
                .build();

        RequestDispatcher dispatcher = RequestDispatcher.builder(routes)
                .codec(codec)
                .rateLimiter(limiter)
                .tokenVerifier(StaticTokenVerifier.fromProperties(props))
                .cors(settings.corsPolicy())
                .relaxedCspForDocs(settings.relaxedCspForDocs())
                .maxBodySize(settings.maxBodySize())
                .trustedProxies(settings.trustedProxies())
                .build();

        AvalonRestServer server = AvalonRestServer.builder()
                .host(settings.host())
                .port(settings.port())
                .dispatcher(dispatcher)
                .build();
        try {
            server.start();
        } catch (RuntimeException e) {
            limiter.close();
            throw e;
        }
        LOG.info("Registered routes: {}", routes.routes());
        return new ExampleApplication(limiter, server);
    }

    public int port() {
        return server.port();
    }

    @Override
    public void close() {
        server.close();
        limiter.close();
    }

    static Properties loadProperties() throws IOException {
        Properties props = new Properties();
        try (InputStream in = ExampleApplication.class.getClassLoader().getResourceAsStream(ServerSettings.RESOURCE)) {
            if (in != null) props.load(in);
        }
        return props;
    }

    public static void main(String[] args) throws Exception {
        Path uploads = Path.of(args.length > 0 ? args[0] : "uploads");
        ExampleApplication app = start(loadProperties(), uploads);
        CountDownLatch shutdown = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            app.close();
            shutdown.countDown();
        }, "avalon-rest-shutdown"));
        LOG.info("Example application started on port {}", app.port());
        shutdown.await();
    }
}
