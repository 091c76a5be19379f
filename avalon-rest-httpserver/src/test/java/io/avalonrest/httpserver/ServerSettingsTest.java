package io.avalonrest.httpserver;

import io.avalonrest.server.core.RequestDispatcher;
import io.avalonrest.server.core.response.CorsPolicy;
import io.avalonrest.server.core.security.RateLimitConfig;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ServerSettingsTest {

    @Test
    void emptyPropertiesGiveDefaults() {
        ServerSettings settings = ServerSettings.load(new Properties());

        assertThat(settings.port()).isEqualTo(8080);
        assertThat(settings.host()).isNull();
        assertThat(settings.trustedProxies()).isEmpty();
        assertThat(settings.maxBodySize()).isEqualTo(RequestDispatcher.DEFAULT_MAX_BODY_SIZE);
        assertThat(settings.blockListFile()).isEqualTo(Path.of("logs/blocked-ips.json"));
        assertThat(settings.corsPolicy().allowOrigin()).isEqualTo("*");

        RateLimitConfig config = settings.rateLimitConfig();
        assertThat(config.defaultMaxRequests()).isEqualTo(100);
        assertThat(config.endpointLimits()).isEqualTo(RateLimitConfig.defaults().endpointLimits());
    }

    @Test
    void readsOverrides() {
        Properties props = new Properties();
        props.setProperty("server.port", "9090");
        props.setProperty("server.max-body-size-mb", "2");
        props.setProperty("server.trusted-proxies", "10.0.0.2, 10.0.0.3");
        props.setProperty("cors.allow-origin", "https://app.example");
        props.setProperty("cors.allow-credentials", "false");
        props.setProperty("rate-limit.default.max-requests", "50");
        props.setProperty("rate-limit.default.window", "30s");
        props.setProperty("rate-limit.block-duration", "PT5M");
        props.setProperty("rate-limit.whitelist", "127.0.0.1, ::1");
        props.setProperty("rate-limit.endpoint.0.path", "/api/login");
        props.setProperty("rate-limit.endpoint.0.max-requests", "3");
        props.setProperty("rate-limit.endpoint.0.window", "1m");

        ServerSettings settings = ServerSettings.load(props);
        CorsPolicy cors = settings.corsPolicy();
        RateLimitConfig config = settings.rateLimitConfig();

        assertThat(settings.port()).isEqualTo(9090);
        assertThat(settings.maxBodySize()).isEqualTo(2L * 1024 * 1024);
        assertThat(settings.trustedProxies()).containsExactly("10.0.0.2", "10.0.0.3");
        assertThat(cors.allowOrigin()).isEqualTo("https://app.example");
        assertThat(cors.allowCredentials()).isFalse();
        assertThat(config.defaultMaxRequests()).isEqualTo(50);
        assertThat(config.defaultWindow()).isEqualTo(Duration.ofSeconds(30));
        assertThat(config.blockDuration()).isEqualTo(Duration.ofMinutes(5));
        assertThat(config.whitelist()).containsExactly("127.0.0.1", "::1");
        assertThat(config.endpointLimits()).hasSize(1);
        assertThat(config.limitFor("/api/login/now").maxRequests()).isEqualTo(3);
    }

    @Test
    void parsesDurations() {
        assertThat(ServerSettings.parseDuration("250ms")).isEqualTo(Duration.ofMillis(250));
        assertThat(ServerSettings.parseDuration("15m")).isEqualTo(Duration.ofMinutes(15));
        assertThat(ServerSettings.parseDuration("3d")).isEqualTo(Duration.ofDays(3));
        assertThat(ServerSettings.parseDuration("pt1h")).isEqualTo(Duration.ofHours(1));
        assertThat(ServerSettings.parseDuration("45")).isEqualTo(Duration.ofSeconds(45));
    }

    @Test
    void rejectsMalformedValues() {
        Properties props = new Properties();
        props.setProperty("server.port", "eighty");
        props.setProperty("rate-limit.block-duration", "soon");
        ServerSettings settings = ServerSettings.load(props);

        assertThatThrownBy(settings::port).hasMessageContaining("server.port");
        assertThatThrownBy(settings::rateLimitConfig).hasMessageContaining("rate-limit.block-duration");
    }

    @Test
    void missingClasspathResourceGivesDefaults() {
        assertThat(ServerSettings.fromClasspath("does-not-exist.properties").port()).isEqualTo(8080);
    }
}
