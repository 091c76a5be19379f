package io.avalonrest.server.core.routing;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RouteTemplateTest {

    @Test
    void parsesLiteralsAndPlaceholders() {
        RouteTemplate t = RouteTemplate.parse("/orders/{orderId}/items/{itemId}/");
        assertThat(t.size()).isEqualTo(4);
        assertThat(t.literalCount()).isEqualTo(2);
        assertThat(t).hasToString("/orders/{orderId}/items/{itemId}");
    }

    @Test
    void capturesPlaceholders() {
        RouteTemplate t = RouteTemplate.parse("orders/{orderId}/items/{itemId}");
        assertThat(t.match(List.of("ORDERS", "7", "items", "x1")))
                .hasValueSatisfying(m -> {
                    assertThat(m).containsEntry("orderId", "7");
                    assertThat(m).containsEntry("itemId", "x1");
                });
        assertThat(t.match(List.of("orders", "7", "lines", "x1"))).isEmpty();
    }

    @Test
    void emptySegmentsAreIgnored() {
        assertThat(RoutePaths.segments("//api///User/")).containsExactly("api", "user");
        assertThat(RoutePaths.normalize("/Api/User/")).isEqualTo("api/user");
    }
}
