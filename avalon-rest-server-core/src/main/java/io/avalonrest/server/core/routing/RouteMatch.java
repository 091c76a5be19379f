package io.avalonrest.server.core.routing;

import java.util.Map;

/**
 * A fully resolved route: handler type, method and captured placeholder values.
 */
public record RouteMatch(RouteEntry entry, HandlerMethod handler, String subPath, Map<String, String> routeParams) {

    public RouteMatch {
        routeParams = Map.copyOf(routeParams);
    }
}
