package io.avalonrest.server.core.routing;

import io.avalonrest.core.HttpMethod;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * A handler type registered under a path prefix.
 *
 * @param prefix normalized prefix ({@code api/user})
 * @param segments prefix segments
 * @param handlerType the handler class
 * @param factory creates one handler instance per request
 * @param methods routable methods in matching order
 */
public record RouteEntry(
        String prefix,
        List<String> segments,
        Class<?> handlerType,
        Supplier<?> factory,
        List<HandlerMethod> methods
) {

    public RouteEntry {
        Objects.requireNonNull(prefix, "prefix");
        Objects.requireNonNull(handlerType, "handlerType");
        Objects.requireNonNull(factory, "factory");
        segments = List.copyOf(segments);
        methods = List.copyOf(methods);
    }

    /**
     * Finds the first method whose verb and template match; templates are tried in registration order.
     */
    public Optional<RouteMatch> findMethod(HttpMethod verb, String subPath) {
        List<String> requested = RoutePaths.segments(subPath);
        for (HandlerMethod m : methods) {
            if (m.httpMethod() != verb) continue;
            Optional<Map<String, String>> captures = m.template().match(requested);
            if (captures.isPresent()) {
                return Optional.of(new RouteMatch(this, m, subPath, captures.get()));
            }
        }
        return Optional.empty();
    }
}
