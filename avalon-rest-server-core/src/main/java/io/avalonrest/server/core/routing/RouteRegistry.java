package io.avalonrest.server.core.routing;

import io.avalonrest.server.core.annotation.Controller;
import io.avalonrest.server.core.annotation.Route;
import io.avalonrest.server.core.binding.ParameterBinding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.Parameter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Immutable table of handler types by path prefix.
 *
 * <p>Handler types are registered explicitly at startup:
 * <pre>{@code
 * RouteRegistry routes = RouteRegistry.builder()
 *     .register(UserController.class, UserController::new)
 *     .register(AdminController.class, AdminController::new)
 *     .build();
 * }</pre>
 *
 * <p>Lookups try prefixes by segment count, then literal length, both descending, so the most
 * specific prefix wins. The table is never mutated after {@link Builder#build()}.
 */
public final class RouteRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(RouteRegistry.class);

    private static final Comparator<RouteEntry> SPECIFICITY = Comparator
            .comparingInt((RouteEntry e) -> e.segments().size()).reversed()
            .thenComparing(Comparator.comparingInt((RouteEntry e) -> e.prefix().length()).reversed())
            .thenComparing(RouteEntry::prefix);

    private static final Comparator<HandlerMethod> MATCH_ORDER = Comparator
            .comparingInt(HandlerMethod::order)
            .thenComparing(Comparator.comparingInt((HandlerMethod m) -> m.template().literalCount()).reversed())
            .thenComparing(m -> m.method().getName())
            .thenComparing(m -> m.template().toString());

    private final List<RouteEntry> entries;

    private RouteRegistry(List<RouteEntry> entries) {
        List<RouteEntry> sorted = new ArrayList<>(entries);
        sorted.sort(SPECIFICITY);
        this.entries = List.copyOf(sorted);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Finds the handler type owning {@code path}.
     *
     * @return the match with the unmatched tail as sub-path, or empty when no prefix fits
     */
    public Optional<ControllerMatch> findController(String path) {
        List<String> requested = RoutePaths.segments(path);
        for (RouteEntry e : entries) {
            List<String> prefix = e.segments();
            if (requested.size() < prefix.size()) continue;
            boolean matches = true;
            for (int i = 0; i < prefix.size(); i++) {
                if (!prefix.get(i).equalsIgnoreCase(requested.get(i))) {
                    matches = false;
                    break;
                }
            }
            if (matches) {
                String subPath = "/" + String.join("/", requested.subList(prefix.size(), requested.size()));
                return Optional.of(new ControllerMatch(e, subPath));
            }
        }
        return Optional.empty();
    }

    /**
     * Registered prefixes in lookup order.
     */
    public List<String> routes() {
        List<String> out = new ArrayList<>(entries.size());
        for (RouteEntry e : entries) out.add("/" + e.prefix());
        return out;
    }

    public List<RouteEntry> entries() {
        return entries;
    }

    /**
     * Derives the prefix for a handler type: lowercased, slashes trimmed, {@code [controller]} substituted.
     */
    static String prefixOf(Class<?> type) {
        Controller controller = type.getAnnotation(Controller.class);
        String route = controller != null ? controller.route() : Controller.CONTROLLER_TOKEN;
        String name = type.getSimpleName().toLowerCase(Locale.ROOT);
        if (name.endsWith("controller") && name.length() > "controller".length()) {
            name = name.substring(0, name.length() - "controller".length());
        }
        return RoutePaths.normalize(route.toLowerCase(Locale.ROOT).replace(Controller.CONTROLLER_TOKEN, name));
    }

    /**
     * Builder for {@link RouteRegistry}.
     */
    public static final class Builder {
        private final Map<String, RouteEntry> byPrefix = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Registers a handler type created by its public no-argument constructor.
         */
        public <T> Builder register(Class<T> type) {
            Objects.requireNonNull(type, "type");
            final Constructor<T> ctor;
            try {
                ctor = type.getConstructor();
                ctor.setAccessible(true);
            } catch (NoSuchMethodException e) {
                throw new IllegalArgumentException(type.getName() + " has no public no-argument constructor", e);
            }
            return register(type, () -> {
                try {
                    return ctor.newInstance();
                } catch (ReflectiveOperationException e) {
                    throw new IllegalStateException("Cannot create " + type.getName(), e);
                }
            });
        }

        /**
         * Registers a handler type with the factory that creates one instance per request.
         *
         * @throws IllegalArgumentException if the prefix is already taken or a method is not routable
         */
        public <T> Builder register(Class<T> type, Supplier<? extends T> factory) {
            Objects.requireNonNull(type, "type");
            Objects.requireNonNull(factory, "factory");
            String prefix = prefixOf(type);
            RouteEntry existing = byPrefix.get(prefix);
            if (existing != null) {
                throw new IllegalArgumentException("Route prefix '/" + prefix + "' of " + type.getName()
                        + " is already registered by " + existing.handlerType().getName());
            }

            List<HandlerMethod> methods = new ArrayList<>();
            for (Method m : type.getMethods()) {
                Route route = m.getAnnotation(Route.class);
                if (route == null) continue;
                if (Modifier.isStatic(m.getModifiers())) {
                    throw new IllegalArgumentException("Route method " + m + " must not be static");
                }
                m.setAccessible(true); // handler types need not be public
                List<ParameterBinding> bindings = new ArrayList<>();
                for (Parameter p : m.getParameters()) {
                    if (!p.isNamePresent()) {
                        LOG.warn("Parameter names of {} are not available; compile with -parameters", m);
                    }
                    bindings.add(ParameterBinding.of(p));
                }
                methods.add(new HandlerMethod(m, route.method(), RouteTemplate.parse(route.path()), route.order(),
                        AuthRequirement.resolve(m, type), bindings));
            }
            methods.sort(MATCH_ORDER);

            byPrefix.put(prefix, new RouteEntry(prefix, RoutePaths.segments(prefix), type, factory, methods));
            LOG.info("Registered {} under /{} with {} route(s)", type.getSimpleName(), prefix, methods.size());
            for (HandlerMethod hm : methods) {
                LOG.debug("  {}", hm);
            }
            return this;
        }

        public RouteRegistry build() {
            return new RouteRegistry(new ArrayList<>(byPrefix.values()));
        }
    }
}
