package io.avalonrest.server.core.routing;

import io.avalonrest.core.Protocol;
import io.avalonrest.server.core.annotation.AllowAnonymous;
import io.avalonrest.server.core.annotation.Authorize;

import java.lang.reflect.Method;
import java.util.List;

/**
 * Authorization demanded by a handler method.
 *
 * @param required whether a verified credential is needed
 * @param roles roles of which at least one must be held; empty means any identity
 * @param scheme authentication scheme
 */
public record AuthRequirement(boolean required, List<String> roles, String scheme) {

    public static final AuthRequirement NONE = new AuthRequirement(false, List.of(), Protocol.SCHEME_BEARER);

    public AuthRequirement {
        roles = roles == null ? List.of() : List.copyOf(roles);
        scheme = scheme == null || scheme.isBlank() ? Protocol.SCHEME_BEARER : firstScheme(scheme);
    }

    /**
     * Resolves the effective requirement. Precedence: method {@code @AllowAnonymous}, method
     * {@code @Authorize}, type {@code @AllowAnonymous}, type {@code @Authorize}.
     */
    public static AuthRequirement resolve(Method method, Class<?> type) {
        if (method.isAnnotationPresent(AllowAnonymous.class)) return NONE;
        Authorize onMethod = method.getAnnotation(Authorize.class);
        if (onMethod != null) return of(onMethod);
        if (type.isAnnotationPresent(AllowAnonymous.class)) return NONE;
        Authorize onType = type.getAnnotation(Authorize.class);
        return onType != null ? of(onType) : NONE;
    }

    private static AuthRequirement of(Authorize a) {
        return new AuthRequirement(true, List.of(a.roles()), a.scheme());
    }

    private static String firstScheme(String schemes) {
        int comma = schemes.indexOf(',');
        return (comma >= 0 ? schemes.substring(0, comma) : schemes).trim();
    }
}
