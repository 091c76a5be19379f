package io.avalonrest.server.core.routing;

import io.avalonrest.core.HttpMethod;
import io.avalonrest.server.core.binding.ParameterBinding;
import io.avalonrest.server.core.binding.ParameterSource;

import java.lang.reflect.Method;
import java.util.List;
import java.util.Objects;

/**
 * A routable handler method with its binding plan.
 */
public record HandlerMethod(
        Method method,
        HttpMethod httpMethod,
        RouteTemplate template,
        int order,
        AuthRequirement auth,
        List<ParameterBinding> parameters
) {

    public HandlerMethod {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(httpMethod, "httpMethod");
        Objects.requireNonNull(template, "template");
        Objects.requireNonNull(auth, "auth");
        parameters = List.copyOf(parameters);
    }

    public boolean hasBodyParameter() {
        for (ParameterBinding p : parameters) {
            if (p.source() == ParameterSource.BODY) return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return httpMethod + " " + template + " -> " + method.getDeclaringClass().getSimpleName() + "." + method.getName();
    }
}
