package io.avalonrest.server.core.binding;

/**
 * Where a handler parameter takes its value from.
 */
public enum ParameterSource {
    BODY,
    HEADER,
    QUERY,
    FORM,
    FILE,
    /** {@code RequestContext} or {@code ServerRequest} injection. */
    CONTEXT,
    /** Untagged: a route capture of the same name, else the default, else the zero value. */
    ROUTE
}
