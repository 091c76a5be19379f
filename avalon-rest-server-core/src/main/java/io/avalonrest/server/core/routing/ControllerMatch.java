package io.avalonrest.server.core.routing;

/**
 * Result of a prefix lookup.
 *
 * @param entry the owning handler type
 * @param subPath the unmatched tail, always starting with {@code /}
 */
public record ControllerMatch(RouteEntry entry, String subPath) {}
