package io.avalonrest.server.core;

import io.avalonrest.server.spi.VerifiedIdentity;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Optional base class for handlers, giving access to the request context and result helpers.
 *
 * <p>A fresh handler instance serves each request, so the context never leaks across requests.
 */
public abstract class ControllerBase {

    private RequestContext context;

    void bind(RequestContext context) {
        this.context = context;
    }

    protected RequestContext context() {
        return context;
    }

    protected Optional<VerifiedIdentity> user() {
        return context == null ? Optional.empty() : context.identity();
    }

    protected ActionResult ok() {
        return new ActionResult.Status(200);
    }

    protected ActionResult ok(Object value) {
        return ActionResult.ok(value);
    }

    protected ActionResult created(Object value) {
        return new ActionResult.Value(201, value);
    }

    protected ActionResult noContent() {
        return new ActionResult.Status(204);
    }

    protected ActionResult status(int status, Object value) {
        return new ActionResult.Value(status, value);
    }

    protected ActionResult badRequest(String message) {
        return ActionResult.error(400, message);
    }

    protected ActionResult unauthorized(String message) {
        return ActionResult.error(401, message);
    }

    protected ActionResult forbidden(String message) {
        return ActionResult.error(403, message);
    }

    protected ActionResult notFound(String message) {
        return ActionResult.error(404, message);
    }

    protected ActionResult internalServerError(String message) {
        return ActionResult.error(500, message);
    }

    protected ActionResult content(String content, String contentType) {
        return new ActionResult.Content(200, content, contentType, StandardCharsets.UTF_8);
    }

    protected ActionResult file(byte[] bytes, String contentType, String fileName) {
        return new ActionResult.File(bytes, contentType, fileName);
    }

    protected ActionResult stream(InputStream stream, String contentType, String fileName, boolean attachment) {
        return new ActionResult.StreamFile(stream, contentType, fileName, attachment);
    }
}
