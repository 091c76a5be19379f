package io.avalonrest.server.core.binding;

import io.avalonrest.core.AvalonRestException;
import io.avalonrest.core.Headers;
import io.avalonrest.core.Protocol;
import io.avalonrest.json.spi.JsonCodec;
import io.avalonrest.json.spi.JsonException;
import io.avalonrest.json.spi.JsonNode;
import io.avalonrest.server.core.QueryString;
import io.avalonrest.server.core.RequestContext;
import io.avalonrest.server.core.ServerRequest;
import io.avalonrest.server.core.multipart.FormField;
import io.avalonrest.server.core.multipart.FormFile;
import io.avalonrest.server.core.multipart.MultipartDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Produces handler arguments from a request.
 *
 * <p>Per parameter the first applicable source wins: file (when multipart data is present), form
 * (when the request is not JSON), body, header, query, injected context, route capture, declared
 * default, and finally the zero value of the type.
 *
 * <p>A missing header without a default is an error while a missing query parameter falls back to
 * the zero value.
 */
public final class ParameterResolver {

    private static final Logger LOG = LoggerFactory.getLogger(ParameterResolver.class);

    private final JsonCodec codec;
    private final ValueConverter converter;

    public ParameterResolver(JsonCodec codec) {
        this.codec = Objects.requireNonNull(codec, "codec");
        this.converter = new ValueConverter(codec);
    }

    /**
     * Parses the body once for all parameters of a handler.
     *
     * @throws AvalonRestException.BadInput if the JSON or multipart body is malformed
     */
    public RequestSnapshot snapshot(byte[] body, String contentType, List<ParameterBinding> bindings) {
        String mediaType = Headers.mediaType(contentType);
        boolean hasBodyParam = false;
        boolean hasFormParam = false;
        for (ParameterBinding b : bindings) {
            hasBodyParam |= b.source() == ParameterSource.BODY;
            hasFormParam |= b.source() == ParameterSource.FORM || b.source() == ParameterSource.FILE;
        }
        boolean json = mediaType.equals(Protocol.CT_JSON) || mediaType.endsWith("+json") || hasBodyParam;
        if (isBlank(body)) {
            return new RequestSnapshot(body, contentType, json, null, null, null);
        }

        if (json) {
            try {
                return new RequestSnapshot(body, contentType, true, codec.readTree(body), null, null);
            } catch (JsonException e) {
                throw new AvalonRestException.BadInput("Invalid JSON format: " + e.getMessage(), e);
            }
        }
        if (hasFormParam) {
            if (mediaType.equals(Protocol.CT_MULTIPART_FORM_DATA)) {
                Map<String, FormField> parts = MultipartDecoder.parse(body, contentType);
                Map<String, String> text = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
                for (FormField f : parts.values()) {
                    if (!f.isFile()) text.put(f.name(), f.value());
                }
                return new RequestSnapshot(body, contentType, false, null, Collections.unmodifiableMap(text), parts);
            }
            if (mediaType.equals(Protocol.CT_FORM_URLENCODED)) {
                String text = new String(body, StandardCharsets.UTF_8);
                return new RequestSnapshot(body, contentType, false, null, QueryString.parse(text), null);
            }
        }
        return new RequestSnapshot(body, contentType, false, null, null, null);
    }

    /**
     * Resolves every parameter in declaration order.
     *
     * @throws AvalonRestException.BadInput when a value is missing or cannot be converted
     */
    public Object[] resolve(List<ParameterBinding> bindings, RequestContext ctx, RequestSnapshot snapshot) {
        Object[] args = new Object[bindings.size()];
        for (int i = 0; i < args.length; i++) {
            ParameterBinding b = bindings.get(i);
            try {
                args[i] = resolveOne(b, ctx, snapshot);
            } catch (AvalonRestException e) {
                LOG.debug("Cannot resolve parameter '{}': {}", b.name(), e.getMessage());
                throw e;
            }
        }
        return args;
    }

    private Object resolveOne(ParameterBinding b, RequestContext ctx, RequestSnapshot snap) {
        ParameterSource source = b.source();
        if (source == ParameterSource.FILE && snap.multipartFields() != null) {
            return resolveFile(b, snap.multipartFields());
        }
        if (source == ParameterSource.FORM && !snap.isJsonRequest() && snap.hasFormData()) {
            return resolveForm(b, snap);
        }
        switch (source) {
            case BODY:
                return resolveBody(b, snap);
            case HEADER:
                return resolveHeader(b, ctx);
            case QUERY:
                return resolveQuery(b, ctx);
            case CONTEXT:
                return b.type() == ServerRequest.class ? ctx.request() : ctx;
            default:
                break;
        }
        String routeValue = ctx.routeParams().get(b.name());
        if (routeValue != null) {
            return convert(b, routeValue, "route value");
        }
        return fallback(b);
    }

    private Object resolveFile(ParameterBinding b, Map<String, FormField> parts) {
        FormField field = parts.get(b.sourceName());
        if (field == null || !field.isFile()) {
            return fallback(b);
        }
        if (b.fileValidation() != null) {
            FileValidator.Result result = new FileValidator(b.fileValidation()).validate(field);
            for (String warning : result.warnings()) {
                LOG.warn("Upload '{}' ({}): {}", field.fileName(), b.sourceName(), warning);
            }
            if (!result.isValid()) {
                throw new AvalonRestException.BadInput("File validation failed: " + String.join("; ", result.errors()));
            }
        }
        Class<?> type = b.type();
        if (type == FormFile.class || type == FormField.class || type == Object.class) return field;
        if (type == byte[].class) return field.bytes();
        if (type == String.class) return field.fileName();
        if (!ValueConverter.isScalar(type) && !type.isArray() && !type.isInterface()) {
            return ModelBinder.bindFile(type, field);
        }
        return field;
    }

    private Object resolveForm(ParameterBinding b, RequestSnapshot snap) {
        String key = b.sourceName();
        Map<String, String> form = snap.formFields();
        if (form != null && form.containsKey(key)) {
            return convert(b, form.get(key), "form field");
        }
        Map<String, FormField> parts = snap.multipartFields();
        if (parts != null) {
            FormField f = parts.get(key);
            if (f != null && !f.isFile()) {
                return convert(b, f.value(), "form field");
            }
        }
        Class<?> type = b.type();
        if (!ValueConverter.isScalar(type) && !type.isArray() && !type.isInterface()) {
            String prefix = b.sourceName().equals(b.name()) ? "" : b.sourceName();
            return ModelBinder.bindForm(type, prefix, k -> formValue(snap, k), converter);
        }
        return fallback(b);
    }

    private static String formValue(RequestSnapshot snap, String key) {
        if (snap.formFields() != null && snap.formFields().containsKey(key)) {
            return snap.formFields().get(key);
        }
        if (snap.multipartFields() != null) {
            FormField f = snap.multipartFields().get(key);
            if (f != null && !f.isFile()) return f.value();
        }
        return null;
    }

    private Object resolveBody(ParameterBinding b, RequestSnapshot snap) {
        JsonNode doc = snap.document();
        if (doc == null || doc.isNull()) {
            if (b.hasDefault()) return convert(b, b.defaultValue(), "default");
            if (b.required()) {
                throw new AvalonRestException.BadInput("Request body is required for parameter '" + b.name() + "'");
            }
            return ValueConverter.zeroValue(b.type());
        }
        if (b.type() == JsonNode.class) return doc;
        if (b.type() == String.class && !doc.isTextual()) return doc.toJson();
        try {
            Object value = codec.convert(doc, b.genericType());
            if (value == null && b.type().isPrimitive()) return ValueConverter.zeroValue(b.type());
            return value;
        } catch (JsonException e) {
            throw new AvalonRestException.BadInput(
                    "Invalid JSON format for parameter '" + b.name() + "': " + e.getMessage(), e);
        }
    }

    private Object resolveHeader(ParameterBinding b, RequestContext ctx) {
        Set<String> names = nameVariants(b.sourceName());
        for (String name : names) {
            Optional<String> value = ctx.header(name).filter(v -> !v.isEmpty());
            if (value.isPresent()) {
                return convert(b, value.get(), "header");
            }
        }
        if (b.hasDefault()) return convert(b, b.defaultValue(), "default");
        throw new AvalonRestException.BadInput("Missing required header. Tried: " + String.join(", ", names));
    }

    private Object resolveQuery(ParameterBinding b, RequestContext ctx) {
        for (String name : nameVariants(b.sourceName())) {
            String value = ctx.query().get(name);
            if (value != null && !value.isEmpty()) {
                return convert(b, value, "query parameter");
            }
        }
        return fallback(b);
    }

    private Object fallback(ParameterBinding b) {
        if (b.hasDefault()) return convert(b, b.defaultValue(), "default");
        return ValueConverter.zeroValue(b.type());
    }

    private Object convert(ParameterBinding b, String raw, String origin) {
        try {
            return converter.convert(raw, b.type(), b.genericType());
        } catch (IllegalArgumentException e) {
            throw new AvalonRestException.BadInput("Cannot convert " + origin + " '" + raw + "' of parameter '"
                    + b.name() + "' to type '" + b.type().getSimpleName() + "'", e);
        }
    }

    static Set<String> nameVariants(String name) {
        Set<String> names = new LinkedHashSet<>();
        names.add(name);
        names.add(name.replace('_', '-'));
        names.add(name.replace('-', '_'));
        return names;
    }

    private static boolean isBlank(byte[] body) {
        if (body == null) return true;
        for (byte b : body) {
            if (b != ' ' && b != '\t' && b != '\r' && b != '\n') return false;
        }
        return true;
    }
}
