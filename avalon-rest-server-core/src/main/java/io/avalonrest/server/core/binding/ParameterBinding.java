package io.avalonrest.server.core.binding;

import io.avalonrest.server.core.RequestContext;
import io.avalonrest.server.core.ServerRequest;
import io.avalonrest.server.core.annotation.DefaultValue;
import io.avalonrest.server.core.annotation.FileValidation;
import io.avalonrest.server.core.annotation.FromBody;
import io.avalonrest.server.core.annotation.FromFile;
import io.avalonrest.server.core.annotation.FromForm;
import io.avalonrest.server.core.annotation.FromHeader;
import io.avalonrest.server.core.annotation.FromQuery;

import java.lang.reflect.Parameter;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Binding plan for one handler parameter, computed once at registration.
 *
 * @param name declared parameter name
 * @param type erased parameter type
 * @param genericType full parameter type
 * @param source value source
 * @param sourceName header, query or form key; defaults to {@code name}
 * @param defaultValue textual default, or null
 * @param required for body parameters, whether an absent body is an error
 * @param fileValidation upload checks for file parameters, or null
 */
public record ParameterBinding(
        String name,
        Class<?> type,
        Type genericType,
        ParameterSource source,
        String sourceName,
        String defaultValue,
        boolean required,
        FileValidationOptions fileValidation
) {

    public ParameterBinding {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(source, "source");
        genericType = genericType == null ? type : genericType;
        sourceName = sourceName == null || sourceName.isEmpty() ? name : sourceName;
    }

    public boolean hasDefault() {
        return defaultValue != null;
    }

    /**
     * Reads the binding annotations of a reflected parameter.
     *
     * @throws IllegalArgumentException if more than one source annotation is present
     */
    public static ParameterBinding of(Parameter parameter) {
        FromBody body = parameter.getAnnotation(FromBody.class);
        FromHeader header = parameter.getAnnotation(FromHeader.class);
        FromQuery query = parameter.getAnnotation(FromQuery.class);
        FromForm form = parameter.getAnnotation(FromForm.class);
        FromFile file = parameter.getAnnotation(FromFile.class);

        List<String> tags = new ArrayList<>();
        ParameterSource source = null;
        String sourceName = null;
        if (body != null) {
            tags.add("@FromBody");
            source = ParameterSource.BODY;
        }
        if (header != null) {
            tags.add("@FromHeader");
            source = ParameterSource.HEADER;
            sourceName = header.name();
        }
        if (query != null) {
            tags.add("@FromQuery");
            source = ParameterSource.QUERY;
            sourceName = query.name();
        }
        if (form != null) {
            tags.add("@FromForm");
            source = ParameterSource.FORM;
            sourceName = form.name();
        }
        if (file != null) {
            tags.add("@FromFile");
            source = ParameterSource.FILE;
            sourceName = file.name();
        }
        if (tags.size() > 1) {
            throw new IllegalArgumentException("Parameter '" + parameter.getName() + "' of "
                    + parameter.getDeclaringExecutable() + " has conflicting sources " + tags);
        }
        Class<?> type = parameter.getType();
        if (source == null) {
            source = type == RequestContext.class || type == ServerRequest.class
                    ? ParameterSource.CONTEXT
                    : ParameterSource.ROUTE;
        }

        DefaultValue dv = parameter.getAnnotation(DefaultValue.class);
        FileValidation fv = parameter.getAnnotation(FileValidation.class);
        return new ParameterBinding(
                parameter.getName(),
                type,
                parameter.getParameterizedType(),
                source,
                sourceName,
                dv == null ? null : dv.value(),
                body == null || body.required(),
                fv == null ? null : FileValidationOptions.from(fv));
    }
}
