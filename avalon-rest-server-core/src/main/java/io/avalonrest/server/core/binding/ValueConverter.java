package io.avalonrest.server.core.binding;

import io.avalonrest.json.spi.JsonCodec;
import io.avalonrest.json.spi.JsonException;

import java.lang.reflect.Constructor;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.temporal.Temporal;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Converts request strings (headers, query values, form fields, route captures) to parameter types.
 *
 * <p>Strings that look like JSON objects or arrays are bound through the {@link JsonCodec} first.
 * Otherwise booleans (including {@code 1}/{@code 0}), numbers, UUIDs, enums (case-insensitive),
 * {@code java.time} values and {@link Optional} wrappers are recognized, falling back to a public
 * static {@code valueOf(String)}, {@code of(String)} or {@code fromString(String)} factory or a
 * public {@code (String)} constructor.
 */
public final class ValueConverter {

    private static final Map<Class<?>, Object> ZERO = Map.of(
            boolean.class, false,
            char.class, '\0',
            byte.class, (byte) 0,
            short.class, (short) 0,
            int.class, 0,
            long.class, 0L,
            float.class, 0f,
            double.class, 0d);

    private final JsonCodec codec;

    public ValueConverter(JsonCodec codec) {
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    /**
     * @throws IllegalArgumentException if {@code raw} cannot be converted
     */
    public Object convert(String raw, Class<?> type, Type genericType) {
        if (type == String.class || type == Object.class || type == CharSequence.class) return raw;
        if (type == Optional.class) {
            if (raw == null || raw.isBlank()) return Optional.empty();
            Type inner = typeArgument(genericType);
            Class<?> innerClass = inner instanceof Class<?> c ? c : rawClass(inner);
            return Optional.ofNullable(convert(raw, innerClass, inner));
        }
        if (raw == null) return zeroValue(type);
        String value = raw.trim();
        if (!type.isPrimitive() && value.isEmpty()) return null;

        if (looksLikeJson(value)) {
            try {
                return codec.readValue(value, genericType);
            } catch (JsonException e) {
                if (!isScalar(type)) {
                    throw new IllegalArgumentException(e.getMessage(), e);
                }
            }
        }

        try {
            Object converted = convertScalar(value, type);
            if (converted != null) return converted;
        } catch (IllegalArgumentException | java.time.DateTimeException e) {
            throw new IllegalArgumentException(e.getMessage(), e);
        }
        return viaFactory(value, type);
    }

    private static Object convertScalar(String v, Class<?> type) {
        if (type == boolean.class || type == Boolean.class) return parseBoolean(v);
        if (type == int.class || type == Integer.class) return Integer.valueOf(v);
        if (type == long.class || type == Long.class) return Long.valueOf(v);
        if (type == double.class || type == Double.class) return Double.valueOf(v);
        if (type == float.class || type == Float.class) return Float.valueOf(v);
        if (type == short.class || type == Short.class) return Short.valueOf(v);
        if (type == byte.class || type == Byte.class) return Byte.valueOf(v);
        if (type == char.class || type == Character.class) {
            if (v.length() != 1) throw new IllegalArgumentException("Expected a single character");
            return v.charAt(0);
        }
        if (type == BigDecimal.class) return new BigDecimal(v);
        if (type == BigInteger.class) return new BigInteger(v);
        if (type == UUID.class) return UUID.fromString(v);
        if (type.isEnum()) return parseEnum(v, type);
        if (type == Instant.class) return Instant.parse(v);
        if (type == LocalDate.class) return LocalDate.parse(v);
        if (type == LocalDateTime.class) return LocalDateTime.parse(v);
        if (type == OffsetDateTime.class) return OffsetDateTime.parse(v);
        if (type == Duration.class) return Duration.parse(v);
        return null;
    }

    private static Boolean parseBoolean(String v) {
        if (v.equalsIgnoreCase("true") || v.equals("1")) return Boolean.TRUE;
        if (v.equalsIgnoreCase("false") || v.equals("0")) return Boolean.FALSE;
        throw new IllegalArgumentException("Not a boolean");
    }

    private static Object parseEnum(String v, Class<?> type) {
        for (Object constant : type.getEnumConstants()) {
            if (((Enum<?>) constant).name().equalsIgnoreCase(v)) return constant;
        }
        throw new IllegalArgumentException("Not one of " + java.util.Arrays.toString(type.getEnumConstants()));
    }

    private static Object viaFactory(String v, Class<?> type) {
        for (String factory : new String[]{"valueOf", "of", "fromString", "parse"}) {
            try {
                Method m = type.getMethod(factory, String.class);
                if (Modifier.isStatic(m.getModifiers()) && type.isAssignableFrom(m.getReturnType())) {
                    return m.invoke(null, v);
                }
            } catch (NoSuchMethodException ignored) {
                // try the next factory name
            } catch (ReflectiveOperationException e) {
                throw new IllegalArgumentException(rootMessage(e), e);
            }
        }
        try {
            Constructor<?> ctor = type.getConstructor(String.class);
            return ctor.newInstance(v);
        } catch (NoSuchMethodException e) {
            throw new IllegalArgumentException("No string conversion available", e);
        } catch (ReflectiveOperationException e) {
            throw new IllegalArgumentException(rootMessage(e), e);
        }
    }

    /**
     * Value used for an absent parameter: 0/false for primitives, empty for Optional, null otherwise.
     */
    public static Object zeroValue(Class<?> type) {
        if (type == Optional.class) return Optional.empty();
        return type.isPrimitive() ? ZERO.get(type) : null;
    }

    /**
     * True for types bound from a single string rather than property by property.
     */
    public static boolean isScalar(Class<?> type) {
        return type.isPrimitive()
                || type == String.class
                || type == CharSequence.class
                || type == Boolean.class
                || type == Character.class
                || Number.class.isAssignableFrom(type)
                || type == UUID.class
                || type.isEnum()
                || Temporal.class.isAssignableFrom(type)
                || type == Duration.class
                || type == Optional.class;
    }

    static boolean looksLikeJson(String v) {
        return (v.startsWith("{") && v.endsWith("}")) || (v.startsWith("[") && v.endsWith("]"));
    }

    private static Type typeArgument(Type generic) {
        if (generic instanceof ParameterizedType pt && pt.getActualTypeArguments().length == 1) {
            return pt.getActualTypeArguments()[0];
        }
        return String.class;
    }

    private static Class<?> rawClass(Type type) {
        if (type instanceof ParameterizedType pt && pt.getRawType() instanceof Class<?> c) return c;
        return Object.class;
    }

    private static String rootMessage(Throwable t) {
        Throwable cur = t;
        while (cur.getCause() != null) cur = cur.getCause();
        return cur.getMessage() == null ? cur.getClass().getSimpleName() : cur.getMessage();
    }
}
