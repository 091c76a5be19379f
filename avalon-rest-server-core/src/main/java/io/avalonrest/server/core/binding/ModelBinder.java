package io.avalonrest.server.core.binding;

import io.avalonrest.server.core.multipart.FormField;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.Type;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * Fills plain model objects property by property.
 *
 * <p>A writable property is a public one-argument {@code setX} method or, failing that, a
 * non-static non-final field. Models need a no-argument constructor.
 */
final class ModelBinder {

    private static final Logger LOG = LoggerFactory.getLogger(ModelBinder.class);

    private ModelBinder() {}

    /**
     * Binds form values. Each property is looked up under {@code prefix.property} when a prefix is
     * given, else under its own name. Conversion failures are logged and the property left unset.
     */
    static Object bindForm(Class<?> type, String prefix, Function<String, String> lookup, ValueConverter converter) {
        Object instance = instantiate(type);
        for (Property p : properties(type).values()) {
            String key = prefix == null || prefix.isEmpty() ? p.name : prefix + "." + p.name;
            String raw = lookup.apply(key);
            if (raw == null) continue;
            try {
                p.set(instance, converter.convert(raw, p.type, p.genericType));
            } catch (RuntimeException e) {
                LOG.warn("Skipping form field '{}' for {}: {}", key, type.getSimpleName(), e.getMessage());
            }
        }
        return instance;
    }

    /**
     * Copies a file part onto properties named {@code filename}, {@code contentType},
     * {@code data|content|fileData} ({@code byte[]}) and {@code size|length} ({@code int}/{@code long}).
     */
    static Object bindFile(Class<?> type, FormField file) {
        Object instance = instantiate(type);
        for (Property p : properties(type).values()) {
            switch (p.name.toLowerCase(Locale.ROOT)) {
                case "filename" -> {
                    if (p.type == String.class) p.set(instance, file.fileName());
                }
                case "contenttype" -> {
                    if (p.type == String.class) p.set(instance, file.contentType());
                }
                case "data", "content", "filedata" -> {
                    if (p.type == byte[].class) p.set(instance, file.bytes());
                }
                case "size", "length" -> {
                    if (p.type == long.class || p.type == Long.class) p.set(instance, file.size());
                    else if (p.type == int.class || p.type == Integer.class) p.set(instance, (int) file.size());
                }
                default -> {
                }
            }
        }
        return instance;
    }

    private static Object instantiate(Class<?> type) {
        try {
            Constructor<?> ctor = type.getDeclaredConstructor();
            ctor.setAccessible(true);
            return ctor.newInstance();
        } catch (ReflectiveOperationException e) {
            throw new IllegalStateException("Cannot instantiate " + type.getName()
                    + "; model types need a no-argument constructor", e);
        }
    }

    private static Map<String, Property> properties(Class<?> type) {
        Map<String, Property> out = new LinkedHashMap<>();
        for (Method m : type.getMethods()) {
            if (Modifier.isStatic(m.getModifiers()) || m.getParameterCount() != 1) continue;
            String n = m.getName();
            if (n.length() <= 3 || !n.startsWith("set")) continue;
            String name = decapitalize(n.substring(3));
            out.putIfAbsent(name, new Property(name, m.getParameterTypes()[0], m.getGenericParameterTypes()[0], m, null));
        }
        for (Class<?> c = type; c != null && c != Object.class; c = c.getSuperclass()) {
            for (Field f : c.getDeclaredFields()) {
                int mod = f.getModifiers();
                if (Modifier.isStatic(mod) || Modifier.isFinal(mod) || f.isSynthetic()) continue;
                out.putIfAbsent(f.getName(), new Property(f.getName(), f.getType(), f.getGenericType(), null, f));
            }
        }
        return out;
    }

    private static String decapitalize(String s) {
        if (s.length() > 1 && Character.isUpperCase(s.charAt(0)) && Character.isUpperCase(s.charAt(1))) return s;
        return Character.toLowerCase(s.charAt(0)) + s.substring(1);
    }

    private static final class Property {
        final String name;
        final Class<?> type;
        final Type genericType;
        private final Method setter;
        private final Field field;

        Property(String name, Class<?> type, Type genericType, Method setter, Field field) {
            this.name = name;
            this.type = type;
            this.genericType = genericType;
            this.setter = setter;
            this.field = field;
        }

        void set(Object target, Object value) {
            if (value == null && type.isPrimitive()) return;
            try {
                if (setter != null) {
                    setter.invoke(target, value);
                } else {
                    field.setAccessible(true);
                    field.set(target, value);
                }
            } catch (ReflectiveOperationException e) {
                throw new IllegalStateException("Cannot set property '" + name + "'", e);
            }
        }
    }
}
