package io.avalonrest.server.core.binding;

import io.avalonrest.server.core.annotation.FileValidation;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Upload checks applied by {@link FileValidator}.
 *
 * @param maxFileSize maximum size in bytes
 * @param allowedExtensions lowercase extensions including the dot; empty allows any not prohibited
 * @param allowedMimeTypes allowed declared content types; empty allows any
 * @param prohibitedExtensions extensions always rejected
 * @param validateContent whether to sniff magic numbers
 */
public record FileValidationOptions(
        long maxFileSize,
        List<String> allowedExtensions,
        List<String> allowedMimeTypes,
        List<String> prohibitedExtensions,
        boolean validateContent
) {

    public static final long DEFAULT_MAX_FILE_SIZE = 10L * 1024 * 1024;

    public static final List<String> DEFAULT_PROHIBITED_EXTENSIONS =
            List.of(".exe", ".bat", ".cmd", ".com", ".pif", ".scr", ".vbs", ".js");

    public FileValidationOptions {
        allowedExtensions = normalizeExtensions(allowedExtensions);
        allowedMimeTypes = allowedMimeTypes == null ? List.of() : List.copyOf(allowedMimeTypes);
        prohibitedExtensions = normalizeExtensions(prohibitedExtensions);
    }

    public static FileValidationOptions defaults() {
        return new FileValidationOptions(DEFAULT_MAX_FILE_SIZE, List.of(), List.of(), DEFAULT_PROHIBITED_EXTENSIONS, true);
    }

    public static FileValidationOptions from(FileValidation annotation) {
        return new FileValidationOptions(
                annotation.maxFileSize(),
                List.of(annotation.allowedExtensions()),
                List.of(annotation.allowedMimeTypes()),
                DEFAULT_PROHIBITED_EXTENSIONS,
                annotation.validateContent());
    }

    private static List<String> normalizeExtensions(List<String> in) {
        if (in == null) return List.of();
        List<String> out = new ArrayList<>(in.size());
        for (String e : in) {
            if (e == null || e.isBlank()) continue;
            String ext = e.trim().toLowerCase(Locale.ROOT);
            out.add(ext.startsWith(".") ? ext : "." + ext);
        }
        return List.copyOf(out);
    }
}
