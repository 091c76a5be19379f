package io.avalonrest.server.core.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Validates a {@link FromFile} upload before the handler runs. Any error answers 400.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.PARAMETER)
public @interface FileValidation {

    /** Maximum file size in bytes. */
    long maxFileSize() default 10L * 1024 * 1024;

    /** Allowed extensions including the dot; empty allows any not prohibited. */
    String[] allowedExtensions() default {};

    /** Allowed MIME types; empty allows any. */
    String[] allowedMimeTypes() default {};

    /** Sniff magic numbers for executables and declared-type mismatches. */
    boolean validateContent() default true;
}
