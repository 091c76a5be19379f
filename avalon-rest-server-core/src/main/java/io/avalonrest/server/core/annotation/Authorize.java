package io.avalonrest.server.core.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Requires a verified bearer credential. When roles are listed the identity must hold one of them.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.TYPE, ElementType.METHOD})
public @interface Authorize {

    String[] roles() default {};

    /**
     * Authentication scheme; only {@code Bearer} is supported. A comma-separated list uses its first entry.
     */
    String scheme() default "Bearer";
}
