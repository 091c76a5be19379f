package io.avalonrest.server.core.annotation;

import io.avalonrest.core.HttpMethod;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares a handler method for a verb and a path template relative to the controller prefix.
 *
 * <p>Template segments are literals (matched case-insensitively) or placeholders written as
 * {@code {name}}. An empty path matches the controller prefix itself.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface Route {

    HttpMethod method() default HttpMethod.GET;

    String path() default "";

    /**
     * Lower values are tried first when several templates could match the same sub-path.
     */
    int order() default 0;
}
