package io.avalonrest.server.core.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Binds the JSON request body. Declaring it on any parameter makes the whole request parsed as JSON.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.PARAMETER)
public @interface FromBody {

    /**
     * When true an empty body without a {@link DefaultValue} is rejected with 400.
     */
    boolean required() default true;
}
