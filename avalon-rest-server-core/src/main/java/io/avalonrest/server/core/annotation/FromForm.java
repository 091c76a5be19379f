package io.avalonrest.server.core.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Binds a urlencoded or multipart text field. Non-scalar targets are bound property by property from {@code name.property} keys.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.PARAMETER)
public @interface FromForm {

    /**
     * Name of the form field; empty means the parameter name.
     */
    String name() default "";
}
