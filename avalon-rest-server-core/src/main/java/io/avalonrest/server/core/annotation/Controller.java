package io.avalonrest.server.core.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a handler type and declares the path prefix it owns.
 *
 * <p>The token {@code [controller]} is replaced by the lowercased simple class name with a
 * trailing {@code Controller} removed, so {@code UserController} under {@code api/[controller]}
 * owns {@code api/user}.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface Controller {

    /** Placeholder replaced by the derived controller name. */
    String CONTROLLER_TOKEN = "[controller]";

    /**
     * Route prefix; leading and trailing slashes are ignored.
     */
    String route() default "api/" + CONTROLLER_TOKEN;
}
