package io.argbind.core.scan;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Binds a field to a form-encoded body argument. Independent of {@link UrlParam}: a field may
 * carry both with different keys.
 *
 * @see UrlParam
 */
@Documented
@Target(ElementType.FIELD)
@Retention(RetentionPolicy.RUNTIME)
public @interface FormParam {

    /** The argument key, optionally followed by {@code ,modifier}. */
    String value();
}
