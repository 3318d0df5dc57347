package io.argbind.core.scan;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Binds a field to a URL query argument. Pass {@code UrlParam.class} as the namespace to
 * {@link ArgScanner#scan}.
 *
 * <p>
 * The value has the form {@code key} or {@code key,modifier}; the modifier is ignored during
 * lookup. A value of {@code "-"} excludes the field.
 */
@Documented
@Target(ElementType.FIELD)
@Retention(RetentionPolicy.RUNTIME)
public @interface UrlParam {

    /** The argument key, optionally followed by {@code ,modifier}. */
    String value();
}
