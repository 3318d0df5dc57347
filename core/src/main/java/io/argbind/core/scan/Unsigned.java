package io.argbind.core.scan;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks an integral field ({@code byte}, {@code short}, {@code int}, {@code long}, their wrappers,
 * or arrays and lists of them) as unsigned. Values are parsed as unsigned base-10 numbers over the
 * full width of the type and stored in two's complement, so {@code 255} into a {@code byte} reads
 * back as {@code -1} and {@link Byte#toUnsignedInt} recovers it.
 */
@Documented
@Target(ElementType.FIELD)
@Retention(RetentionPolicy.RUNTIME)
public @interface Unsigned {}
