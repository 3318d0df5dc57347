package io.argbind.core.scan;

import java.util.regex.Pattern;

/**
 * Text-to-value coercion primitives used by {@link ArgScanner}.
 *
 * <p>
 * Each method returns a value boxed to the exact Java type requested, so the result can be handed
 * straight to {@link java.lang.reflect.Field#set} or {@link java.lang.reflect.Array#set}. Only ASCII
 * digits are accepted; surrounding whitespace is never trimmed.
 *
 * <p>
 * Thread-safe and stateless.
 */
final class Coercions {

    static final String EXPECTED_INT = "expected int";
    static final String EXPECTED_UNSIGNED_INT = "expected unsigned int";
    static final String EXPECTED_DECIMAL = "expected decimal";
    static final String EXPECTED_BOOLEAN = "expected boolean";

    private static final Pattern SIGNED_DIGITS = Pattern.compile("[+-]?[0-9]+");

    private static final Pattern UNSIGNED_DIGITS = Pattern.compile("[0-9]+");

    /**
     * Plain decimal literal: no hex floats, no NaN/Infinity words, no type suffixes. Each digit has
     * exactly one way to match, so rejection stays linear in the input length.
     */
    private static final Pattern DECIMAL_LITERAL =
            Pattern.compile("[+-]?([0-9]+(\\.[0-9]*)?|\\.[0-9]+)([eE][+-]?[0-9]+)?");

    private Coercions() {}

    /**
     * Coerces raw text into a value of the given kind and Java type.
     *
     * @param kind the declared kind; {@link ValueKind#BYTES} is not handled here
     * @param type the concrete field or element type
     * @param raw  the raw argument text
     * @return the coerced value, boxed to {@code type}
     * @throws CoercionException if the text is not a valid literal for the kind
     */
    static Object coerce(ValueKind kind, Class<?> type, String raw) throws CoercionException {
        return switch (kind) {
            case INT -> parseInt(raw, type);
            case UNSIGNED_INT -> parseUnsigned(raw, type);
            case DECIMAL -> parseDecimal(raw, type);
            case BOOLEAN -> parseBoolean(raw);
            case STRING -> raw;
            case BYTES -> throw new IllegalArgumentException("byte sequences are assigned, not coerced");
        };
    }

    static Object parseInt(String raw, Class<?> type) throws CoercionException {
        if (!SIGNED_DIGITS.matcher(raw).matches()) {
            throw new CoercionException(EXPECTED_INT);
        }
        long value;
        try {
            value = Long.parseLong(raw);
        } catch (NumberFormatException e) {
            throw new CoercionException(EXPECTED_INT);
        }
        if (type == byte.class || type == Byte.class) {
            checkRange(value, Byte.MIN_VALUE, Byte.MAX_VALUE, EXPECTED_INT);
            return (byte) value;
        }
        if (type == short.class || type == Short.class) {
            checkRange(value, Short.MIN_VALUE, Short.MAX_VALUE, EXPECTED_INT);
            return (short) value;
        }
        if (type == int.class || type == Integer.class) {
            checkRange(value, Integer.MIN_VALUE, Integer.MAX_VALUE, EXPECTED_INT);
            return (int) value;
        }
        return value;
    }

    static Object parseUnsigned(String raw, Class<?> type) throws CoercionException {
        if (!UNSIGNED_DIGITS.matcher(raw).matches()) {
            throw new CoercionException(EXPECTED_UNSIGNED_INT);
        }
        long value;
        try {
            value = Long.parseUnsignedLong(raw);
        } catch (NumberFormatException e) {
            throw new CoercionException(EXPECTED_UNSIGNED_INT);
        }
        if (type == byte.class || type == Byte.class) {
            checkUnsignedMax(value, 0xFFL);
            return (byte) value;
        }
        if (type == short.class || type == Short.class) {
            checkUnsignedMax(value, 0xFFFFL);
            return (short) value;
        }
        if (type == int.class || type == Integer.class) {
            checkUnsignedMax(value, 0xFFFF_FFFFL);
            return (int) value;
        }
        return value;
    }

    /**
     * Parses a finite decimal. NaN and infinities are rejected even when spelled in a form the JDK
     * parser would accept, and so is a value that overflows a {@code float} target.
     */
    static Object parseDecimal(String raw, Class<?> type) throws CoercionException {
        if (!DECIMAL_LITERAL.matcher(raw).matches()) {
            throw new CoercionException(EXPECTED_DECIMAL);
        }
        double value = Double.parseDouble(raw);
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new CoercionException(EXPECTED_DECIMAL);
        }
        if (type == float.class || type == Float.class) {
            float narrowed = (float) value;
            if (Float.isInfinite(narrowed)) {
                throw new CoercionException(EXPECTED_DECIMAL);
            }
            return narrowed;
        }
        return value;
    }

    static Boolean parseBoolean(String raw) throws CoercionException {
        switch (raw) {
            case "1", "t", "T", "TRUE", "true", "True":
                return Boolean.TRUE;
            case "0", "f", "F", "FALSE", "false", "False":
                return Boolean.FALSE;
            default:
                throw new CoercionException(EXPECTED_BOOLEAN);
        }
    }

    private static void checkRange(long value, long min, long max, String reason) throws CoercionException {
        if (value < min || value > max) {
            throw new CoercionException(reason);
        }
    }

    private static void checkUnsignedMax(long value, long max) throws CoercionException {
        if (Long.compareUnsigned(value, max) > 0) {
            throw new CoercionException(EXPECTED_UNSIGNED_INT);
        }
    }
}
