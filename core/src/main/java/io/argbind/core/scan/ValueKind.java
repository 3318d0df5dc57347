package io.argbind.core.scan;

import java.util.Map;

/** Declared scalar kind of a bindable field, or of the elements of a bindable sequence. */
public enum ValueKind {
    INT,
    UNSIGNED_INT,
    DECIMAL,
    BOOLEAN,
    STRING,
    /** Raw byte sequence ({@code byte[]}); receives the first value verbatim. */
    BYTES;

    private static final Map<Class<?>, ValueKind> BY_TYPE = Map.ofEntries(
            Map.entry(byte.class, INT),
            Map.entry(Byte.class, INT),
            Map.entry(short.class, INT),
            Map.entry(Short.class, INT),
            Map.entry(int.class, INT),
            Map.entry(Integer.class, INT),
            Map.entry(long.class, INT),
            Map.entry(Long.class, INT),
            Map.entry(float.class, DECIMAL),
            Map.entry(Float.class, DECIMAL),
            Map.entry(double.class, DECIMAL),
            Map.entry(Double.class, DECIMAL),
            Map.entry(boolean.class, BOOLEAN),
            Map.entry(Boolean.class, BOOLEAN),
            Map.entry(String.class, STRING),
            Map.entry(byte[].class, BYTES));

    /**
     * Resolves the kind for a Java type.
     *
     * @param type     the field or element type
     * @param unsigned whether the field carries {@link Unsigned}
     * @return the kind, or {@code null} if values of this type cannot be bound
     */
    static ValueKind of(Class<?> type, boolean unsigned) {
        ValueKind kind = BY_TYPE.get(type);
        if (kind == INT && unsigned) {
            return UNSIGNED_INT;
        }
        return kind;
    }
}
