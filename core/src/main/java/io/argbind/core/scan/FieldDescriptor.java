package io.argbind.core.scan;

import java.lang.annotation.Annotation;
import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One bindable field of a target class under one annotation namespace.
 *
 * <p>
 * Tables are derived by reflection on first use of a (class, namespace) pair and cached for the
 * lifetime of the class loader; the cached lists are immutable and safe to share between threads.
 *
 * @param field       the reflected field, already made accessible
 * @param key         the binding key, with any {@code ,modifier} suffix removed
 * @param kind        the scalar kind of the field, or of its elements for sequences
 * @param shape       scalar, array, list or raw bytes
 * @param elementType the scalar Java type that coerced values are boxed to
 */
public record FieldDescriptor(Field field, String key, ValueKind kind, Shape shape, Class<?> elementType) {

    private static final Logger LOG = LoggerFactory.getLogger(FieldDescriptor.class);

    /** Sentinel annotation value that excludes a field from binding. */
    public static final String IGNORE = "-";

    private static final Map<CacheKey, List<FieldDescriptor>> CACHE = new ConcurrentHashMap<>();

    /** How values are assigned to the field. */
    public enum Shape {
        /** Single value, coerced from the first argument value. */
        SCALAR,
        /** Java array, one element per argument value. */
        ARRAY,
        /** {@code List}, {@code Collection} or {@code Iterable}, one element per argument value. */
        LIST,
        /** {@code byte[]}, assigned from the first argument value verbatim. */
        BYTES
    }

    private record CacheKey(Class<?> type, Class<? extends Annotation> namespace) {}

    /**
     * Returns the bindable fields of a type under a namespace, superclass fields first, each class
     * in declaration order.
     *
     * @param type      the target class
     * @param namespace an annotation type declaring a {@code String value()} element
     * @return an immutable, possibly empty list
     * @throws IllegalArgumentException if the namespace has no {@code String value()} element
     */
    public static List<FieldDescriptor> describe(Class<?> type, Class<? extends Annotation> namespace) {
        return CACHE.computeIfAbsent(new CacheKey(type, namespace), k -> build(k.type(), k.namespace()));
    }

    private static List<FieldDescriptor> build(Class<?> type, Class<? extends Annotation> namespace) {
        Method valueElement = valueElement(namespace);

        Deque<Class<?>> hierarchy = new ArrayDeque<>();
        for (Class<?> c = type; c != null && c != Object.class; c = c.getSuperclass()) {
            hierarchy.push(c);
        }

        List<FieldDescriptor> descriptors = new ArrayList<>();
        for (Class<?> c : hierarchy) {
            for (Field field : c.getDeclaredFields()) {
                FieldDescriptor descriptor = describeField(field, namespace, valueElement);
                if (descriptor != null) {
                    descriptors.add(descriptor);
                }
            }
        }
        LOG.debug(
                "Described {} bindable field(s) on {} for @{}",
                descriptors.size(),
                type.getName(),
                namespace.getSimpleName());
        return List.copyOf(descriptors);
    }

    private static FieldDescriptor describeField(
            Field field, Class<? extends Annotation> namespace, Method valueElement) {
        int modifiers = field.getModifiers();
        if (Modifier.isStatic(modifiers) || Modifier.isFinal(modifiers) || field.isSynthetic()) {
            return null;
        }
        Annotation annotation = field.getAnnotation(namespace);
        if (annotation == null) {
            return null;
        }
        String key = bindingKey(annotationValue(annotation, valueElement));
        if (key == null) {
            return null;
        }

        boolean unsigned = field.isAnnotationPresent(Unsigned.class);
        Class<?> type = field.getType();
        FieldDescriptor descriptor;
        if (type == byte[].class) {
            descriptor = new FieldDescriptor(field, key, ValueKind.BYTES, Shape.BYTES, byte.class);
        } else if (type.isArray()) {
            descriptor = sequence(field, key, Shape.ARRAY, type.getComponentType(), unsigned);
        } else if (Iterable.class.isAssignableFrom(type) && type.isAssignableFrom(ArrayList.class)) {
            descriptor = sequence(field, key, Shape.LIST, listElementType(field.getGenericType()), unsigned);
        } else {
            ValueKind kind = ValueKind.of(type, unsigned);
            descriptor = kind != null ? new FieldDescriptor(field, key, kind, Shape.SCALAR, type) : null;
        }

        if (descriptor == null) {
            LOG.debug(
                    "Skipping {}.{}: type {} is not bindable",
                    field.getDeclaringClass().getName(),
                    field.getName(),
                    type.getTypeName());
            return null;
        }
        if (!field.trySetAccessible()) {
            LOG.warn(
                    "Skipping {}.{}: field is not accessible to argbind",
                    field.getDeclaringClass().getName(),
                    field.getName());
            return null;
        }
        return descriptor;
    }

    private static FieldDescriptor sequence(
            Field field, String key, Shape shape, Class<?> elementType, boolean unsigned) {
        if (elementType == null) {
            return null;
        }
        ValueKind kind = ValueKind.of(elementType, unsigned);
        if (kind == null || kind == ValueKind.BYTES) {
            return null;
        }
        return new FieldDescriptor(field, key, kind, shape, elementType);
    }

    /** Element class of {@code List<E>}, or {@code null} for raw or wildcard declarations. */
    private static Class<?> listElementType(Type genericType) {
        if (genericType instanceof ParameterizedType parameterized) {
            Type[] arguments = parameterized.getActualTypeArguments();
            if (arguments.length == 1 && arguments[0] instanceof Class<?> element) {
                return element;
            }
        }
        return null;
    }

    /**
     * Strips the optional {@code ,modifier} suffix.
     *
     * @return the key, or {@code null} if the annotation value excludes the field
     */
    static String bindingKey(String annotationValue) {
        if (annotationValue == null || annotationValue.isEmpty() || IGNORE.equals(annotationValue)) {
            return null;
        }
        int comma = annotationValue.indexOf(',');
        String key = comma >= 0 ? annotationValue.substring(0, comma) : annotationValue;
        return key.isEmpty() ? null : key;
    }

    private static Method valueElement(Class<? extends Annotation> namespace) {
        Method value;
        try {
            value = namespace.getMethod("value");
        } catch (NoSuchMethodException e) {
            throw new IllegalArgumentException(
                    "annotation namespace @" + namespace.getName() + " must declare a String value() element", e);
        }
        if (value.getReturnType() != String.class) {
            throw new IllegalArgumentException(
                    "annotation namespace @" + namespace.getName() + " must declare a String value() element");
        }
        // Non-public annotation types are legal namespaces.
        value.trySetAccessible();
        return value;
    }

    private static String annotationValue(Annotation annotation, Method valueElement) {
        try {
            return (String) valueElement.invoke(annotation);
        } catch (IllegalAccessException | InvocationTargetException e) {
            throw new IllegalStateException("cannot read @" + annotation.annotationType().getName() + ".value()", e);
        }
    }
}
