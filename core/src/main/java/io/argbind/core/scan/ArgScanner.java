package io.argbind.core.scan;

import io.argbind.core.error.ArgScanException;
import io.argbind.core.error.InvalidTargetException;
import io.argbind.core.model.Args;
import java.lang.annotation.Annotation;
import java.lang.reflect.Array;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Flat tag scanner: populates the annotated fields of a bean from an {@link Args} multimap.
 *
 * <p>
 * The caller picks the annotation namespace per call, so one class can carry independent key sets,
 * e.g. {@code @UrlParam("q")} for query strings and {@code @FormParam("query")} for form bodies.
 * Any annotation type with a {@code String value()} element qualifies, Jackson's
 * {@code @JsonProperty} included.
 *
 * <p>
 * Processing per field, in declaration order (superclass fields first):
 * <ol>
 * <li>no annotation, an empty value or {@code "-"} → skipped</li>
 * <li>{@code key,modifier} → looked up as {@code key}</li>
 * <li>key absent from the arguments → skipped, the field keeps its value</li>
 * <li>{@code byte[]} → UTF-8 bytes of the first value</li>
 * <li>array or list → every value under the key, each coerced</li>
 * <li>scalar → the first value, coerced</li>
 * </ol>
 *
 * <p>
 * The first coercion failure aborts the scan with an {@link ArgScanException}. Fields assigned before
 * the failure stay assigned. A sequence field is only written once all of its elements coerced.
 *
 * <p>
 * Thread-safe: all state is local to each call.
 */
public final class ArgScanner {

    private static final Logger LOG = LoggerFactory.getLogger(ArgScanner.class);

    private ArgScanner() {
        // utility class
    }

    /**
     * Binds arguments onto the fields of {@code target} annotated with {@code namespace}.
     *
     * @param args      the argument multimap
     * @param target    the bean to populate, mutated in place
     * @param namespace the annotation type whose {@code value()} names each field's key
     * @return the binding keys that were matched and assigned, in field visit order
     * @throws NullPointerException     if any argument is {@code null}
     * @throws InvalidTargetException   if {@code target} is not a bean (array, record, enum, string,
     *                                  boxed primitive, collection or map)
     * @throws IllegalArgumentException if {@code namespace} has no {@code String value()} element
     * @throws ArgScanException         on the first value that cannot be coerced
     */
    public static List<String> scan(Args args, Object target, Class<? extends Annotation> namespace) {
        Objects.requireNonNull(args, "args");
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(namespace, "namespace");
        Class<?> type = target.getClass();
        if (!isBean(type)) {
            throw new InvalidTargetException(type);
        }

        List<String> matched = new ArrayList<>();
        for (FieldDescriptor descriptor : FieldDescriptor.describe(type, namespace)) {
            String key = descriptor.key();
            if (!args.has(key)) {
                continue;
            }
            switch (descriptor.shape()) {
                case BYTES -> set(descriptor, target, args.first(key).getBytes(StandardCharsets.UTF_8));
                case ARRAY -> set(descriptor, target, coerceArray(descriptor, args.all(key)));
                case LIST -> set(descriptor, target, coerceList(descriptor, args.all(key)));
                case SCALAR -> set(descriptor, target, coerceOne(descriptor, args.first(key)));
            }
            matched.add(key);
        }

        LOG.debug("Scanned {} with @{}: matched {}", type.getSimpleName(), namespace.getSimpleName(), matched);
        return matched;
    }

    private static Object coerceOne(FieldDescriptor descriptor, String raw) {
        try {
            return Coercions.coerce(descriptor.kind(), descriptor.elementType(), raw);
        } catch (CoercionException e) {
            throw new ArgScanException(descriptor.key(), raw, e.reason());
        }
    }

    private static Object coerceArray(FieldDescriptor descriptor, List<String> raws) {
        Object array = Array.newInstance(descriptor.elementType(), raws.size());
        for (int i = 0; i < raws.size(); i++) {
            Array.set(array, i, coerceOne(descriptor, raws.get(i)));
        }
        return array;
    }

    private static List<Object> coerceList(FieldDescriptor descriptor, List<String> raws) {
        List<Object> list = new ArrayList<>(raws.size());
        for (String raw : raws) {
            list.add(coerceOne(descriptor, raw));
        }
        return list;
    }

    private static void set(FieldDescriptor descriptor, Object target, Object value) {
        try {
            descriptor.field().set(target, value);
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("cannot assign field " + descriptor.field().getName(), e);
        }
    }

    private static boolean isBean(Class<?> type) {
        return !(type.isArray()
                || type.isEnum()
                || type.isRecord()
                || type.isPrimitive()
                || type.isInterface()
                || CharSequence.class.isAssignableFrom(type)
                || Number.class.isAssignableFrom(type)
                || Boolean.class == type
                || Character.class == type
                || Collection.class.isAssignableFrom(type)
                || Map.class.isAssignableFrom(type));
    }
}
