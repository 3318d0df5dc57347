package io.argbind.core.model;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.BiConsumer;

/**
 * Ordered argument multimap: string keys to one or more string values, as produced by a URL query
 * string or an {@code application/x-www-form-urlencoded} body.
 *
 * <p>
 * Distinct keys iterate in order of first occurrence. Values under a key keep insertion order.
 * The raw pairs are also kept in submission order, interleaving across keys included; see
 * {@link #pairs()}. Keys are case-sensitive. The class is immutable; build instances through {@link #builder()},
 * {@link #of(Map)} or {@link #parse(String)}.
 */
public final class Args {

    private static final Args EMPTY = new Args(List.of());

    /** Raw (key, value) pairs in submission order. */
    private final List<Map.Entry<String, String>> pairs;

    /** Grouped view: first-occurrence key order, values are non-empty unmodifiable lists. */
    private final LinkedHashMap<String, List<String>> store;

    private Args(List<Map.Entry<String, String>> pairs) {
        this.pairs = List.copyOf(pairs);
        LinkedHashMap<String, List<String>> grouped = new LinkedHashMap<>();
        for (Map.Entry<String, String> pair : this.pairs) {
            grouped.computeIfAbsent(pair.getKey(), k -> new ArrayList<>()).add(pair.getValue());
        }
        grouped.replaceAll((key, values) -> List.copyOf(values));
        this.store = grouped;
    }

    /**
     * True if at least one value is registered under the key.
     *
     * @param key the argument key
     * @return {@code true} if present
     */
    public boolean has(String key) {
        return store.containsKey(key);
    }

    /**
     * First value for a key.
     *
     * @return the first value, or {@code null} if the key is absent
     */
    public String first(String key) {
        List<String> values = store.get(key);
        return values != null ? values.get(0) : null;
    }

    /**
     * All values for a key, in submission order.
     *
     * @return an unmodifiable list of values, or an empty list if absent
     */
    public List<String> all(String key) {
        List<String> values = store.get(key);
        return values != null ? values : List.of();
    }

    /** Distinct keys in order of first occurrence. */
    public Set<String> keys() {
        return Collections.unmodifiableSet(store.keySet());
    }

    /** Number of distinct keys. */
    public int size() {
        return store.size();
    }

    /** Returns {@code true} if no arguments are present. */
    public boolean isEmpty() {
        return store.isEmpty();
    }

    /**
     * Visits every (key, value) pair in submission order.
     *
     * @param visitor receives each key and value
     */
    public void forEach(BiConsumer<String, String> visitor) {
        pairs.forEach(pair -> visitor.accept(pair.getKey(), pair.getValue()));
    }

    /**
     * Raw pairs in submission order. {@code a=1&b=2&a=3} yields {@code a=1}, {@code b=2},
     * {@code a=3}, unlike the grouped {@link #toMultiValueMap()}.
     *
     * @return an unmodifiable list of immutable entries
     */
    public List<Map.Entry<String, String>> pairs() {
        return pairs;
    }

    /**
     * All-values-per-key view.
     *
     * @return an unmodifiable map preserving key order
     */
    public Map<String, List<String>> toMultiValueMap() {
        return Collections.unmodifiableMap(store);
    }

    // ── Factory methods ──

    /**
     * Creates arguments from a multi-value map. Iteration order of the map becomes the key order;
     * keys mapped to {@code null} or empty lists are dropped.
     *
     * @param multiValue key → list of values
     * @return immutable {@code Args}
     */
    public static Args of(Map<String, List<String>> multiValue) {
        if (multiValue == null || multiValue.isEmpty()) {
            return EMPTY;
        }
        Builder builder = builder();
        multiValue.forEach((key, values) -> {
            if (values != null) {
                values.forEach(value -> builder.add(key, value));
            }
        });
        return builder.build();
    }

    /**
     * Parses a raw query string or form-urlencoded body. Pairs are separated by {@code &}; key and
     * value are split at the first {@code =} and percent-decoded as UTF-8, with {@code +} decoding to
     * a space. A pair without {@code =} yields the key with an empty value. Empty pairs are skipped
     * and a single leading {@code ?} is ignored.
     *
     * @param raw the encoded arguments, may be {@code null}
     * @return immutable {@code Args}
     * @throws IllegalArgumentException if a percent escape is malformed
     */
    public static Args parse(String raw) {
        if (raw == null || raw.isEmpty()) {
            return EMPTY;
        }
        String encoded = raw.charAt(0) == '?' ? raw.substring(1) : raw;
        Builder builder = builder();
        for (String pair : encoded.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            if (eq >= 0) {
                builder.add(decode(pair.substring(0, eq)), decode(pair.substring(eq + 1)));
            } else {
                builder.add(decode(pair), "");
            }
        }
        return builder.build();
    }

    /** Returns the empty argument set. */
    public static Args empty() {
        return EMPTY;
    }

    /** Returns a new builder. */
    public static Builder builder() {
        return new Builder();
    }

    private static String decode(String component) {
        return URLDecoder.decode(component, StandardCharsets.UTF_8);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Args that)) return false;
        return pairs.equals(that.pairs);
    }

    @Override
    public int hashCode() {
        return pairs.hashCode();
    }

    /** Prints key names only; argument values may carry credentials. */
    @Override
    public String toString() {
        return "Args" + store.keySet();
    }

    /** Accumulates (key, value) pairs in submission order. Not thread-safe. */
    public static final class Builder {

        private final List<Map.Entry<String, String>> pending = new ArrayList<>();

        private Builder() {}

        /**
         * Appends a value under a key.
         *
         * @param key   the argument key, not {@code null}
         * @param value the value, not {@code null}
         * @return this builder
         */
        public Builder add(String key, String value) {
            pending.add(entry(key, value));
            return this;
        }

        /**
         * Replaces all values under a key with a single value. An existing key keeps the position of
         * its first pair; otherwise the pair is appended.
         *
         * @return this builder
         */
        public Builder set(String key, String value) {
            Map.Entry<String, String> replacement = entry(key, value);
            int first = -1;
            for (int i = 0; i < pending.size(); i++) {
                if (pending.get(i).getKey().equals(key)) {
                    first = i;
                    break;
                }
            }
            if (first < 0) {
                pending.add(replacement);
                return this;
            }
            pending.set(first, replacement);
            for (int i = pending.size() - 1; i > first; i--) {
                if (pending.get(i).getKey().equals(key)) {
                    pending.remove(i);
                }
            }
            return this;
        }

        /**
         * Removes every value under a key. The key loses its position in the iteration order.
         *
         * @return this builder
         */
        public Builder remove(String key) {
            pending.removeIf(pair -> pair.getKey().equals(key));
            return this;
        }

        public Args build() {
            return pending.isEmpty() ? EMPTY : new Args(pending);
        }

        private static Map.Entry<String, String> entry(String key, String value) {
            if (key == null || value == null) {
                throw new NullPointerException("argument key and value must not be null");
            }
            return Map.entry(key, value);
        }
    }
}
