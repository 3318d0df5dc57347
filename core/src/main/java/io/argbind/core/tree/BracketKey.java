package io.argbind.core.tree;

import io.argbind.core.error.KeySyntaxException;
import java.util.ArrayList;
import java.util.List;

/**
 * Decomposes bracket-notation argument keys into path segments.
 *
 * <p>
 * Grammar: {@code name ( "[" segment "]" )*}, where neither {@code name} nor {@code segment} contains
 * a bracket character and either may be empty. {@code bar[one][two]} yields {@code [bar, one, two]};
 * {@code items[]} yields {@code [items, ""]}, the empty segment marking a collection.
 *
 * <p>
 * Anything outside the grammar is rejected rather than guessed at: {@code a[b}, {@code a]b},
 * {@code a[b[c]]}, {@code a[b]c}.
 *
 * <p>
 * Thread-safe and stateless.
 */
public final class BracketKey {

    private BracketKey() {}

    /**
     * Splits a key into its segments. The first segment is the top-level property name.
     *
     * @param key      the raw argument key
     * @param maxDepth maximum number of bracket segments allowed after the name
     * @return the segments, never empty
     * @throws KeySyntaxException if the key is malformed or nests deeper than {@code maxDepth}
     */
    public static List<String> split(String key, int maxDepth) {
        List<String> segments = new ArrayList<>();

        int open = key.indexOf('[');
        int nameEnd = open >= 0 ? open : key.length();
        int strayClose = key.indexOf(']');
        if (strayClose >= 0 && strayClose < nameEnd) {
            throw new KeySyntaxException("unexpected ']'", key, strayClose);
        }
        segments.add(key.substring(0, nameEnd));

        int i = nameEnd;
        while (i < key.length()) {
            if (key.charAt(i) != '[') {
                throw new KeySyntaxException("expected '[' after ']'", key, i);
            }
            if (segments.size() > maxDepth) {
                throw new KeySyntaxException("nesting deeper than " + maxDepth + " levels", key, i);
            }
            int close = key.indexOf(']', i + 1);
            if (close < 0) {
                throw new KeySyntaxException("unclosed '['", key, i);
            }
            int nested = key.indexOf('[', i + 1);
            if (nested >= 0 && nested < close) {
                throw new KeySyntaxException("unexpected '[' inside brackets", key, nested);
            }
            segments.add(key.substring(i + 1, close));
            i = close + 1;
        }
        return segments;
    }
}
