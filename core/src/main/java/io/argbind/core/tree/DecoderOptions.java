package io.argbind.core.tree;

/**
 * Settings for {@link NestedArgsDecoder}.
 *
 * @param maxDepth                  maximum number of bracket segments after the top-level name
 * @param caseInsensitiveProperties match tree keys to target properties ignoring case
 * @param failOnUnknownProperties   reject tree keys with no matching target property
 */
public record DecoderOptions(int maxDepth, boolean caseInsensitiveProperties, boolean failOnUnknownProperties) {

    /** Default options: depth 32, case-insensitive matching, unknown keys ignored. */
    public static final DecoderOptions DEFAULT = new DecoderOptions(32, true, false);

    public DecoderOptions {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be at least 1, got: " + maxDepth);
        }
    }
}
