package io.argbind.core.error;

/**
 * Thrown when an argument key does not follow the bracket grammar
 * {@code name ( "[" segment "]" )*}, or nests deeper than the configured limit.
 */
public final class KeySyntaxException extends BindException {

    private static final long serialVersionUID = 1L;

    private final int position;

    public KeySyntaxException(String message, String key, int position) {
        super(String.format("malformed argument key `%s` at index %d: %s", key, position, message), key, Stage.BUILD);
        this.position = position;
    }

    /** Zero-based index into the key where the problem was detected. */
    public int position() {
        return position;
    }
}
