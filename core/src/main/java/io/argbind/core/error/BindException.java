package io.argbind.core.error;

/**
 * Abstract base for all argbind exceptions. Never thrown directly; callers catch this type to
 * handle any binding failure, or one of the concrete subclasses for a specific stage.
 */
public abstract class BindException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Stage of the binding pipeline in which the error occurred. */
    public enum Stage {
        /** Flat tag scanning and value coercion. */
        SCAN,
        /** Bracket-key decomposition and tree building. */
        BUILD,
        /** Mapping the merged tree onto the target type. */
        DECODE
    }

    private final String key;
    private final Stage stage;

    protected BindException(String message, String key, Stage stage) {
        super(message);
        this.key = key;
        this.stage = stage;
    }

    protected BindException(String message, Throwable cause, String key, Stage stage) {
        super(message, cause);
        this.key = key;
        this.stage = stage;
    }

    /** The argument key that triggered the error, or {@code null} if not tied to a single key. */
    public String key() {
        return key;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The stage in which the error occurred. */
    public Stage stage() {
        return stage;
    }
}
