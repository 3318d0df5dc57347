package io.argbind.core.error;

/**
 * Thrown when a raw argument value cannot be coerced into the declared kind of the field it is bound
 * to. The message has the form {@code failed to decode `<key>`, got: `<value>` (<reason>)}.
 */
public final class ArgScanException extends BindException {

    private static final long serialVersionUID = 1L;

    private final String value;
    private final String reason;

    public ArgScanException(String key, String value, String reason) {
        super(String.format("failed to decode `%s`, got: `%s` (%s)", key, value, reason), key, Stage.SCAN);
        this.value = value;
        this.reason = reason;
    }

    /** The raw value that failed coercion. */
    public String value() {
        return value;
    }

    /** The expected-kind reason, e.g. {@code expected int}. */
    public String reason() {
        return reason;
    }
}
