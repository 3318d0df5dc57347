package io.argbind.core.error;

/** Thrown when a required argument is absent or has an empty first value. */
public final class MissingArgException extends BindException {

    private static final long serialVersionUID = 1L;

    public MissingArgException(String key) {
        super("Missing or empty field `" + key + "`", key, Stage.SCAN);
    }
}
