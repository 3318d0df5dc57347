package io.argbind.core.error;

/**
 * Thrown when the merged argument tree cannot be mapped onto the target type, e.g. an object where
 * a scalar field is declared. The underlying Jackson exception is kept as the cause.
 */
public final class TreeDecodeException extends BindException {

    private static final long serialVersionUID = 1L;

    private final String targetType;

    public TreeDecodeException(String message, Throwable cause, String targetType) {
        super(message, cause, null, Stage.DECODE);
        this.targetType = targetType;
    }

    /** Type name of the decode target. */
    public String targetType() {
        return targetType;
    }
}
