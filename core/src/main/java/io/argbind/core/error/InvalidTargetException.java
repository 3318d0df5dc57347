package io.argbind.core.error;

/** Thrown when the scan target is not a bean whose fields can receive arguments. */
public final class InvalidTargetException extends BindException {

    private static final long serialVersionUID = 1L;

    private final Class<?> targetType;

    public InvalidTargetException(Class<?> targetType) {
        super("cannot bind arguments into non-bean type: " + targetType.getName(), null, Stage.SCAN);
        this.targetType = targetType;
    }

    /** The rejected target type. */
    public Class<?> targetType() {
        return targetType;
    }
}
