package io.argbind.core.scan;

/**
 * Internal signal from {@link Coercions} to {@link ArgScanner}. The scanner rethrows it as an
 * {@link io.argbind.core.error.ArgScanException} carrying the binding key and raw value.
 */
final class CoercionException extends Exception {

    private static final long serialVersionUID = 1L;

    CoercionException(String reason) {
        super(reason, null, false, false);
    }

    /** The expected-kind reason, e.g. {@code expected int}. */
    String reason() {
        return getMessage();
    }
}
