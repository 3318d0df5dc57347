package io.argbind.javalin;

/**
 * Thrown when a request body cannot be decoded onto its target. The underlying binding or JSON
 * exception is kept as the cause.
 */
public final class RequestDecodeException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public RequestDecodeException(Throwable cause) {
        super("error decoding request: " + cause.getMessage(), cause);
    }
}
