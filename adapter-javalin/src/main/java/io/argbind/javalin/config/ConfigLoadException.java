package io.argbind.javalin.config;

/**
 * Thrown when binder configuration cannot be loaded: missing file, invalid YAML, or a value that
 * does not parse. The message is meant for startup error output.
 */
public class ConfigLoadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ConfigLoadException(String message) {
        super(message);
    }

    public ConfigLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
