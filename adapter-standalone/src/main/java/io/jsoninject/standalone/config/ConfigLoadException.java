package io.jsoninject.standalone.config;

/**
 * Thrown when server configuration or page definitions cannot be loaded: missing file, invalid
 * YAML, or values out of range. The message is meant for startup error output.
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
