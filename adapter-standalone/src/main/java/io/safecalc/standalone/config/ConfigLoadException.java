package io.safecalc.standalone.config;

/**
 * Thrown when the service configuration cannot be loaded: an explicit file is
 * missing, the YAML is malformed, a value has the wrong type, or the resulting
 * settings are out of range. The message is meant for startup error output.
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
