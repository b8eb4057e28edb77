package io.quadc.core.config;

/**
 * Thrown when compiler options cannot be loaded: missing file, invalid YAML or an invalid value.
 */
public class OptionsLoadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public OptionsLoadException(String message) {
        super(message);
    }

    public OptionsLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
