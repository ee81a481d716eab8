package io.typedrecord.core.config;

/**
 * Thrown when validation settings cannot be loaded: missing file, invalid YAML or an
 * unparseable value in YAML or in an environment override.
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
