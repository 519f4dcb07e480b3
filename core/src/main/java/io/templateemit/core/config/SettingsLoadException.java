package io.templateemit.core.config;

/**
 * Thrown when emitter settings cannot be loaded: missing file, malformed JSON/YAML, or a value of
 * the wrong type.
 */
public class SettingsLoadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public SettingsLoadException(String message) {
        super(message);
    }

    public SettingsLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
