package io.nlpqlresolver.core.config;

/**
 * Thrown when resolver configuration cannot be loaded: missing file, invalid YAML, or a value
 * that cannot be used (such as an unknown charset).
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
