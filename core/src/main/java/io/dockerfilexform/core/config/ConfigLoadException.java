package io.dockerfilexform.core.config;

/**
 * Thrown when configuration loading fails: missing file, invalid YAML, or a value of the wrong
 * type. The message is suitable for direct display to the caller.
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
