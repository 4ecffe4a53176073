package io.layerwarm.cli.config;

/**
 * Thrown when the tool configuration cannot be loaded: unreadable file, invalid YAML, an unknown
 * key or an invalid value. The message names the offending key.
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
