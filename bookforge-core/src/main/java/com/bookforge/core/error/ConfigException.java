package com.bookforge.core.error;

/**
 * Thrown by the configuration loader for malformed directives or invalid option values.
 */
public class ConfigException extends BookException {

    private final String line;

    public ConfigException(String message, String line) {
        super(line == null ? message : message + ": " + line);
        this.line = line;
    }

    public ConfigException(String message, String line, Throwable cause) {
        super(line == null ? message : message + ": " + line, cause);
        this.line = line;
    }

    /**
     * Returns the configuration line in error, if any.
     *
     * @return offending line or null
     */
    public String getLine() {
        return line;
    }
}
