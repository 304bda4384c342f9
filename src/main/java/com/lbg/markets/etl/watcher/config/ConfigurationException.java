package com.lbg.markets.etl.watcher.config;

import java.util.List;

/**
 * Raised when the watch configuration cannot be loaded or fails validation.
 * Fatal at startup; a failed reload leaves the previous configuration in place.
 */
public class ConfigurationException extends RuntimeException {

    private final List<String> errors;

    public ConfigurationException(String message) {
        super(message);
        this.errors = List.of(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
        this.errors = List.of(message);
    }

    public ConfigurationException(String source, List<String> errors) {
        super("Invalid watch configuration " + source + ": " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> errors() {
        return errors;
    }
}
