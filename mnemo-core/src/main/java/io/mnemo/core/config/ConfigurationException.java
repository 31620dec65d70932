package io.mnemo.core.config;

/**
 * Raised while building the engine from invalid limits or retention policies. Never raised for
 * malformed memory data, which is absorbed at scoring time instead.
 */
public class ConfigurationException extends IllegalArgumentException {

    public ConfigurationException(String message) {
        super(message);
    }
}
