package de.mirkosertic.corpuscoverage.config;

/**
 * Raised when the analysis cannot be set up from the given configuration,
 * for example when a word list resource is missing or a setting is out of range.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(final String message) {
        super(message);
    }

    public ConfigurationException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
