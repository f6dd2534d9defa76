package de.mirkosertic.mcp.ruleengine.config;

/**
 * Raised when the engine is misconfigured: invalid tuning values, or a vocabulary/catalog
 * source that is missing or unreadable. Always fatal at startup.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(final String message) {
        super(message);
    }

    public ConfigurationException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
