package com.settleworks.core.common.error;

/**
 * A static table (catalog, tier requirements) could not be read or failed validation.
 */
public class ConfigurationException extends SettlementException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
