package com.presence.core.stage;

/**
 * Thrown at startup when the declared stage table is inconsistent.
 */
public class StageConfigurationException extends RuntimeException {

    public StageConfigurationException(String message) {
        super(message);
    }
}
