package com.facility.snapshot.exception;

/**
 * Reference data required by the snapshot job is missing, e.g. no HVAC statuses.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }
}
