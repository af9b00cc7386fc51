package com.ora.normalization.exception;

import com.ora.normalization.model.FailureCategory;

/**
 * Exception thrown when configuration or a collaborator contract is unusable.
 */
public class ConfigurationException extends MigrationException {

    public ConfigurationException(String message) {
        super(FailureCategory.PREWORK_FAILURE, message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(FailureCategory.PREWORK_FAILURE, message, cause);
    }
}
