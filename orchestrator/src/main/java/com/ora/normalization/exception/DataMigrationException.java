package com.ora.normalization.exception;

import com.ora.normalization.model.FailureCategory;

/**
 * Exception thrown when the shadow table rebuild fails inside its transaction.
 */
public class DataMigrationException extends MigrationException {

    public DataMigrationException(String message) {
        super(FailureCategory.INTEGRITY_FAILURE, message);
    }

    public DataMigrationException(String message, Throwable cause) {
        super(FailureCategory.INTEGRITY_FAILURE, message, cause);
    }
}
