package com.ora.normalization.exception;

import com.ora.normalization.model.FailureCategory;

/**
 * Exception thrown when the store cannot be opened.
 */
public class ConnectionException extends MigrationException {

    public ConnectionException(String message) {
        super(FailureCategory.INTEGRITY_FAILURE, message);
    }

    public ConnectionException(String message, Throwable cause) {
        super(FailureCategory.INTEGRITY_FAILURE, message, cause);
    }
}
