package com.ora.normalization.exception;

import com.ora.normalization.model.FailureCategory;

/**
 * Exception thrown when the post-rebuild integrity gate refuses the commit.
 */
public class IntegrityException extends MigrationException {

    public IntegrityException(String message) {
        super(FailureCategory.INTEGRITY_FAILURE, message);
    }

    public IntegrityException(String message, Throwable cause) {
        super(FailureCategory.INTEGRITY_FAILURE, message, cause);
    }
}
