package com.ora.normalization.exception;

import com.ora.normalization.model.FailureCategory;

/**
 * Base exception for all migration-related errors.
 * Each exception carries the failure category reported to the operator.
 */
public class MigrationException extends RuntimeException {

    private final FailureCategory category;

    public MigrationException(FailureCategory category, String message) {
        super(message);
        this.category = category;
    }

    public MigrationException(FailureCategory category, String message, Throwable cause) {
        super(message, cause);
        this.category = category;
    }

    public FailureCategory getCategory() {
        return category;
    }
}
