package com.ora.normalization.exception;

import com.ora.normalization.model.FailureCategory;

/**
 * Exception thrown when reference catalog creation or population fails.
 */
public class SchemaException extends MigrationException {

    public SchemaException(String message) {
        super(FailureCategory.PREWORK_FAILURE, message);
    }

    public SchemaException(String message, Throwable cause) {
        super(FailureCategory.PREWORK_FAILURE, message, cause);
    }
}
