package com.ora.normalization.exception;

import com.ora.normalization.model.FailureCategory;

/**
 * Exception thrown when a snapshot cannot be created or verified.
 */
public class BackupException extends MigrationException {

    public BackupException(String message) {
        super(FailureCategory.BACKUP_FAILURE, message);
    }

    public BackupException(String message, Throwable cause) {
        super(FailureCategory.BACKUP_FAILURE, message, cause);
    }
}
