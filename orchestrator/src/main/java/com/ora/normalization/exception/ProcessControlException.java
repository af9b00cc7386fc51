package com.ora.normalization.exception;

import com.ora.normalization.model.FailureCategory;

/**
 * Exception thrown when external workflows cannot be quiesced.
 */
public class ProcessControlException extends MigrationException {

    public ProcessControlException(String message) {
        super(FailureCategory.PROCESS_CONTROL_FAILURE, message);
    }

    public ProcessControlException(String message, Throwable cause) {
        super(FailureCategory.PROCESS_CONTROL_FAILURE, message, cause);
    }
}
