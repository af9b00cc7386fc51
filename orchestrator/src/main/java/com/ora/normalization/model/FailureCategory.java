package com.ora.normalization.model;

/**
 * Categories of failure a migration run can report.
 */
public enum FailureCategory {
    /** A single row could not be parsed or resolved; the row was skipped. */
    VALIDATION_FAILURE("ValidationFailure", false),

    /** A post-rebuild check failed or the rebuild itself aborted before commit. */
    INTEGRITY_FAILURE("IntegrityFailure", true),

    /** Snapshot creation or checksum verification failed before any destructive step. */
    BACKUP_FAILURE("BackupFailure", true),

    /** External workflows could not be paused. */
    PROCESS_CONTROL_FAILURE("ProcessControlFailure", true),

    /** Rollback found no usable backup; manual intervention required. */
    CATASTROPHIC_FAILURE("CatastrophicFailure", true),

    /** A Prework step failed; nothing destructive happened. */
    PREWORK_FAILURE("PreworkFailure", true);

    private final String displayName;
    private final boolean aborting;

    FailureCategory(String displayName, boolean aborting) {
        this.displayName = displayName;
        this.aborting = aborting;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Whether this category stops the current phase.
     */
    public boolean isAborting() {
        return aborting;
    }
}
