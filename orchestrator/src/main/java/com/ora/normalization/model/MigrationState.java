package com.ora.normalization.model;

/**
 * States of the migration orchestrator.
 */
public enum MigrationState {
    // Initial state, and the state after a successful Prework
    IDLE("Idle", false, false),

    PREWORK("Running Prework", false, false),
    MIGRATING("Migrating", false, false),

    // Terminal states of a Migration run
    COMMITTED("Committed", true, false),
    ROLLED_BACK("Rolled Back", true, true),
    FAILED("Failed - Manual Intervention Required", true, true);

    private final String displayName;
    private final boolean isTerminal;
    private final boolean isError;

    MigrationState(String displayName, boolean isTerminal, boolean isError) {
        this.displayName = displayName;
        this.isTerminal = isTerminal;
        this.isError = isError;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isTerminal() {
        return isTerminal;
    }

    public boolean isError() {
        return isError;
    }

    public boolean isRunning() {
        return this == PREWORK || this == MIGRATING;
    }
}
