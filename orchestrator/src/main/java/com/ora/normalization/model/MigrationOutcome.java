package com.ora.normalization.model;

import java.nio.file.Path;
import java.util.Set;

/**
 * Final result of one orchestrator run, reported to the operator.
 */
public record MigrationOutcome(
        String runId,
        RunMode mode,
        MigrationState state,
        Set<FailureCategory> failures,
        long rowsMigrated,
        long rowsSkipped,
        long lotsCreated,
        String message,
        Path logFile
) {

    public MigrationOutcome {
        failures = Set.copyOf(failures);
    }

    /**
     * Whether the run reached the state its entry point aims for. Prework always returns to
     * {@code IDLE}, so it succeeds only when no aborting failure was recorded.
     */
    public boolean isSuccess() {
        return switch (mode) {
            case PREWORK -> state == MigrationState.IDLE && failures.stream().noneMatch(FailureCategory::isAborting);
            case MIGRATE, TEST_REPLAY -> state == MigrationState.COMMITTED;
            case ROLLBACK -> state == MigrationState.ROLLED_BACK;
        };
    }
}
