package com.ora.normalization.orchestration;

/**
 * Interface for migration steps.
 * Each step represents a distinct, ordered action within the Prework or Migration phase.
 */
public interface MigrationStep {

    /**
     * Execute this step.
     *
     * @param context The run context
     * @throws Exception if the step fails
     */
    void execute(MigrationContext context) throws Exception;

    /**
     * Get the name of this step for logging.
     */
    String getStepName();

    /**
     * Check if this step should be skipped based on context.
     * Default implementation never skips.
     */
    default boolean shouldSkip(MigrationContext context) {
        return false;
    }
}
