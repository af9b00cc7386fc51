package com.ora.normalization.orchestration;

import com.ora.normalization.model.FailureCategory;

/**
 * Explicit outcome of one step or phase. The orchestrator transitions on these values only.
 */
public record StepResult(String stepName, boolean success, FailureCategory category, String message) {

    public static StepResult success(String stepName) {
        return new StepResult(stepName, true, null, null);
    }

    public static StepResult failure(String stepName, FailureCategory category, String message) {
        return new StepResult(stepName, false, category, message);
    }

    public boolean isFailure() {
        return !success;
    }
}
