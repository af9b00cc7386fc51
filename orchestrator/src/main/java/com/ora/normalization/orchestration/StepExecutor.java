package com.ora.normalization.orchestration;

import com.ora.normalization.exception.MigrationException;
import com.ora.normalization.model.FailureCategory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Runs one step and turns its outcome into a {@link StepResult}.
 * This is the only place where step exceptions are caught.
 */
@Component
@Slf4j
public class StepExecutor {

    /**
     * Execute a step if it shouldn't be skipped.
     *
     * @param fallback category reported for failures that carry none of their own
     */
    public StepResult execute(MigrationStep step, MigrationContext context, FailureCategory fallback) {
        MigrationLog auditLog = context.getAuditLog();

        if (step.shouldSkip(context)) {
            auditLog.info("Skipping step: {}", step.getStepName());
            return StepResult.success(step.getStepName());
        }

        auditLog.info("Starting step: {}", step.getStepName());
        try {
            step.execute(context);
            auditLog.info("Completed step: {}", step.getStepName());
            return StepResult.success(step.getStepName());

        } catch (MigrationException e) {
            auditLog.error("Failed step: {} ({}): {}", step.getStepName(), e.getCategory().getDisplayName(), e.getMessage());
            log.debug("Step {} failure", step.getStepName(), e);
            return StepResult.failure(step.getStepName(), e.getCategory(), e.getMessage());

        } catch (Exception e) {
            auditLog.error("Failed step: {} ({}): {}", step.getStepName(), fallback.getDisplayName(), e.getMessage());
            log.error("[Run-{}] Unexpected error in step {}", context.getRunId(), step.getStepName(), e);
            return StepResult.failure(step.getStepName(), fallback,
                "Step '" + step.getStepName() + "' failed: " + e.getMessage());
        }
    }
}
