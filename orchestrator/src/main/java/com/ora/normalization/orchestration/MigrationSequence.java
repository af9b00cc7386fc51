package com.ora.normalization.orchestration;

import com.ora.normalization.model.FailureCategory;
import com.ora.normalization.orchestration.steps.CommitStep;
import com.ora.normalization.orchestration.steps.CreateBackupsStep;
import com.ora.normalization.orchestration.steps.OpenTransactionStep;
import com.ora.normalization.orchestration.steps.PauseWorkflowsStep;
import com.ora.normalization.orchestration.steps.RebuildStep;
import com.ora.normalization.orchestration.steps.ResumeWorkflowsStep;
import com.ora.normalization.orchestration.steps.ValidationStep;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;

/**
 * The ordered steps of the Migration phase, shared by live runs and test replays.
 *
 * <p>Backups are verified before workflows are paused, workflows are paused before the
 * transaction opens, and workflows resume only after the commit.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class MigrationSequence {

    private final StepExecutor stepExecutor;

    private final CreateBackupsStep createBackupsStep;
    private final PauseWorkflowsStep pauseWorkflowsStep;
    private final OpenTransactionStep openTransactionStep;
    private final RebuildStep rebuildStep;
    private final ValidationStep validationStep;
    private final CommitStep commitStep;
    private final ResumeWorkflowsStep resumeWorkflowsStep;

    public List<MigrationStep> steps() {
        return List.of(createBackupsStep, pauseWorkflowsStep, openTransactionStep,
            rebuildStep, validationStep, commitStep, resumeWorkflowsStep);
    }

    /**
     * Run every step in order, stopping at the first failure. On failure the open
     * transaction, if any, is rolled back so the store holds the original table again.
     *
     * @return the failed step's result, or a success result for the whole phase
     */
    public StepResult run(MigrationContext context) {
        for (MigrationStep step : steps()) {
            StepResult result = stepExecutor.execute(step, context, FailureCategory.INTEGRITY_FAILURE);
            if (result.isFailure()) {
                context.recordFailure(result.category());
                abortTransaction(context);
                return result;
            }
        }
        return StepResult.success("Migration");
    }

    private void abortTransaction(MigrationContext context) {
        if (!context.hasOpenTransaction()) {
            return;
        }
        Connection conn = context.getConnection();
        context.setConnection(null);
        try {
            conn.rollback();
            context.getAuditLog().warn("  Rebuild transaction rolled back, original table intact");
        } catch (SQLException e) {
            context.getAuditLog().error("  Transaction rollback failed: {}", e.getMessage());
        } finally {
            try {
                conn.close();
            } catch (SQLException e) {
                log.warn("[Run-{}] Could not close connection: {}", context.getRunId(), e.getMessage());
            }
        }
    }
}
