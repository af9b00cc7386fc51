package com.ora.normalization.orchestration.steps;

import com.ora.normalization.orchestration.MigrationContext;
import com.ora.normalization.orchestration.MigrationStep;
import com.ora.normalization.service.workflow.WorkflowQuiescenceController;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Runs after commit only. A failed resume is a warning, never a failed migration.
 */
@Component
@RequiredArgsConstructor
public class ResumeWorkflowsStep implements MigrationStep {

    private final WorkflowQuiescenceController quiescenceController;

    @Override
    public void execute(MigrationContext context) {
        quiescenceController.resumeWorkflows(context);
    }

    @Override
    public String getStepName() {
        return "Resume workflows";
    }

    @Override
    public boolean shouldSkip(MigrationContext context) {
        return context.isTestMode() || !context.isCommitted();
    }
}
