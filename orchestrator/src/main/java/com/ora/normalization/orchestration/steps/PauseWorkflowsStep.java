package com.ora.normalization.orchestration.steps;

import com.ora.normalization.orchestration.MigrationContext;
import com.ora.normalization.orchestration.MigrationStep;
import com.ora.normalization.service.workflow.WorkflowQuiescenceController;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class PauseWorkflowsStep implements MigrationStep {

    private final WorkflowQuiescenceController quiescenceController;

    @Override
    public void execute(MigrationContext context) {
        quiescenceController.pauseWorkflows(context);
    }

    @Override
    public String getStepName() {
        return "Pause workflows";
    }

    @Override
    public boolean shouldSkip(MigrationContext context) {
        return context.isTestMode();
    }
}
