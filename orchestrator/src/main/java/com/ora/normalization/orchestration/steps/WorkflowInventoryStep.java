package com.ora.normalization.orchestration.steps;

import com.ora.normalization.orchestration.MigrationContext;
import com.ora.normalization.orchestration.MigrationStep;
import com.ora.normalization.service.workflow.WorkflowQuiescenceController;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Prework step reporting which workflows the Migration phase will have to pause.
 * Process inspection problems are warnings here.
 */
@Component
@RequiredArgsConstructor
public class WorkflowInventoryStep implements MigrationStep {

    private final WorkflowQuiescenceController quiescenceController;

    @Override
    public void execute(MigrationContext context) {
        try {
            List<String> running = quiescenceController.runningWorkflows(context);
            if (running.isEmpty()) {
                context.getAuditLog().info("  No configured workflows are running");
            } else {
                context.getAuditLog().info("  Workflows to pause during migration: {}", running);
            }
        } catch (RuntimeException e) {
            context.getAuditLog().warn("  Could not inspect workflow processes: {}", e.getMessage());
        }
    }

    @Override
    public String getStepName() {
        return "Inventory workflows";
    }
}
