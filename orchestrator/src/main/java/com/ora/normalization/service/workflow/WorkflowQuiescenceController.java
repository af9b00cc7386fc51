package com.ora.normalization.service.workflow;

import com.ora.normalization.config.MigrationProperties;
import com.ora.normalization.exception.ProcessControlException;
import com.ora.normalization.orchestration.MigrationContext;
import com.ora.normalization.orchestration.MigrationLog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Pauses the configured ingestion workflows for the destructive window and resumes them after.
 *
 * <p>Only a failure to pause during a Migration run aborts; failing to resume is reported
 * and left to the operator.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class WorkflowQuiescenceController {

    private final MigrationProperties properties;

    /**
     * Stop every configured workflow using the run's process controller.
     *
     * @throws ProcessControlException if any workflow is still running afterwards
     */
    public ProcessControlResult pauseWorkflows(MigrationContext context) {
        MigrationLog auditLog = context.getAuditLog();
        List<String> names = properties.getWorkflows().getNames();
        auditLog.info("  Pausing workflows: {}", names);

        ProcessControlResult result = context.getProcessController().pause(names);
        if (!result.success()) {
            auditLog.critical("  Workflows still running: {}", result.remaining());
            throw new ProcessControlException("Could not pause workflows: " + result.message());
        }
        auditLog.info("  ✓ Workflows paused ({})", result.message());
        return result;
    }

    /**
     * Relaunch the workflow supervisor. Never throws; a failure is logged as a warning.
     */
    public ProcessControlResult resumeWorkflows(MigrationContext context) {
        MigrationLog auditLog = context.getAuditLog();
        ProcessControlResult result;
        try {
            result = context.getProcessController().resume();
        } catch (RuntimeException e) {
            result = ProcessControlResult.failure(List.of(), e.getMessage());
        }
        if (result.success()) {
            auditLog.info("  ✓ Workflows resumed ({})", result.message());
        } else {
            auditLog.warn("  Workflows were not resumed, restart them manually: {}", result.message());
        }
        return result;
    }

    /**
     * Report which configured workflows are currently running without touching them.
     */
    public List<String> runningWorkflows(MigrationContext context) {
        return context.getProcessController().running(properties.getWorkflows().getNames());
    }

    /**
     * Stop every workflow process ahead of a restore.
     */
    public ProcessControlResult stopAllWorkflows(MigrationContext context) {
        ProcessControlResult result = context.getProcessController().stopAll();
        if (result.success()) {
            context.getAuditLog().info("  Workflow processes stopped: {}", result.message());
        } else {
            context.getAuditLog().warn("  Workflow processes still running: {}", result.message());
        }
        return result;
    }
}
