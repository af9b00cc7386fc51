package com.ora.normalization.orchestration;

import com.ora.normalization.config.MigrationProperties;
import com.ora.normalization.exception.ConfigurationException;
import com.ora.normalization.model.FailureCategory;
import com.ora.normalization.model.MigrationOutcome;
import com.ora.normalization.model.MigrationState;
import com.ora.normalization.model.RebuildReport;
import com.ora.normalization.model.RollbackResult;
import com.ora.normalization.model.RunMode;
import com.ora.normalization.orchestration.steps.BuildEntityCatalogStep;
import com.ora.normalization.orchestration.steps.BuildLotCatalogStep;
import com.ora.normalization.orchestration.steps.TestReplayStep;
import com.ora.normalization.orchestration.steps.VerifyParserStep;
import com.ora.normalization.orchestration.steps.WorkflowInventoryStep;
import com.ora.normalization.service.MigrationRunService;
import com.ora.normalization.service.rollback.RollbackCoordinator;
import com.ora.normalization.service.workflow.ProcessController;
import com.ora.normalization.util.RunIds;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.List;

/**
 * Orchestrator for the normalization migration.
 *
 * <p>Entry points: Prework (catalogs and checks, safe to repeat alongside live traffic),
 * Migration (backup, quiesce, rebuild, validate, commit, resume), Rollback and test replay.
 * State changes happen only on the {@link StepResult} values the steps produce.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MigrationOrchestrator {

    // Prework steps
    private final BuildEntityCatalogStep buildEntityCatalogStep;
    private final BuildLotCatalogStep buildLotCatalogStep;
    private final VerifyParserStep verifyParserStep;
    private final WorkflowInventoryStep workflowInventoryStep;
    private final TestReplayStep testReplayStep;

    private final StepExecutor stepExecutor;
    private final MigrationSequence migrationSequence;
    private final TestReplayRunner testReplayRunner;
    private final RollbackCoordinator rollbackCoordinator;
    private final MigrationRunService runService;
    private final ProcessController processController;
    private final MigrationProperties properties;
    private final Clock clock;

    private volatile MigrationState state = MigrationState.IDLE;

    public MigrationState getState() {
        return state;
    }

    /**
     * Run the entry point selected by {@code mode} against the store at {@code database}.
     */
    public MigrationOutcome run(RunMode mode, Path database) {
        return switch (mode) {
            case PREWORK -> prework(database);
            case MIGRATE -> migrate(database);
            case ROLLBACK -> rollback(database);
            case TEST_REPLAY -> testReplay(database);
        };
    }

    /**
     * Build catalogs and check readiness. Never touches the fact table and always ends in {@code IDLE}.
     */
    public MigrationOutcome prework(Path database) {
        MigrationContext context = begin(RunMode.PREWORK, database, MigrationState.PREWORK);
        MigrationLog auditLog = context.getAuditLog();

        List<MigrationStep> steps = List.of(
            buildEntityCatalogStep, buildLotCatalogStep, verifyParserStep, workflowInventoryStep, testReplayStep);

        String message = "Prework complete, ready for migration";
        for (MigrationStep step : steps) {
            StepResult result = stepExecutor.execute(step, context, FailureCategory.PREWORK_FAILURE);
            if (result.isFailure()) {
                if (result.category() == FailureCategory.PROCESS_CONTROL_FAILURE) {
                    auditLog.warn("Process control problem during Prework, continuing: {}", result.message());
                    continue;
                }
                context.recordFailure(result.category());
                message = "Prework failed at '" + result.stepName() + "': " + result.message();
                break;
            }
        }

        state = MigrationState.IDLE;
        auditLog.info("Catalogs: {} SKUs, {} lots", context.getEntityCatalogRows(), context.getSubIdentifierCatalogRows());
        return finish(context, state, message);
    }

    /**
     * The live migration. Any failure after the backups exist restores the newest verified backup.
     */
    public MigrationOutcome migrate(Path database) {
        MigrationContext context = begin(RunMode.MIGRATE, database, MigrationState.MIGRATING);
        MigrationLog auditLog = context.getAuditLog();

        StepResult result = migrationSequence.run(context);
        if (result.success()) {
            state = MigrationState.COMMITTED;
            return finish(context, state, "Migration committed");
        }

        if (result.category() == FailureCategory.BACKUP_FAILURE) {
            // Nothing destructive has happened yet
            auditLog.error("Backup failed, store left unchanged: {}", result.message());
            state = MigrationState.ROLLED_BACK;
            return finish(context, state, "Aborted before any change: " + result.message());
        }

        auditLog.error("Migration failed at '{}': {}", result.stepName(), result.message());
        RollbackResult rollback = rollbackCoordinator.restore(context);
        if (rollback.restored()) {
            state = MigrationState.ROLLED_BACK;
            return finish(context, state, "Migration failed at '" + result.stepName() + "' and was rolled back: "
                + rollback.message());
        }
        context.recordFailure(FailureCategory.CATASTROPHIC_FAILURE);
        state = MigrationState.FAILED;
        return finish(context, state, "Migration failed and rollback could not complete: " + rollback.message()
            + ". Manual intervention required");
    }

    /**
     * Restore the newest verified backup, independent of any earlier run.
     */
    public MigrationOutcome rollback(Path database) {
        MigrationContext context = begin(RunMode.ROLLBACK, database, state);

        RollbackResult result = rollbackCoordinator.restore(context);
        if (result.restored()) {
            state = MigrationState.ROLLED_BACK;
            return finish(context, state, "Rollback complete: " + result.message());
        }
        context.recordFailure(FailureCategory.CATASTROPHIC_FAILURE);
        state = MigrationState.FAILED;
        return finish(context, state, "Rollback failed: " + result.message() + ". Manual intervention required");
    }

    /**
     * Replay the Migration phase on a disposable copy of the store.
     */
    public MigrationOutcome testReplay(Path database) {
        MigrationContext context = begin(RunMode.TEST_REPLAY, database, MigrationState.MIGRATING);

        MigrationOutcome replay = testReplayRunner.replay(context);
        replay.failures().forEach(context::recordFailure);
        state = replay.state();

        MigrationOutcome outcome = new MigrationOutcome(context.getRunId(), RunMode.TEST_REPLAY, state,
            context.getFailures(), replay.rowsMigrated(), replay.rowsSkipped(), replay.lotsCreated(),
            replay.message(), context.getAuditLog().getLogFile());
        runService.record(outcome, context);
        return outcome;
    }

    private MigrationContext begin(RunMode mode, Path database, MigrationState runningState) {
        if (state.isRunning()) {
            throw new IllegalStateException("A run is already in progress: " + state.getDisplayName());
        }
        String runId = RunIds.newRunId(clock);
        MigrationContext context = MigrationContext.builder()
            .runId(runId)
            .mode(mode)
            .databasePath(database.toAbsolutePath())
            .testMode(mode == RunMode.TEST_REPLAY)
            .backupDirectory(Paths.get(properties.getBackup().getDirectory()).toAbsolutePath())
            .markerDirectory(Paths.get(properties.getOutput().getMarkerDirectory()).toAbsolutePath())
            .busyTimeoutMs(properties.getDatabase().getBusyTimeoutMs())
            .processController(processController)
            .auditLog(new MigrationLog(runId, clock, runLogFile(runId)))
            .build();

        state = runningState;
        context.getAuditLog().info("========== {} STARTED ==========", mode.getOptionName().toUpperCase());
        context.getAuditLog().info("Store: {}", context.getDatabasePath());
        return context;
    }

    private MigrationOutcome finish(MigrationContext context, MigrationState finalState, String message) {
        RebuildReport report = context.getRebuildReport();
        MigrationOutcome outcome = new MigrationOutcome(
            context.getRunId(),
            context.getMode(),
            finalState,
            context.getFailures(),
            report == null ? 0 : report.migratedRows(),
            report == null ? 0 : report.skippedRows(),
            report == null ? 0 : report.lotsCreated(),
            message,
            context.getAuditLog().getLogFile());
        runService.record(outcome, context);
        return outcome;
    }

    private Path runLogFile(String runId) {
        Path logDirectory = Paths.get(properties.getOutput().getLogDirectory()).toAbsolutePath();
        try {
            Files.createDirectories(logDirectory);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot create log directory " + logDirectory + ": " + e.getMessage(), e);
        }
        return logDirectory.resolve("migration_" + runId + ".log");
    }
}
