package com.ora.normalization.orchestration;

import com.ora.normalization.infrastructure.database.DatabaseConnectionConfig;
import com.ora.normalization.model.BackupSet;
import com.ora.normalization.model.FailureCategory;
import com.ora.normalization.model.RebuildReport;
import com.ora.normalization.model.RunMode;
import com.ora.normalization.model.ValidationReport;
import com.ora.normalization.service.workflow.ProcessController;
import lombok.Builder;
import lombok.Getter;
import lombok.Setter;

import java.nio.file.Path;
import java.sql.Connection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Context object that carries state through one run. Created once per run by the
 * orchestrator and passed to every step; no component keeps run state of its own.
 */
@Getter
public class MigrationContext {

    private final String runId;
    private final RunMode mode;
    private final Path databasePath;

    /**
     * Run against a disposable copy: no real workflows, no real backup set, no restore.
     */
    private final boolean testMode;

    private final Path backupDirectory;
    private final Path markerDirectory;
    private final int busyTimeoutMs;
    private final ProcessController processController;
    private final MigrationLog auditLog;

    /**
     * Connection holding the open rebuild transaction, between opening and commit.
     */
    @Setter
    private Connection connection;

    @Setter
    private BackupSet backupSet;

    @Setter
    private RebuildReport rebuildReport;

    @Setter
    private ValidationReport validationReport;

    @Setter
    private boolean committed;

    @Setter
    private long entityCatalogRows;

    @Setter
    private long subIdentifierCatalogRows;

    private final Set<FailureCategory> failures = EnumSet.noneOf(FailureCategory.class);

    @Builder
    public MigrationContext(
            String runId,
            RunMode mode,
            Path databasePath,
            boolean testMode,
            Path backupDirectory,
            Path markerDirectory,
            int busyTimeoutMs,
            ProcessController processController,
            MigrationLog auditLog) {
        this.runId = runId;
        this.mode = mode;
        this.databasePath = databasePath;
        this.testMode = testMode;
        this.backupDirectory = backupDirectory;
        this.markerDirectory = markerDirectory;
        this.busyTimeoutMs = busyTimeoutMs;
        this.processController = processController;
        this.auditLog = auditLog;
    }

    /**
     * Connection settings for the store this run works on.
     */
    public DatabaseConnectionConfig connectionConfig() {
        return DatabaseConnectionConfig.live(databasePath, busyTimeoutMs);
    }

    public void recordFailure(FailureCategory category) {
        failures.add(category);
    }

    public Set<FailureCategory> getFailures() {
        return Collections.unmodifiableSet(failures);
    }

    public boolean hasOpenTransaction() {
        return connection != null;
    }

    /**
     * Context for replaying the migration on a disposable copy of this run's store.
     */
    public MigrationContext forTestReplay(Path copy, Path workDirectory, ProcessController controller) {
        return MigrationContext.builder()
            .runId(runId)
            .mode(RunMode.TEST_REPLAY)
            .databasePath(copy)
            .testMode(true)
            .backupDirectory(workDirectory.resolve("backups"))
            .markerDirectory(workDirectory.resolve("markers"))
            .busyTimeoutMs(busyTimeoutMs)
            .processController(controller)
            .auditLog(auditLog.withLabel("test-replay"))
            .build();
    }
}
