package com.ora.normalization.orchestration;

import com.ora.normalization.infrastructure.database.DatabaseConnectionFactory;
import com.ora.normalization.model.FailureCategory;
import com.ora.normalization.model.MigrationOutcome;
import com.ora.normalization.model.MigrationState;
import com.ora.normalization.model.RebuildReport;
import com.ora.normalization.model.RunMode;
import com.ora.normalization.service.workflow.NoOpProcessController;
import com.ora.normalization.util.SqliteSupport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Set;

/**
 * Replays the Migration phase against a disposable copy of a store.
 *
 * <p>The replay uses its own backup and marker directories and a process controller that
 * touches nothing. It never restores anything: a failed replay just discards the copy.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class TestReplayRunner {

    private final MigrationSequence migrationSequence;
    private final DatabaseConnectionFactory connectionFactory;

    public MigrationOutcome replay(MigrationContext source) {
        MigrationLog auditLog = source.getAuditLog();
        Path workDirectory = null;
        try {
            workDirectory = Files.createTempDirectory("migration-test-replay-");
            Path copy = copyStore(source, workDirectory);
            auditLog.info("TEST MODE: replaying migration on {}", copy);

            MigrationContext replay = source.forTestReplay(copy, workDirectory, new NoOpProcessController());
            StepResult result = migrationSequence.run(replay);

            RebuildReport report = replay.getRebuildReport();
            long migrated = report == null ? 0 : report.migratedRows();
            long skipped = report == null ? 0 : report.skippedRows();
            long lots = report == null ? 0 : report.lotsCreated();

            if (result.success()) {
                auditLog.info("TEST MODE: migration committed on the copy");
                return new MigrationOutcome(source.getRunId(), RunMode.TEST_REPLAY, MigrationState.COMMITTED,
                    replay.getFailures(), migrated, skipped, lots, "test replay committed", auditLog.getLogFile());
            }
            auditLog.error("TEST MODE: {} failed: {}", result.stepName(), result.message());
            return new MigrationOutcome(source.getRunId(), RunMode.TEST_REPLAY, MigrationState.ROLLED_BACK,
                replay.getFailures(), migrated, skipped, lots, result.message(), auditLog.getLogFile());

        } catch (IOException | RuntimeException e) {
            auditLog.error("TEST MODE: could not prepare disposable copy: {}", e.getMessage());
            return new MigrationOutcome(source.getRunId(), RunMode.TEST_REPLAY, MigrationState.FAILED,
                Set.of(FailureCategory.BACKUP_FAILURE), 0, 0, 0,
                "could not copy store: " + e.getMessage(), auditLog.getLogFile());
        } finally {
            discard(workDirectory);
        }
    }

    /**
     * Copies the store after a checkpoint; journal companions are copied too in case the
     * checkpoint could not fold everything in.
     */
    private Path copyStore(MigrationContext source, Path workDirectory) throws IOException {
        Path store = source.getDatabasePath();
        try (Connection conn = connectionFactory.createConnection(source.connectionConfig())) {
            SqliteSupport.checkpoint(conn);
        } catch (SQLException e) {
            source.getAuditLog().warn("  Checkpoint before copy failed, copying journal too: {}", e.getMessage());
        }

        Path copy = workDirectory.resolve(store.getFileName());
        Files.copy(store, copy);
        for (Path companion : SqliteSupport.companionFiles(store)) {
            if (Files.exists(companion)) {
                Files.copy(companion, workDirectory.resolve(companion.getFileName()));
            }
        }
        return copy;
    }

    private void discard(Path workDirectory) {
        if (workDirectory == null) {
            return;
        }
        try {
            FileSystemUtils.deleteRecursively(workDirectory);
        } catch (IOException e) {
            log.warn("Could not delete test replay directory {}: {}", workDirectory, e.getMessage());
        }
    }
}
