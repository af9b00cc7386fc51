package com.ora.normalization.support;

import com.ora.normalization.model.RunMode;
import com.ora.normalization.orchestration.MigrationContext;
import com.ora.normalization.orchestration.MigrationLog;
import com.ora.normalization.service.workflow.ProcessController;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Run contexts rooted in a test directory.
 */
public final class TestContexts {

    private TestContexts() {
    }

    public static MigrationContext context(String runId, RunMode mode, Path store, Path workDir,
                                           ProcessController controller) {
        return MigrationContext.builder()
            .runId(runId)
            .mode(mode)
            .databasePath(store)
            .testMode(false)
            .backupDirectory(workDir.resolve("backups"))
            .markerDirectory(workDir.resolve("migration"))
            .busyTimeoutMs(1000)
            .processController(controller)
            .auditLog(new MigrationLog(runId, Clock.systemDefaultZone(), null))
            .build();
    }
}
