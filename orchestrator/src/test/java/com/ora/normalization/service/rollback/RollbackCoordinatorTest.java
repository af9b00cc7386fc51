package com.ora.normalization.service.rollback;

import com.ora.normalization.config.MigrationProperties;
import com.ora.normalization.infrastructure.database.DatabaseConnectionFactory;
import com.ora.normalization.model.BackupSet;
import com.ora.normalization.model.RollbackResult;
import com.ora.normalization.model.RunMode;
import com.ora.normalization.orchestration.MigrationContext;
import com.ora.normalization.service.backup.BackupManager;
import com.ora.normalization.service.workflow.WorkflowQuiescenceController;
import com.ora.normalization.support.RecordingProcessController;
import com.ora.normalization.support.TestContexts;
import com.ora.normalization.support.TestStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RollbackCoordinatorTest {

    @TempDir
    Path tempDir;

    private Path store;
    private BackupManager backupManager;
    private RollbackCoordinator coordinator;
    private RecordingProcessController processController;

    @BeforeEach
    void setUp() throws Exception {
        store = TestStore.create(tempDir, "rollback.db");
        backupManager = new BackupManager(new DatabaseConnectionFactory(), Clock.systemDefaultZone());
        coordinator = new RollbackCoordinator(backupManager,
            new WorkflowQuiescenceController(new MigrationProperties()));
        processController = new RecordingProcessController();
    }

    private MigrationContext context(String runId) {
        return TestContexts.context(runId, RunMode.ROLLBACK, store, tempDir, processController);
    }

    @Test
    @DisplayName("Should restore the newest primary backup")
    void testRestorePrimary() throws Exception {
        BackupSet backupSet = backupManager.createVerifiedBackups(context("20251019_010203"));
        TestStore.execute(store, "DELETE FROM shipped_items");

        RollbackResult result = coordinator.restore(context("20251019_020000"));

        assertTrue(result.restored());
        assertEquals(backupSet.primary().path(), result.backupUsed());
        assertEquals(TestStore.SOURCE_ROWS, TestStore.countRows(store, "shipped_items"));
        assertEquals(TestStore.ORDER_ROWS, TestStore.countRows(store, "shipped_orders"));
    }

    @Test
    @DisplayName("Should stop workflows before restoring and resume them after")
    void testWorkflowOrdering() {
        backupManager.createVerifiedBackups(context("20251019_010203"));

        coordinator.restore(context("20251019_020000"));

        assertEquals(List.of("stopAll", "resume"), processController.getCalls());
    }

    @Test
    @DisplayName("Should fall back to the secondary backup when the primary is corrupt")
    void testFallbackToSecondary() throws Exception {
        BackupSet backupSet = backupManager.createVerifiedBackups(context("20251019_010203"));
        Files.writeString(backupSet.primary().path(), "corrupted");
        TestStore.execute(store, "DELETE FROM shipped_items");

        RollbackResult result = coordinator.restore(context("20251019_020000"));

        assertTrue(result.restored());
        assertEquals(backupSet.secondary().path(), result.backupUsed());
        assertEquals(TestStore.SOURCE_ROWS, TestStore.countRows(store, "shipped_items"));
    }

    @Test
    @DisplayName("Should report a catastrophic failure when no backup is usable")
    void testNoUsableBackup() throws Exception {
        BackupSet backupSet = backupManager.createVerifiedBackups(context("20251019_010203"));
        Files.writeString(backupSet.primary().path(), "corrupted");
        Files.writeString(backupSet.secondary().path(), "corrupted too");
        TestStore.execute(store, "DELETE FROM shipped_items");

        RollbackResult result = coordinator.restore(context("20251019_020000"));

        assertFalse(result.restored());
        assertNull(result.backupUsed());
        assertEquals(0, TestStore.countRows(store, "shipped_items"));
        assertFalse(processController.getCalls().contains("resume"));
    }

    @Test
    @DisplayName("Should report a catastrophic failure when there are no backups at all")
    void testNoBackups() {
        RollbackResult result = coordinator.restore(context("20251019_020000"));

        assertFalse(result.restored());
    }

    @Test
    @DisplayName("Should keep the replaced store next to the backups")
    void testPreservesReplacedStore() throws Exception {
        backupManager.createVerifiedBackups(context("20251019_010203"));
        TestStore.execute(store, "DELETE FROM shipped_items");

        coordinator.restore(context("20251019_020000"));

        Path saved = tempDir.resolve("backups/rollback.db.pre_rollback_20251019_020000");
        assertTrue(Files.exists(saved));
        assertEquals(0, TestStore.countRows(saved, "shipped_items"));
    }
}
