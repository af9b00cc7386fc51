package com.ora.normalization.service.backup;

import com.ora.normalization.config.MigrationProperties;
import com.ora.normalization.exception.BackupException;
import com.ora.normalization.exception.MigrationException;
import com.ora.normalization.infrastructure.database.DatabaseConnectionFactory;
import com.ora.normalization.model.BackupSet;
import com.ora.normalization.model.FailureCategory;
import com.ora.normalization.model.RunMode;
import com.ora.normalization.orchestration.MigrationContext;
import com.ora.normalization.support.RecordingProcessController;
import com.ora.normalization.support.TestContexts;
import com.ora.normalization.support.TestStore;
import com.ora.normalization.util.FileChecksums;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BackupManagerTest {

    @TempDir
    Path tempDir;

    private Path store;
    private BackupManager backupManager;
    private FreezeMarkerWriter markerWriter;

    @BeforeEach
    void setUp() throws Exception {
        store = TestStore.create(tempDir, "backup.db");
        DatabaseConnectionFactory connectionFactory = new DatabaseConnectionFactory();
        backupManager = new BackupManager(connectionFactory, Clock.systemDefaultZone());
        markerWriter = new FreezeMarkerWriter(new MigrationProperties(), connectionFactory, Clock.systemDefaultZone());
    }

    private MigrationContext context(String runId) {
        return TestContexts.context(runId, RunMode.MIGRATE, store, tempDir, new RecordingProcessController());
    }

    // ========== Backup Creation ==========

    @Test
    @DisplayName("Should create verified primary and secondary backups with identical checksums")
    void testCreateVerifiedBackups() throws Exception {
        BackupSet backupSet = backupManager.createVerifiedBackups(context("20251019_010203"));

        assertTrue(backupSet.isVerified());
        assertEquals("20251019_010203", backupSet.backupId());
        assertEquals(backupSet.primary().checksum(), backupSet.secondary().checksum());
        assertEquals(tempDir.resolve("backups/backup.db.backup_primary_20251019_010203"), backupSet.primary().path());
        assertTrue(Files.exists(backupSet.secondary().path()));
        assertEquals(backupSet.primary().checksum(), FileChecksums.readRecordedChecksum(backupSet.primary().path()));
        assertEquals(TestStore.SOURCE_ROWS, TestStore.countRows(backupSet.primary().path(), "shipped_items"));
    }

    @Test
    @DisplayName("Should fail with a backup failure when the store is missing")
    void testMissingStore() throws Exception {
        Files.delete(store);

        MigrationException e = assertThrows(BackupException.class,
            () -> backupManager.createVerifiedBackups(context("20251019_010203")));
        assertEquals(FailureCategory.BACKUP_FAILURE, e.getCategory());
    }

    @Test
    @DisplayName("Should refuse to overwrite an existing backup")
    void testExistingBackup() {
        backupManager.createVerifiedBackups(context("20251019_010203"));

        assertThrows(BackupException.class, () -> backupManager.createVerifiedBackups(context("20251019_010203")));
    }

    // ========== Verification ==========

    @Test
    @DisplayName("Should reject a backup whose content no longer matches its checksum")
    void testTamperedBackupUnusable() throws Exception {
        BackupSet backupSet = backupManager.createVerifiedBackups(context("20251019_010203"));
        Path primary = backupSet.primary().path();
        assertTrue(backupManager.isUsable(primary, TestStore.log()));

        TestStore.execute(primary, "DELETE FROM shipped_orders WHERE order_number = 'ORD3'");

        assertFalse(backupManager.isUsable(primary, TestStore.log()));
    }

    @Test
    @DisplayName("Should report a corrupted snapshot")
    void testCorruptedSnapshot() throws Exception {
        Path garbage = tempDir.resolve("garbage.db");
        Files.writeString(garbage, "this is not a database", StandardOpenOption.CREATE);

        assertNotEquals("ok", backupManager.integrityOf(garbage));
        assertFalse(backupManager.isUsable(garbage, TestStore.log()));
        assertFalse(backupManager.isUsable(tempDir.resolve("absent.db"), TestStore.log()));
    }

    @Test
    @DisplayName("Should find the newest backup by run timestamp")
    void testNewestBackup() {
        backupManager.createVerifiedBackups(context("20251019_010203"));
        backupManager.createVerifiedBackups(context("20251019_020000"));

        Path backups = tempDir.resolve("backups");
        assertEquals("backup.db.backup_primary_20251019_020000",
            backupManager.newestPrimary(backups, store).orElseThrow().getFileName().toString());
        assertEquals("backup.db.backup_secondary_20251019_020000",
            backupManager.newestSecondary(backups, store).orElseThrow().getFileName().toString());
        assertTrue(backupManager.newestPrimary(tempDir.resolve("none"), store).isEmpty());
    }

    // ========== Freeze Markers ==========

    @Test
    @DisplayName("Should record the freeze point row counts")
    void testFreezeMarkers() throws Exception {
        MigrationContext context = context("20251019_010203");
        BackupSet backupSet = backupManager.createVerifiedBackups(context);

        Map<String, Long> counts = markerWriter.writeMarkers(context, backupSet);

        Path markers = tempDir.resolve("migration");
        assertEquals(Map.of("shipped_items", (long) TestStore.SOURCE_ROWS, "shipped_orders", (long) TestStore.ORDER_ROWS), counts);
        assertEquals(counts, FreezeMarkerWriter.readRowCounts(markers.resolve(FreezeMarkerWriter.ROW_COUNTS_FILE)));
        assertEquals("20251019_010203", Files.readString(markers.resolve(FreezeMarkerWriter.BACKUP_ID_FILE)).trim());
        assertTrue(Files.exists(markers.resolve(FreezeMarkerWriter.FREEZE_TIMESTAMP_FILE)));
    }
}
