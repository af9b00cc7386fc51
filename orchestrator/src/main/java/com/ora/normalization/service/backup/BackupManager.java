package com.ora.normalization.service.backup;

import com.ora.normalization.exception.BackupException;
import com.ora.normalization.infrastructure.database.DatabaseConnectionConfig;
import com.ora.normalization.infrastructure.database.DatabaseConnectionFactory;
import com.ora.normalization.model.BackupArtifact;
import com.ora.normalization.model.BackupSet;
import com.ora.normalization.orchestration.MigrationContext;
import com.ora.normalization.orchestration.MigrationLog;
import com.ora.normalization.util.FileChecksums;
import com.ora.normalization.util.SqliteSupport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Creates and verifies point-in-time snapshots of the store.
 *
 * <p>A backup set is a primary snapshot that passed {@code PRAGMA integrity_check} and a
 * secondary byte copy of it with an identical checksum. Snapshots are never pruned here.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BackupManager {

    static final String PRIMARY_MARKER = ".backup_primary_";
    static final String SECONDARY_MARKER = ".backup_secondary_";

    private final DatabaseConnectionFactory connectionFactory;
    private final Clock clock;

    /**
     * Create the primary and secondary snapshots for this run and verify both.
     *
     * @throws BackupException if either snapshot cannot be created or verified
     */
    public BackupSet createVerifiedBackups(MigrationContext context) {
        MigrationLog auditLog = context.getAuditLog();
        Path store = context.getDatabasePath();
        String backupId = context.getRunId();

        try {
            Files.createDirectories(context.getBackupDirectory());

            checkpointStore(context);

            Path primary = context.getBackupDirectory().resolve(store.getFileName() + PRIMARY_MARKER + backupId);
            Files.copy(store, primary);
            auditLog.info("  Created primary backup: {}", primary);

            String integrity = integrityOf(primary);
            if (!SqliteSupport.INTEGRITY_OK.equals(integrity)) {
                throw new BackupException("Primary backup corrupted: " + integrity);
            }
            String primaryChecksum = FileChecksums.sha256(primary);
            FileChecksums.writeChecksumFile(primary, primaryChecksum);
            auditLog.info("  Primary backup verified");

            Path secondary = context.getBackupDirectory().resolve(store.getFileName() + SECONDARY_MARKER + backupId);
            Files.copy(primary, secondary);
            String secondaryChecksum = FileChecksums.sha256(secondary);

            if (!primaryChecksum.equals(secondaryChecksum)) {
                throw new BackupException("Secondary backup checksum mismatch");
            }
            FileChecksums.writeChecksumFile(secondary, secondaryChecksum);
            auditLog.info("  Secondary backup verified (checksum: {}...)", primaryChecksum.substring(0, 8));
            auditLog.info("  Total backup size: {} MB", String.format("%.2f", Files.size(primary) / 1024.0 / 1024.0));

            LocalDateTime now = LocalDateTime.now(clock);
            return new BackupSet(backupId,
                new BackupArtifact(primary, primaryChecksum, now, true),
                new BackupArtifact(secondary, secondaryChecksum, now, true));

        } catch (IOException e) {
            throw new BackupException("Backup creation failed: " + e.getMessage(), e);
        }
    }

    /**
     * Result of {@code PRAGMA integrity_check} on a snapshot file, {@code "ok"} when sound.
     * Any failure to open or read the file is reported as the result.
     */
    public String integrityOf(Path snapshot) {
        if (!Files.isRegularFile(snapshot)) {
            return "file not found";
        }
        try (Connection conn = connectionFactory.createConnection(DatabaseConnectionConfig.snapshot(snapshot))) {
            return SqliteSupport.integrityCheck(conn);
        } catch (SQLException | RuntimeException e) {
            log.warn("Integrity check of {} failed: {}", snapshot, e.getMessage());
            return "unreadable: " + e.getMessage();
        }
    }

    /**
     * Whether a snapshot is sound and, when a checksum file exists for it, still matches it.
     */
    public boolean isUsable(Path snapshot, MigrationLog auditLog) {
        String integrity = integrityOf(snapshot);
        if (!SqliteSupport.INTEGRITY_OK.equals(integrity)) {
            auditLog.critical("Backup integrity check failed for {}: {}", snapshot, integrity);
            return false;
        }
        try {
            String recorded = FileChecksums.readRecordedChecksum(snapshot);
            if (recorded != null && !recorded.equalsIgnoreCase(FileChecksums.sha256(snapshot))) {
                auditLog.critical("Backup checksum mismatch for {}", snapshot);
                return false;
            }
        } catch (IOException e) {
            auditLog.critical("Backup checksum could not be verified for {}: {}", snapshot, e.getMessage());
            return false;
        }
        return true;
    }

    public Optional<Path> newestPrimary(Path backupDirectory, Path store) {
        return newest(backupDirectory, store.getFileName() + PRIMARY_MARKER);
    }

    public Optional<Path> newestSecondary(Path backupDirectory, Path store) {
        return newest(backupDirectory, store.getFileName() + SECONDARY_MARKER);
    }

    /**
     * Snapshot names end with the run timestamp, so name order is creation order.
     */
    private Optional<Path> newest(Path backupDirectory, String prefix) {
        if (!Files.isDirectory(backupDirectory)) {
            return Optional.empty();
        }
        List<Path> candidates = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(backupDirectory, prefix + "*")) {
            for (Path path : stream) {
                if (isSnapshotFile(path.getFileName().toString())) {
                    candidates.add(path);
                }
            }
        } catch (IOException e) {
            log.warn("Could not list backups in {}: {}", backupDirectory, e.getMessage());
            return Optional.empty();
        }
        return candidates.stream().max(Comparator.comparing(p -> p.getFileName().toString()));
    }

    private static boolean isSnapshotFile(String name) {
        return !name.endsWith(FileChecksums.EXTENSION) && !name.endsWith("-wal") && !name.endsWith("-shm");
    }

    private void checkpointStore(MigrationContext context) {
        try (Connection conn = connectionFactory.createConnection(context.connectionConfig())) {
            SqliteSupport.checkpoint(conn);
            log.debug("Checkpointed {} before snapshot", context.getDatabasePath());
        } catch (SQLException | RuntimeException e) {
            throw new BackupException("Could not checkpoint store before backup: " + e.getMessage(), e);
        }
    }
}
