package com.ora.normalization.service.rollback;

import com.ora.normalization.model.RollbackResult;
import com.ora.normalization.orchestration.MigrationContext;
import com.ora.normalization.orchestration.MigrationLog;
import com.ora.normalization.service.backup.BackupManager;
import com.ora.normalization.service.workflow.WorkflowQuiescenceController;
import com.ora.normalization.util.SqliteSupport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Restores the live store from the newest usable backup.
 *
 * <p>Works on files only, independent of any transaction, so it also recovers a store that
 * cannot be opened. The caller must have closed its own connections to the store.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RollbackCoordinator {

    static final String PRE_ROLLBACK_MARKER = ".pre_rollback_";

    private final BackupManager backupManager;
    private final WorkflowQuiescenceController quiescenceController;

    public RollbackResult restore(MigrationContext context) {
        MigrationLog auditLog = context.getAuditLog();
        Path store = context.getDatabasePath();
        Path backupDirectory = context.getBackupDirectory();

        auditLog.warn("ROLLBACK: restoring {} from {}", store, backupDirectory);
        quiescenceController.stopAllWorkflows(context);

        Optional<Path> backup = chooseBackup(backupDirectory, store, auditLog);
        if (backup.isEmpty()) {
            auditLog.critical("No usable backup found in {}. MANUAL INTERVENTION REQUIRED", backupDirectory);
            return RollbackResult.catastrophic("no usable backup in " + backupDirectory);
        }

        Path source = backup.get();
        try {
            preserveCurrentStore(store, backupDirectory, context.getRunId(), auditLog);
            SqliteSupport.deleteCompanionFiles(store);
            Files.copy(source, store, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            auditLog.critical("Restore from {} failed: {}. MANUAL INTERVENTION REQUIRED", source, e.getMessage());
            return RollbackResult.catastrophic("restore from " + source + " failed: " + e.getMessage());
        }

        String integrity = backupManager.integrityOf(store);
        if (!SqliteSupport.INTEGRITY_OK.equals(integrity)) {
            auditLog.critical("Restored store failed integrity check: {}. MANUAL INTERVENTION REQUIRED", integrity);
            return RollbackResult.catastrophic("restored store failed integrity check: " + integrity);
        }
        auditLog.info("✓ Store restored from {}", source.getFileName());

        quiescenceController.resumeWorkflows(context);
        return RollbackResult.restored(source, "restored from " + source.getFileName());
    }

    /**
     * The newest primary backup if usable, otherwise the newest secondary.
     */
    private Optional<Path> chooseBackup(Path backupDirectory, Path store, MigrationLog auditLog) {
        Optional<Path> primary = backupManager.newestPrimary(backupDirectory, store);
        if (primary.isPresent()) {
            auditLog.info("  Found primary backup: {}", primary.get().getFileName());
            if (backupManager.isUsable(primary.get(), auditLog)) {
                return primary;
            }
            auditLog.warn("  Primary backup unusable, trying secondary");
        } else {
            auditLog.warn("  No primary backup found, trying secondary");
        }

        Optional<Path> secondary = backupManager.newestSecondary(backupDirectory, store);
        if (secondary.isPresent() && backupManager.isUsable(secondary.get(), auditLog)) {
            auditLog.info("  Using secondary backup: {}", secondary.get().getFileName());
            return secondary;
        }
        return Optional.empty();
    }

    /**
     * Keeps the store being replaced, with its journal companions, next to the backups.
     */
    private void preserveCurrentStore(Path store, Path backupDirectory, String runId, MigrationLog auditLog)
            throws IOException {
        if (!Files.exists(store)) {
            return;
        }
        Files.createDirectories(backupDirectory);
        Path saved = backupDirectory.resolve(store.getFileName() + PRE_ROLLBACK_MARKER + runId);
        Files.copy(store, saved, StandardCopyOption.REPLACE_EXISTING);
        for (Path companion : SqliteSupport.companionFiles(store)) {
            if (Files.exists(companion)) {
                String suffix = companion.getFileName().toString().substring(store.getFileName().toString().length());
                Files.copy(companion, saved.resolveSibling(saved.getFileName() + suffix), StandardCopyOption.REPLACE_EXISTING);
            }
        }
        auditLog.info("  Current store saved as {}", saved.getFileName());
    }
}
