package com.ora.normalization.orchestration.steps;

import com.ora.normalization.exception.BackupException;
import com.ora.normalization.model.BackupSet;
import com.ora.normalization.orchestration.MigrationContext;
import com.ora.normalization.orchestration.MigrationStep;
import com.ora.normalization.service.backup.BackupManager;
import com.ora.normalization.service.backup.FreezeMarkerWriter;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * First Migration step: verified backups and the freeze markers describing them.
 */
@Component
@RequiredArgsConstructor
public class CreateBackupsStep implements MigrationStep {

    private final BackupManager backupManager;
    private final FreezeMarkerWriter freezeMarkerWriter;

    @Override
    public void execute(MigrationContext context) {
        BackupSet backupSet = backupManager.createVerifiedBackups(context);
        context.setBackupSet(backupSet);
        try {
            freezeMarkerWriter.writeMarkers(context, backupSet);
        } catch (IOException e) {
            throw new BackupException("Could not write freeze markers: " + e.getMessage(), e);
        }
        context.getAuditLog().info("  ✓ Backup set {} verified", backupSet.backupId());
    }

    @Override
    public String getStepName() {
        return "Create verified backups";
    }
}
