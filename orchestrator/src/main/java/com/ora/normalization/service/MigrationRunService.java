package com.ora.normalization.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ora.normalization.model.BackupSet;
import com.ora.normalization.model.FailureCategory;
import com.ora.normalization.model.MigrationLogEntry;
import com.ora.normalization.model.MigrationOutcome;
import com.ora.normalization.orchestration.MigrationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Reports finished runs: a console summary and a JSON summary next to the run log.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MigrationRunService {

    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Log the outcome and persist its summary. Failing to write the summary never changes the outcome.
     *
     * @return the summary file, or {@code null} if it could not be written
     */
    public Path record(MigrationOutcome outcome, MigrationContext context) {
        logSummary(outcome);

        Path logFile = outcome.logFile();
        if (logFile == null) {
            return null;
        }
        Path summaryFile = logFile.resolveSibling("migration_" + outcome.runId() + ".json");
        try {
            Files.writeString(summaryFile, objectMapper.writeValueAsString(toSummary(outcome, context)));
            log.info("[Run-{}] Summary written to {}", outcome.runId(), summaryFile);
            return summaryFile;
        } catch (IOException e) {
            log.error("[Run-{}] Could not write run summary {}: {}", outcome.runId(), summaryFile, e.getMessage());
            return null;
        }
    }

    private void logSummary(MigrationOutcome outcome) {
        log.info("[Run-{}] ========== {} {} ==========", outcome.runId(), outcome.mode().getOptionName().toUpperCase(),
            outcome.isSuccess() ? "COMPLETE" : "FAILED");
        log.info("[Run-{}] Final state: {}", outcome.runId(), outcome.state().getDisplayName());
        if (outcome.failures().isEmpty()) {
            log.info("[Run-{}] Failures: none", outcome.runId());
        } else {
            log.warn("[Run-{}] Failures: {}", outcome.runId(),
                outcome.failures().stream().map(FailureCategory::getDisplayName).sorted().toList());
        }
        log.info("[Run-{}] Rows migrated: {}, rows skipped: {}, lots created: {}",
            outcome.runId(), outcome.rowsMigrated(), outcome.rowsSkipped(), outcome.lotsCreated());
        log.info("[Run-{}] {}", outcome.runId(), outcome.message());
        if (outcome.logFile() != null) {
            log.info("[Run-{}] Log: {}", outcome.runId(), outcome.logFile());
        }
    }

    private RunSummary toSummary(MigrationOutcome outcome, MigrationContext context) {
        BackupSet backupSet = context.getBackupSet();
        return new RunSummary(
            outcome.runId(),
            outcome.mode().getOptionName(),
            outcome.state().name(),
            outcome.isSuccess(),
            outcome.failures().stream().map(FailureCategory::getDisplayName).sorted().toList(),
            outcome.rowsMigrated(),
            outcome.rowsSkipped(),
            outcome.lotsCreated(),
            outcome.message(),
            context.getDatabasePath().toString(),
            backupSet == null ? null : backupSet.primary().path().toString(),
            backupSet == null ? null : backupSet.secondary().path().toString(),
            context.getAuditLog().count(MigrationLogEntry.Level.WARN),
            context.getAuditLog().count(MigrationLogEntry.Level.ERROR)
                + context.getAuditLog().count(MigrationLogEntry.Level.CRITICAL),
            LocalDateTime.now(clock)
        );
    }

    /**
     * Persisted form of a finished run.
     */
    public record RunSummary(
            String runId,
            String mode,
            String state,
            boolean success,
            List<String> failures,
            long rowsMigrated,
            long rowsSkipped,
            long lotsCreated,
            String message,
            String database,
            String primaryBackup,
            String secondaryBackup,
            long warnings,
            long errors,
            LocalDateTime finishedAt
    ) {
    }
}
