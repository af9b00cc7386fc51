package com.ora.normalization.orchestration;

import com.ora.normalization.model.MigrationLogEntry;
import com.ora.normalization.model.MigrationLogEntry.Level;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.helpers.MessageFormatter;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Append-only audit trail of one run. Every entry goes to the application log and, when a
 * log file is set, is appended to the run's persisted log immediately.
 */
@Slf4j
public class MigrationLog {

    private final String runId;
    private final Clock clock;
    private final Path logFile;
    private final String label;
    private final List<MigrationLogEntry> entries;

    public MigrationLog(String runId, Clock clock, Path logFile) {
        this(runId, clock, logFile, "", Collections.synchronizedList(new ArrayList<>()));
    }

    private MigrationLog(String runId, Clock clock, Path logFile, String label, List<MigrationLogEntry> entries) {
        this.runId = runId;
        this.clock = clock;
        this.logFile = logFile;
        this.label = label;
        this.entries = entries;
    }

    /**
     * A view writing into the same trail with every message prefixed by {@code label}.
     */
    public MigrationLog withLabel(String label) {
        return new MigrationLog(runId, clock, logFile, "[" + label + "] ", entries);
    }

    public void info(String pattern, Object... args) {
        append(Level.INFO, pattern, args);
    }

    public void warn(String pattern, Object... args) {
        append(Level.WARN, pattern, args);
    }

    public void error(String pattern, Object... args) {
        append(Level.ERROR, pattern, args);
    }

    public void critical(String pattern, Object... args) {
        append(Level.CRITICAL, pattern, args);
    }

    public List<MigrationLogEntry> getEntries() {
        synchronized (entries) {
            return List.copyOf(entries);
        }
    }

    public long count(Level level) {
        return getEntries().stream().filter(e -> e.level() == level).count();
    }

    public Path getLogFile() {
        return logFile;
    }

    private void append(Level level, String pattern, Object... args) {
        String message = label + MessageFormatter.arrayFormat(pattern, args).getMessage();
        MigrationLogEntry entry = new MigrationLogEntry(LocalDateTime.now(clock), level, message);
        entries.add(entry);

        switch (level) {
            case INFO -> log.info("[Run-{}] {}", runId, message);
            case WARN -> log.warn("[Run-{}] {}", runId, message);
            case ERROR, CRITICAL -> log.error("[Run-{}] {}", runId, message);
        }

        if (logFile != null) {
            try {
                Files.writeString(logFile, entry.format() + System.lineSeparator(),
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            } catch (IOException e) {
                log.error("[Run-{}] Could not append to run log {}: {}", runId, logFile, e.getMessage());
            }
        }
    }
}
