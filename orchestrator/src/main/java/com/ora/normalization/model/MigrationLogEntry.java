package com.ora.normalization.model;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * One line of a run's audit trail.
 */
public record MigrationLogEntry(LocalDateTime timestamp, Level level, String message) {

    private static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    public enum Level {
        INFO, WARN, ERROR, CRITICAL
    }

    public String format() {
        return "[" + FORMAT.format(timestamp) + "] [" + level + "] " + message;
    }
}
