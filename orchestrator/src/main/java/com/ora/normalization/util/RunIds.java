package com.ora.normalization.util;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Run identifiers are the run start time, {@code yyyyMMdd_HHmmss}, so they sort chronologically.
 */
public class RunIds {

    private static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private RunIds() {
        // Utility class - prevent instantiation
    }

    public static String newRunId(Clock clock) {
        return FORMAT.format(LocalDateTime.now(clock));
    }
}
