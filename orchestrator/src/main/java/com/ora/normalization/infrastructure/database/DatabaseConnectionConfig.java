package com.ora.normalization.infrastructure.database;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.file.Path;

/**
 * Configuration holder for store connections.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DatabaseConnectionConfig {

    private Path path;

    /**
     * Enforce foreign keys on this connection.
     */
    @Builder.Default
    private boolean foreignKeys = true;

    /**
     * Switch the store to write-ahead logging when opened. Off for snapshot inspection,
     * so that a backup file is never rewritten by opening it.
     */
    @Builder.Default
    private boolean walMode = true;

    /**
     * Open transactions with BEGIN IMMEDIATE so no other writer can proceed once one starts.
     */
    @Builder.Default
    private boolean immediateTransactions = true;

    @Builder.Default
    private int busyTimeoutMs = 30000;

    public String getJdbcUrl() {
        return "jdbc:sqlite:" + path.toAbsolutePath();
    }

    /**
     * Settings for the live store.
     */
    public static DatabaseConnectionConfig live(Path path, int busyTimeoutMs) {
        return DatabaseConnectionConfig.builder()
            .path(path)
            .busyTimeoutMs(busyTimeoutMs)
            .build();
    }

    /**
     * Settings for inspecting a snapshot without changing its journal mode.
     */
    public static DatabaseConnectionConfig snapshot(Path path) {
        return DatabaseConnectionConfig.builder()
            .path(path)
            .foreignKeys(false)
            .walMode(false)
            .immediateTransactions(false)
            .build();
    }
}
