package com.ora.normalization.service.backup;

import com.ora.normalization.config.MigrationProperties;
import com.ora.normalization.infrastructure.database.DatabaseConnectionConfig;
import com.ora.normalization.infrastructure.database.DatabaseConnectionFactory;
import com.ora.normalization.model.BackupSet;
import com.ora.normalization.orchestration.MigrationContext;
import com.ora.normalization.util.SqliteSupport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes the operator marker files describing the freeze point of a backup set.
 * Nothing in this application reads them back except tests and operators.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class FreezeMarkerWriter {

    public static final String FREEZE_TIMESTAMP_FILE = "freeze_timestamp.txt";
    public static final String BACKUP_ID_FILE = "backup_id.txt";
    public static final String ROW_COUNTS_FILE = "backup_row_counts.txt";

    private final MigrationProperties properties;
    private final DatabaseConnectionFactory connectionFactory;
    private final Clock clock;

    /**
     * Record the freeze time, backup id and key table row counts taken from the primary snapshot.
     *
     * @return the recorded row counts
     */
    public Map<String, Long> writeMarkers(MigrationContext context, BackupSet backupSet) throws IOException {
        Path directory = context.getMarkerDirectory();
        Files.createDirectories(directory);

        Files.writeString(directory.resolve(FREEZE_TIMESTAMP_FILE), LocalDateTime.now(clock) + System.lineSeparator());
        Files.writeString(directory.resolve(BACKUP_ID_FILE), backupSet.backupId() + System.lineSeparator());

        Map<String, Long> counts = rowCounts(backupSet.primary().path(), properties.getSchema().getKeyTables());
        StringBuilder content = new StringBuilder();
        counts.forEach((table, count) -> content.append(table).append(": ").append(count).append(System.lineSeparator()));
        Files.writeString(directory.resolve(ROW_COUNTS_FILE), content.toString());

        context.getAuditLog().info("  Freeze markers written to {}: {}", directory, counts);
        return counts;
    }

    /**
     * Row counts of the given tables; tables missing from the store are recorded as -1.
     */
    public Map<String, Long> rowCounts(Path store, List<String> tables) throws IOException {
        Map<String, Long> counts = new LinkedHashMap<>();
        try (Connection conn = connectionFactory.createConnection(DatabaseConnectionConfig.snapshot(store))) {
            for (String table : tables) {
                counts.put(table, SqliteSupport.tableExists(conn, table) ? SqliteSupport.countRows(conn, table) : -1L);
            }
        } catch (SQLException e) {
            throw new IOException("Could not count rows in " + store + ": " + e.getMessage(), e);
        }
        return counts;
    }

    /**
     * Parse a row counts marker file back into a map.
     */
    public static Map<String, Long> readRowCounts(Path markerFile) throws IOException {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (String line : Files.readAllLines(markerFile)) {
            int separator = line.lastIndexOf(':');
            if (separator > 0) {
                counts.put(line.substring(0, separator).trim(), Long.parseLong(line.substring(separator + 1).trim()));
            }
        }
        return counts;
    }
}
