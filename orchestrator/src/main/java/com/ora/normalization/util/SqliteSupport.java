package com.ora.normalization.util;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Catalog queries and maintenance pragmas for SQLite stores.
 */
@Slf4j
public class SqliteSupport {

    public static final String INTEGRITY_OK = "ok";

    private SqliteSupport() {
        // Utility class - prevent instantiation
    }

    public static boolean tableExists(Connection conn, String table) throws SQLException {
        String sql = "SELECT name FROM sqlite_master WHERE type = 'table' AND name = ?";
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, table);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next();
            }
        }
    }

    public static long countRows(Connection conn, String table) throws SQLException {
        SqlValidator.validateTableName(table);
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM " + table)) {
            if (rs.next()) {
                return rs.getLong(1);
            }
            throw new SQLException("No result returned from count query on " + table);
        }
    }

    /**
     * Column names of a table, in declaration order.
     */
    public static Set<String> columnNames(Connection conn, String table) throws SQLException {
        SqlValidator.validateTableName(table);
        Set<String> columns = new LinkedHashSet<>();
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("PRAGMA table_info(" + table + ")")) {
            while (rs.next()) {
                columns.add(rs.getString("name"));
            }
        }
        return columns;
    }

    /**
     * Explicitly created indexes of a table. Automatic indexes backing constraints have no SQL and are left out.
     */
    public static List<IndexDefinition> explicitIndexes(Connection conn, String table) throws SQLException {
        List<IndexDefinition> indexes = new ArrayList<>();
        String sql = "SELECT name, sql FROM sqlite_master WHERE type = 'index' AND tbl_name = ? AND sql IS NOT NULL";
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, table);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    indexes.add(new IndexDefinition(rs.getString("name"), rs.getString("sql"), new ArrayList<>()));
                }
            }
        }
        for (IndexDefinition index : indexes) {
            try (PreparedStatement stmt = conn.prepareStatement("SELECT name FROM pragma_index_info(?)")) {
                stmt.setString(1, index.name());
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        index.columns().add(rs.getString(1));
                    }
                }
            }
        }
        return indexes;
    }

    /**
     * Runs {@code PRAGMA integrity_check} and returns its report, {@code "ok"} for a sound store.
     */
    public static String integrityCheck(Connection conn) throws SQLException {
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("PRAGMA integrity_check")) {
            List<String> lines = new ArrayList<>();
            while (rs.next()) {
                lines.add(rs.getString(1));
            }
            return lines.isEmpty() ? "no result" : String.join("; ", lines);
        }
    }

    /**
     * Moves all write-ahead log content into the main store file and truncates the log.
     */
    public static void checkpoint(Connection conn) throws SQLException {
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("PRAGMA wal_checkpoint(TRUNCATE)")) {
            if (rs.next() && rs.getInt(1) != 0) {
                throw new SQLException("WAL checkpoint could not complete, store is busy");
            }
        }
    }

    /**
     * The write-ahead log and shared-memory files that accompany a store in WAL mode.
     */
    public static List<Path> companionFiles(Path store) {
        return List.of(
            store.resolveSibling(store.getFileName() + "-wal"),
            store.resolveSibling(store.getFileName() + "-shm")
        );
    }

    public static void deleteCompanionFiles(Path store) throws IOException {
        for (Path companion : companionFiles(store)) {
            if (Files.deleteIfExists(companion)) {
                log.debug("Deleted stale companion file: {}", companion);
            }
        }
    }

    /**
     * An index as declared in the store catalog.
     */
    public record IndexDefinition(String name, String sql, List<String> columns) {
    }
}
