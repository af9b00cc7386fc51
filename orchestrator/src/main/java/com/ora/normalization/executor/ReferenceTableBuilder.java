package com.ora.normalization.executor;

import com.ora.normalization.config.MigrationProperties;
import com.ora.normalization.exception.SchemaException;
import com.ora.normalization.model.EntityCatalogRow;
import com.ora.normalization.model.LotStatus;
import com.ora.normalization.model.SubIdentifierCatalogRow;
import com.ora.normalization.orchestration.MigrationLog;
import com.ora.normalization.util.SqlValidator;
import com.ora.normalization.util.SqliteSupport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * Creates and populates the SKU and lot catalogs from the existing denormalized data.
 * Both builds are idempotent: an existing catalog is left untouched and only counted.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ReferenceTableBuilder {

    private final MigrationProperties properties;

    /**
     * Builds the SKU catalog from the current inventory table.
     *
     * @return row count of the catalog, existing or new
     * @throws SchemaException if population fails or yields an unexpected number of SKUs
     */
    public long buildEntityCatalog(Connection conn, MigrationLog auditLog) {
        MigrationProperties.SchemaConfig schema = properties.getSchema();
        String catalog = SqlValidator.validateTableName(schema.getEntityTable());
        String source = SqlValidator.validateTableName(schema.getEntitySourceTable());
        int expected = properties.getCatalog().getExpectedEntityCount();

        try {
            if (SqliteSupport.tableExists(conn, catalog)) {
                long count = SqliteSupport.countRows(conn, catalog);
                auditLog.info("  {} table already exists, skipping creation ({} rows)", catalog, count);
                return count;
            }
            requireSourceTable(conn, source);

            return inTransaction(conn, catalog, () -> {
                try (Statement stmt = conn.createStatement()) {
                    stmt.execute(String.format("""
                        CREATE TABLE %s (
                            sku_id INTEGER PRIMARY KEY AUTOINCREMENT,
                            sku_code TEXT UNIQUE NOT NULL,
                            product_name TEXT NOT NULL,
                            reorder_point INTEGER DEFAULT 50,
                            pallet_count INTEGER,
                            created_at TEXT DEFAULT CURRENT_TIMESTAMP
                        ) STRICT""", catalog));

                    stmt.execute(String.format("CREATE UNIQUE INDEX idx_%s_code ON %s(sku_code)", catalog, catalog));

                    stmt.execute(String.format("""
                        INSERT INTO %s (sku_code, product_name, reorder_point)
                        SELECT CAST(sku AS TEXT), product_name, reorder_point
                        FROM %s
                        ORDER BY sku""", catalog, source));
                }

                long count = SqliteSupport.countRows(conn, catalog);
                if (count != expected) {
                    // Tripwire against partial or duplicated source data; the catalog is not kept
                    throw new SchemaException(String.format(
                        "Expected %d SKUs in %s, found %d", expected, catalog, count));
                }
                auditLog.info("  Created {} table: {} rows", catalog, count);
                return count;
            });

        } catch (SQLException e) {
            throw new SchemaException("Failed to build " + catalog + " catalog: " + e.getMessage(), e);
        }
    }

    /**
     * Builds the lot catalog by joining lot inventory to the SKU catalog on the SKU code.
     *
     * @return row count of the catalog, existing or new
     * @throws SchemaException if the SKU catalog is missing or population fails
     */
    public long buildSubIdentifierCatalog(Connection conn, MigrationLog auditLog) {
        MigrationProperties.SchemaConfig schema = properties.getSchema();
        String catalog = SqlValidator.validateTableName(schema.getSubIdentifierTable());
        String entityCatalog = SqlValidator.validateTableName(schema.getEntityTable());
        String source = SqlValidator.validateTableName(schema.getSubIdentifierSourceTable());

        try {
            if (SqliteSupport.tableExists(conn, catalog)) {
                long count = SqliteSupport.countRows(conn, catalog);
                auditLog.info("  {} table already exists, skipping creation ({} rows)", catalog, count);
                return count;
            }
            if (!SqliteSupport.tableExists(conn, entityCatalog)) {
                throw new SchemaException(entityCatalog + " must be built before " + catalog);
            }
            requireSourceTable(conn, source);

            return inTransaction(conn, catalog, () -> {
                try (Statement stmt = conn.createStatement()) {
                    stmt.execute(String.format("""
                        CREATE TABLE %s (
                            lot_id INTEGER PRIMARY KEY AUTOINCREMENT,
                            lot_number TEXT NOT NULL,
                            sku_id INTEGER NOT NULL,
                            received_date TEXT,
                            initial_qty INTEGER,
                            manual_adjustment INTEGER DEFAULT 0,
                            status TEXT NOT NULL DEFAULT 'active' CHECK (status IN ('active', 'inactive')),
                            created_at TEXT DEFAULT CURRENT_TIMESTAMP,
                            FOREIGN KEY (sku_id) REFERENCES %s(sku_id) ON DELETE CASCADE,
                            UNIQUE(sku_id, lot_number)
                        ) STRICT""", catalog, entityCatalog));

                    stmt.execute(String.format("CREATE INDEX idx_%s_sku ON %s(sku_id)", catalog, catalog));
                    stmt.execute(String.format("CREATE INDEX idx_%s_status ON %s(status)", catalog, catalog));
                    stmt.execute(String.format("CREATE INDEX idx_%s_received_date ON %s(received_date)", catalog, catalog));

                    stmt.execute(String.format("""
                        INSERT INTO %s (lot_number, sku_id, received_date, initial_qty, manual_adjustment, status)
                        SELECT
                            CAST(li.lot AS TEXT),
                            s.sku_id,
                            li.received_date,
                            li.initial_qty,
                            COALESCE(li.manual_adjustment, 0),
                            COALESCE(li.status, 'active')
                        FROM %s li
                        JOIN %s s ON CAST(li.sku AS TEXT) = s.sku_code
                        ORDER BY li.received_date""", catalog, source, entityCatalog));
                }

                long count = SqliteSupport.countRows(conn, catalog);
                auditLog.info("  Created {} table: {} rows", catalog, count);
                return count;
            });

        } catch (SQLException e) {
            throw new SchemaException("Failed to build " + catalog + " catalog: " + e.getMessage(), e);
        }
    }

    /**
     * Reads the SKU catalog in id order.
     */
    public List<EntityCatalogRow> readEntityCatalog(Connection conn) throws SQLException {
        String catalog = SqlValidator.validateTableName(properties.getSchema().getEntityTable());
        List<EntityCatalogRow> rows = new ArrayList<>();
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT sku_id, sku_code, product_name, reorder_point, pallet_count FROM "
                 + catalog + " ORDER BY sku_id")) {
            while (rs.next()) {
                rows.add(new EntityCatalogRow(
                    rs.getLong("sku_id"),
                    rs.getString("sku_code"),
                    rs.getString("product_name"),
                    nullableInt(rs, "reorder_point"),
                    nullableInt(rs, "pallet_count")));
            }
        }
        return rows;
    }

    /**
     * Reads the lot catalog in id order.
     */
    public List<SubIdentifierCatalogRow> readSubIdentifierCatalog(Connection conn) throws SQLException {
        String catalog = SqlValidator.validateTableName(properties.getSchema().getSubIdentifierTable());
        List<SubIdentifierCatalogRow> rows = new ArrayList<>();
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT lot_id, lot_number, sku_id, status, received_date, initial_qty, "
                 + "manual_adjustment FROM " + catalog + " ORDER BY lot_id")) {
            while (rs.next()) {
                rows.add(new SubIdentifierCatalogRow(
                    rs.getLong("lot_id"),
                    rs.getString("lot_number"),
                    rs.getLong("sku_id"),
                    LotStatus.fromColumnValue(rs.getString("status")),
                    rs.getString("received_date"),
                    nullableInt(rs, "initial_qty"),
                    rs.getInt("manual_adjustment")));
            }
        }
        return rows;
    }

    private static Integer nullableInt(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }

    private void requireSourceTable(Connection conn, String source) throws SQLException {
        if (!SqliteSupport.tableExists(conn, source)) {
            throw new SchemaException("Source table not found: " + source);
        }
    }

    /**
     * Runs one catalog build in its own transaction; any failure leaves no partial catalog behind.
     */
    private long inTransaction(Connection conn, String catalog, CatalogBuild build) throws SQLException {
        boolean autoCommit = conn.getAutoCommit();
        conn.setAutoCommit(false);
        try {
            long count = build.run();
            conn.commit();
            return count;
        } catch (SQLException | RuntimeException e) {
            log.warn("Rolling back partial build of {}: {}", catalog, e.getMessage());
            conn.rollback();
            throw e;
        } finally {
            conn.setAutoCommit(autoCommit);
        }
    }

    @FunctionalInterface
    private interface CatalogBuild {
        long run() throws SQLException;
    }
}
