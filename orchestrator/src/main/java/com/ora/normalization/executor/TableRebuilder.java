package com.ora.normalization.executor;

import com.ora.normalization.config.MigrationProperties;
import com.ora.normalization.exception.DataMigrationException;
import com.ora.normalization.model.NormalizedFactRow;
import com.ora.normalization.model.RebuildReport;
import com.ora.normalization.model.RowValidationFailure;
import com.ora.normalization.model.UnnormalizedFactRow;
import com.ora.normalization.orchestration.MigrationLog;
import com.ora.normalization.parser.ParseResult;
import com.ora.normalization.parser.RecordParser;
import com.ora.normalization.util.SqlValidator;
import com.ora.normalization.util.SqliteSupport;
import com.ora.normalization.util.SqliteSupport.IndexDefinition;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Rebuilds the fact table into its normalized form through a shadow table.
 *
 * <p>Runs on a connection whose transaction is already open and never commits it: create the
 * shadow table with foreign keys, transform and copy every row, drop the original, rename the
 * shadow into place and rebuild the indexes. Readers see either the old table or the new one.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TableRebuilder {

    private static final Set<String> SOURCE_COLUMNS = Set.of(
        "id", "ship_date", "base_sku", "sku_lot", "quantity_shipped", "order_number", "created_at");

    private final MigrationProperties properties;
    private final RecordParser recordParser;

    /**
     * Transform the fact table inside the caller's transaction.
     *
     * @throws DataMigrationException if any statement fails; the caller must roll back
     */
    public RebuildReport rebuild(Connection conn, MigrationLog auditLog) {
        MigrationProperties.SchemaConfig schema = properties.getSchema();
        String fact = SqlValidator.validateTableName(schema.getFactTable());
        String shadow = SqlValidator.validateTableName(schema.getShadowTable());

        try {
            if (conn.getAutoCommit()) {
                throw new DataMigrationException("Rebuild requires an open transaction");
            }
            verifySourceTable(conn, fact);
            List<IndexDefinition> originalIndexes = SqliteSupport.explicitIndexes(conn, fact);

            auditLog.info("  Creating shadow table {} with foreign keys...", shadow);
            createShadowTable(conn, shadow);

            CatalogLookup lookup = CatalogLookup.load(conn, schema);
            RowCounts counts = copyRows(conn, fact, shadow, lookup, auditLog);

            auditLog.info("  Inserted {} records", counts.migrated);
            if (!counts.failures.isEmpty()) {
                auditLog.warn("  Skipped {} invalid records", counts.failures.size());
            }
            if (counts.lotsCreated > 0) {
                auditLog.info("  Created {} missing lots", counts.lotsCreated);
            }

            try (Statement stmt = conn.createStatement()) {
                stmt.execute("DROP TABLE " + fact);
                stmt.execute("ALTER TABLE " + shadow + " RENAME TO " + fact);
            }

            auditLog.info("  Creating indexes...");
            List<String> indexes = createIndexes(conn, fact, originalIndexes, auditLog);

            long newCount = SqliteSupport.countRows(conn, fact);
            auditLog.info("  Table rebuilt: {} rows (not yet committed)", newCount);

            return new RebuildReport(counts.sourceRows, counts.migrated, counts.lotsCreated, counts.failures, indexes);

        } catch (SQLException e) {
            throw new DataMigrationException("Table rebuild failed: " + e.getMessage(), e);
        }
    }

    /**
     * Whether the fact table already carries the normalized foreign key columns.
     */
    public boolean isNormalized(Connection conn) throws SQLException {
        String fact = SqlValidator.validateTableName(properties.getSchema().getFactTable());
        return SqliteSupport.tableExists(conn, fact) && SqliteSupport.columnNames(conn, fact).contains("sku_id");
    }

    private void verifySourceTable(Connection conn, String fact) throws SQLException {
        if (!SqliteSupport.tableExists(conn, fact)) {
            throw new DataMigrationException("Fact table not found: " + fact);
        }
        Set<String> columns = SqliteSupport.columnNames(conn, fact);
        if (!columns.containsAll(SOURCE_COLUMNS)) {
            if (isNormalized(conn)) {
                throw new DataMigrationException(fact + " is already normalized");
            }
            Set<String> missing = new HashSet<>(SOURCE_COLUMNS);
            missing.removeAll(columns);
            throw new DataMigrationException(fact + " is missing columns: " + missing);
        }
    }

    private void createShadowTable(Connection conn, String shadow) throws SQLException {
        MigrationProperties.SchemaConfig schema = properties.getSchema();
        String orderForeignKey = "";
        if (schema.isOrderForeignKey()) {
            orderForeignKey = String.format(",%n    FOREIGN KEY (order_number) REFERENCES %s(order_number)",
                SqlValidator.validateTableName(schema.getOrderTable()));
        }

        String ddl = String.format("""
            CREATE TABLE %s (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                ship_date TEXT NOT NULL,
                shipstation_sku_raw TEXT NOT NULL,
                sku_id INTEGER NOT NULL,
                lot_id INTEGER,
                quantity_shipped INTEGER NOT NULL CHECK (quantity_shipped > 0),
                order_number TEXT,
                created_at TEXT DEFAULT CURRENT_TIMESTAMP,
                FOREIGN KEY (sku_id) REFERENCES %s(sku_id),
                FOREIGN KEY (lot_id) REFERENCES %s(lot_id)%s
            ) STRICT""",
            shadow,
            SqlValidator.validateTableName(schema.getEntityTable()),
            SqlValidator.validateTableName(schema.getSubIdentifierTable()),
            orderForeignKey);

        try (Statement stmt = conn.createStatement()) {
            stmt.execute(ddl);
        }
    }

    private RowCounts copyRows(
            Connection conn, String fact, String shadow, CatalogLookup lookup, MigrationLog auditLog)
            throws SQLException {

        int batchSize = properties.getRebuild().getBatchSize();
        String lots = properties.getSchema().getSubIdentifierTable();
        RowCounts counts = new RowCounts();
        Set<String> seenKeys = new HashSet<>();
        List<NormalizedFactRow> pending = new ArrayList<>(batchSize);

        String select = "SELECT id, ship_date, base_sku, sku_lot, quantity_shipped, order_number, created_at "
            + "FROM " + fact + " ORDER BY id";
        String insert = "INSERT INTO " + shadow
            + " (id, ship_date, shipstation_sku_raw, sku_id, lot_id, quantity_shipped, order_number, created_at)"
            + " VALUES (?, ?, ?, ?, ?, ?, ?, COALESCE(?, CURRENT_TIMESTAMP))";
        String insertLot = "INSERT INTO " + lots + " (lot_number, sku_id, status) VALUES (?, ?, 'active')";

        try (Statement selectStmt = conn.createStatement();
             ResultSet rs = selectStmt.executeQuery(select);
             PreparedStatement insertStmt = conn.prepareStatement(insert);
             PreparedStatement insertLotStmt = conn.prepareStatement(insertLot, Statement.RETURN_GENERATED_KEYS)) {

            while (rs.next()) {
                UnnormalizedFactRow row = readRow(rs);
                counts.sourceRows++;

                ParseResult parsed = recordParser.parse(row.compoundIdentifier());
                String rejection = rejectionReason(row, parsed, lookup, seenKeys);

                if (rejection != null) {
                    auditLog.warn("    Skipped row {} ('{}'): {}", row.id(), row.compoundIdentifier(), rejection);
                    counts.failures.add(new RowValidationFailure(row.id(), row.compoundIdentifier(), rejection));
                    continue;
                }

                ParseResult.Valid valid = (ParseResult.Valid) parsed;
                long skuId = lookup.skuId(valid.baseCode());
                Long lotId = null;
                if (valid.subCode() != null) {
                    lotId = lookup.lotId(skuId, valid.subCode());
                    if (lotId == null) {
                        lotId = createLot(insertLotStmt, skuId, valid.subCode());
                        lookup.addLot(skuId, valid.subCode(), lotId);
                        counts.lotsCreated++;
                        auditLog.info("    Created lot {} for SKU {} (lot_id={})",
                            valid.subCode(), valid.baseCode(), lotId);
                    }
                }

                pending.add(new NormalizedFactRow(row.id(), valid.raw(), skuId, lotId, row.quantity(),
                    row.orderNumber(), row.shipDate(), row.createdAt()));
                if (pending.size() >= batchSize) {
                    counts.migrated += flush(insertStmt, pending);
                }
            }
            counts.migrated += flush(insertStmt, pending);
        }

        auditLog.info("  Processed {} records", counts.sourceRows);
        return counts;
    }

    /**
     * Why a row cannot be migrated, or {@code null} when it can. Rows with a null order
     * number are never treated as duplicates of each other.
     */
    private String rejectionReason(
            UnnormalizedFactRow row, ParseResult parsed, CatalogLookup lookup, Set<String> seenKeys) {
        if (row.quantity() == null || row.quantity() <= 0) {
            return "Non-positive quantity: " + row.quantity();
        }
        if (StringUtils.isBlank(row.shipDate())) {
            return "Missing ship date";
        }
        if (parsed instanceof ParseResult.Invalid invalid) {
            return invalid.error();
        }
        ParseResult.Valid valid = (ParseResult.Valid) parsed;
        if (lookup.skuId(valid.baseCode()) == null) {
            return "SKU not found: " + valid.baseCode();
        }
        if (row.orderNumber() != null) {
            if (!lookup.orderExists(row.orderNumber())) {
                return "Order not found: " + row.orderNumber();
            }
            if (!seenKeys.add(row.orderNumber() + '\u0000' + valid.raw())) {
                return "Duplicate order line: " + row.orderNumber() + " / " + valid.raw();
            }
        }
        return null;
    }

    private UnnormalizedFactRow readRow(ResultSet rs) throws SQLException {
        long quantity = rs.getLong("quantity_shipped");
        boolean quantityMissing = rs.wasNull();
        return new UnnormalizedFactRow(
            rs.getLong("id"),
            StringUtils.trimToNull(rs.getString("ship_date")),
            rs.getString("base_sku"),
            rs.getString("sku_lot"),
            quantityMissing ? null : quantity,
            StringUtils.trimToNull(rs.getString("order_number")),
            rs.getString("created_at")
        );
    }

    private long createLot(PreparedStatement insertLotStmt, long skuId, String lotNumber) throws SQLException {
        insertLotStmt.setString(1, lotNumber);
        insertLotStmt.setLong(2, skuId);
        insertLotStmt.executeUpdate();
        try (ResultSet keys = insertLotStmt.getGeneratedKeys()) {
            if (keys.next()) {
                return keys.getLong(1);
            }
        }
        throw new SQLException("No lot_id returned for new lot " + lotNumber);
    }

    private int flush(PreparedStatement insertStmt, List<NormalizedFactRow> pending) throws SQLException {
        if (pending.isEmpty()) {
            return 0;
        }
        for (NormalizedFactRow row : pending) {
            insertStmt.setLong(1, row.id());
            insertStmt.setString(2, row.shipDate());
            insertStmt.setString(3, row.rawIdentifier());
            insertStmt.setLong(4, row.skuId());
            if (row.lotId() != null) {
                insertStmt.setLong(5, row.lotId());
            } else {
                insertStmt.setNull(5, Types.INTEGER);
            }
            insertStmt.setLong(6, row.quantity());
            insertStmt.setString(7, row.orderNumber());
            insertStmt.setString(8, row.createdAt());
            insertStmt.addBatch();
        }
        insertStmt.executeBatch();
        int inserted = pending.size();
        log.debug("Flushed {} rows to shadow table", inserted);
        pending.clear();
        return inserted;
    }

    private List<String> createIndexes(
            Connection conn, String fact, List<IndexDefinition> originalIndexes, MigrationLog auditLog)
            throws SQLException {

        Map<String, String> standard = new LinkedHashMap<>();
        standard.put("idx_" + fact + "_date", "CREATE INDEX %s ON " + fact + "(ship_date)");
        standard.put("idx_" + fact + "_sku", "CREATE INDEX %s ON " + fact + "(sku_id, ship_date)");
        standard.put("idx_" + fact + "_lot", "CREATE INDEX %s ON " + fact + "(lot_id)");
        standard.put("idx_" + fact + "_order", "CREATE INDEX %s ON " + fact + "(order_number)");
        standard.put("uniq_" + fact + "_key", "CREATE UNIQUE INDEX %s ON " + fact + "(order_number, shipstation_sku_raw)");

        List<String> created = new ArrayList<>();
        try (Statement stmt = conn.createStatement()) {
            for (Map.Entry<String, String> index : standard.entrySet()) {
                stmt.execute(String.format(index.getValue(), index.getKey()));
                created.add(index.getKey());
            }

            Set<String> columns = SqliteSupport.columnNames(conn, fact);
            for (IndexDefinition original : originalIndexes) {
                if (standard.containsKey(original.name())) {
                    continue;
                }
                if (columns.containsAll(original.columns())) {
                    stmt.execute(original.sql());
                    created.add(original.name());
                    auditLog.info("  Recreated index {}", original.name());
                } else {
                    auditLog.warn("  Index {} not recreated: columns {} no longer exist",
                        original.name(), original.columns());
                }
            }
        }
        return created;
    }

    private static final class RowCounts {
        long sourceRows;
        long migrated;
        long lotsCreated;
        final List<RowValidationFailure> failures = new ArrayList<>();
    }

    /**
     * In-memory view of the catalogs for the duration of one rebuild.
     */
    private static final class CatalogLookup {

        private final Map<String, Long> skuIds = new HashMap<>();
        private final Map<String, Long> lotIds = new HashMap<>();
        private final Set<String> orderNumbers = new HashSet<>();
        private final boolean checkOrders;

        private CatalogLookup(boolean checkOrders) {
            this.checkOrders = checkOrders;
        }

        static CatalogLookup load(Connection conn, MigrationProperties.SchemaConfig schema) throws SQLException {
            String skus = SqlValidator.validateTableName(schema.getEntityTable());
            String lots = SqlValidator.validateTableName(schema.getSubIdentifierTable());
            for (String catalog : List.of(skus, lots)) {
                if (!SqliteSupport.tableExists(conn, catalog)) {
                    throw new DataMigrationException("Catalog " + catalog + " not found, run Prework first");
                }
            }

            CatalogLookup lookup = new CatalogLookup(schema.isOrderForeignKey());
            try (Statement stmt = conn.createStatement()) {
                try (ResultSet rs = stmt.executeQuery("SELECT sku_id, sku_code FROM " + skus)) {
                    while (rs.next()) {
                        lookup.skuIds.put(rs.getString("sku_code"), rs.getLong("sku_id"));
                    }
                }
                try (ResultSet rs = stmt.executeQuery("SELECT lot_id, sku_id, lot_number FROM " + lots)) {
                    while (rs.next()) {
                        lookup.addLot(rs.getLong("sku_id"), rs.getString("lot_number"), rs.getLong("lot_id"));
                    }
                }
                if (lookup.checkOrders) {
                    String orders = SqlValidator.validateTableName(schema.getOrderTable());
                    if (!SqliteSupport.tableExists(conn, orders)) {
                        throw new DataMigrationException("Order table not found: " + orders);
                    }
                    try (ResultSet rs = stmt.executeQuery("SELECT order_number FROM " + orders)) {
                        while (rs.next()) {
                            lookup.orderNumbers.add(rs.getString(1));
                        }
                    }
                }
            }
            log.debug("Loaded {} SKUs, {} lots, {} orders", lookup.skuIds.size(), lookup.lotIds.size(),
                lookup.orderNumbers.size());
            return lookup;
        }

        Long skuId(String skuCode) {
            return skuIds.get(skuCode);
        }

        Long lotId(long skuId, String lotNumber) {
            return lotIds.get(skuId + ":" + lotNumber);
        }

        void addLot(long skuId, String lotNumber, long lotId) {
            lotIds.put(skuId + ":" + lotNumber, lotId);
        }

        boolean orderExists(String orderNumber) {
            return !checkOrders || orderNumbers.contains(orderNumber);
        }
    }
}
