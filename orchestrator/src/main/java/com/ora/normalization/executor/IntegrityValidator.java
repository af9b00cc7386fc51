package com.ora.normalization.executor;

import com.ora.normalization.config.MigrationProperties;
import com.ora.normalization.model.IntegrityCheckResult;
import com.ora.normalization.model.ValidationReport;
import com.ora.normalization.orchestration.MigrationLog;
import com.ora.normalization.util.SqlValidator;
import com.ora.normalization.util.SqliteSupport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Savepoint;
import java.sql.Statement;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs the fixed battery of post-rebuild checks against the still-open rebuild transaction.
 *
 * <p>Trial writes are wrapped in savepoints and undone, so the battery leaves the
 * transaction exactly as it found it.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class IntegrityValidator {

    private static final DateTimeFormatter SQLITE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final String CHECK_IDENTIFIER = "__INTEGRITY_CHECK__";

    private final MigrationProperties properties;
    private final Clock clock;

    public ValidationReport validate(Connection conn, MigrationLog auditLog) {
        String fact = SqlValidator.validateTableName(properties.getSchema().getFactTable());
        String skus = SqlValidator.validateTableName(properties.getSchema().getEntityTable());
        String lots = SqlValidator.validateTableName(properties.getSchema().getSubIdentifierTable());

        auditLog.info("  Running 6 core validation tests:");
        List<IntegrityCheckResult> checks = new ArrayList<>();
        checks.add(run(1, "Foreign keys enforced", () -> checkForeignKeysEnforced(conn, fact, skus)));
        checks.add(run(2, "No orphaned records", () -> checkNoOrphans(conn, fact, skus, lots)));
        checks.add(run(3, "Unique constraint enforced", () -> checkUniqueEnforced(conn, fact, skus)));
        checks.add(run(4, "Current-period data present", () -> checkRecentActivity(conn, fact)));
        checks.add(run(5, "No suspicious historical dates", () -> checkSuspiciousDates(conn, fact)));
        checks.add(run(6, "Store integrity", () -> checkStoreIntegrity(conn)));

        for (IntegrityCheckResult check : checks) {
            if (check.isHardFailure()) {
                auditLog.error("    Test {} FAILED: {} - {}", check.number(), check.name(), check.detail());
            } else if (check.advisory()) {
                auditLog.warn("    Test {} WARNING: {} - {}", check.number(), check.name(), check.detail());
            } else {
                auditLog.info("    Test {} PASSED: {} - {}", check.number(), check.name(), check.detail());
            }
        }

        ValidationReport report = new ValidationReport(checks, properties.getValidation().getMinPassingChecks());
        auditLog.info("  Validation Summary: {}/{} tests passed (minimum {})",
            report.passedCount(), checks.size(), report.minPassingChecks());
        return report;
    }

    private IntegrityCheckResult run(int number, String name, Check check) {
        try {
            return check.run();
        } catch (SQLException e) {
            log.error("Check {} ({}) could not run: {}", number, name, e.getMessage());
            return IntegrityCheckResult.failed(number, name, "check could not run: " + e.getMessage());
        }
    }

    /**
     * Inserting a reference to a SKU that cannot exist must be rejected.
     */
    private IntegrityCheckResult checkForeignKeysEnforced(Connection conn, String fact, String skus)
            throws SQLException {
        long missingSkuId = maxId(conn, skus, "sku_id") + 1000;
        String sql = "INSERT INTO " + fact
            + " (sku_id, quantity_shipped, ship_date, shipstation_sku_raw) VALUES (?, 5, ?, ?)";
        String rejection = trialWrite(conn, List.of(sql), ps -> {
            ps.setLong(1, missingSkuId);
            ps.setString(2, LocalDate.now(clock).toString());
            ps.setString(3, CHECK_IDENTIFIER);
        });
        if (rejection != null && StringUtils.containsIgnoreCase(rejection, "FOREIGN KEY")) {
            return IntegrityCheckResult.passed(1, "Foreign keys enforced", "out-of-range sku_id rejected");
        }
        return IntegrityCheckResult.failed(1, "Foreign keys enforced",
            rejection == null ? "out-of-range sku_id was accepted" : "unexpected error: " + rejection);
    }

    private IntegrityCheckResult checkNoOrphans(Connection conn, String fact, String skus, String lots)
            throws SQLException {
        long orphans = count(conn, "SELECT COUNT(*) FROM " + fact
            + " WHERE sku_id NOT IN (SELECT sku_id FROM " + skus + ")");
        long foreignLots = count(conn, "SELECT COUNT(*) FROM " + fact + " f"
            + " WHERE f.lot_id IS NOT NULL AND NOT EXISTS ("
            + "SELECT 1 FROM " + lots + " l WHERE l.lot_id = f.lot_id AND l.sku_id = f.sku_id)");
        if (orphans == 0 && foreignLots == 0) {
            return IntegrityCheckResult.passed(2, "No orphaned records", "every sku_id and lot_id resolves");
        }
        return IntegrityCheckResult.failed(2, "No orphaned records",
            String.format("%d rows with unknown sku_id, %d rows with a lot of another SKU", orphans, foreignLots));
    }

    /**
     * Inserting the same {@code (order_number, shipstation_sku_raw)} pair twice must be rejected.
     */
    private IntegrityCheckResult checkUniqueEnforced(Connection conn, String fact, String skus)
            throws SQLException {
        Long skuId = firstId(conn, skus, "sku_id");
        if (skuId == null) {
            return IntegrityCheckResult.failed(3, "Unique constraint enforced", "no SKU available to test with");
        }
        String sql = "INSERT INTO " + fact
            + " (order_number, shipstation_sku_raw, sku_id, quantity_shipped, ship_date) VALUES (?, ?, ?, 5, ?)";
        TrialBinder binder = ps -> {
            ps.setString(1, CHECK_IDENTIFIER);
            ps.setString(2, CHECK_IDENTIFIER);
            ps.setLong(3, skuId);
            ps.setString(4, LocalDate.now(clock).toString());
        };
        String rejection = withDeferredForeignKeys(conn, () -> trialWrite(conn, List.of(sql, sql), binder));
        if (rejection != null && StringUtils.containsIgnoreCase(rejection, "UNIQUE")) {
            return IntegrityCheckResult.passed(3, "Unique constraint enforced", "duplicate order line rejected");
        }
        return IntegrityCheckResult.failed(3, "Unique constraint enforced",
            rejection == null ? "duplicate order line was accepted" : "unexpected error: " + rejection);
    }

    private IntegrityCheckResult checkRecentActivity(Connection conn, String fact) throws SQLException {
        String today = LocalDate.now(clock).toString();
        long units;
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT COALESCE(SUM(quantity_shipped), 0) FROM " + fact + " WHERE ship_date = ?")) {
            ps.setString(1, today);
            try (ResultSet rs = ps.executeQuery()) {
                units = rs.next() ? rs.getLong(1) : 0;
            }
        }
        if (units > 0) {
            return IntegrityCheckResult.passed(4, "Current-period data present", units + " units shipped today");
        }
        return IntegrityCheckResult.advisory(4, "Current-period data present", "no shipments for " + today);
    }

    private IntegrityCheckResult checkSuspiciousDates(Connection conn, String fact) throws SQLException {
        String cutoff = properties.getValidation().getSuspiciousBefore().toString();
        // created_at holds UTC timestamps written by CURRENT_TIMESTAMP
        String since = SQLITE_TIMESTAMP.format(LocalDateTime.ofInstant(clock.instant(), ZoneOffset.UTC).minusDays(1));
        long suspicious;
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT COUNT(*) FROM " + fact + " WHERE ship_date < ? AND created_at > ?")) {
            ps.setString(1, cutoff);
            ps.setString(2, since);
            try (ResultSet rs = ps.executeQuery()) {
                suspicious = rs.next() ? rs.getLong(1) : 0;
            }
        }
        if (suspicious == 0) {
            return IntegrityCheckResult.passed(5, "No suspicious historical dates", "none before " + cutoff);
        }
        return IntegrityCheckResult.advisory(5, "No suspicious historical dates",
            suspicious + " recently created rows ship before " + cutoff);
    }

    private IntegrityCheckResult checkStoreIntegrity(Connection conn) throws SQLException {
        String result = SqliteSupport.integrityCheck(conn);
        if (SqliteSupport.INTEGRITY_OK.equals(result)) {
            return IntegrityCheckResult.passed(6, "Store integrity", "integrity_check ok");
        }
        return IntegrityCheckResult.failed(6, "Store integrity", result);
    }

    /**
     * Executes the statements inside a savepoint that is always rolled back.
     *
     * @return the error message of the first rejected statement, or {@code null} if all were accepted
     */
    private String trialWrite(Connection conn, List<String> statements, TrialBinder binder) throws SQLException {
        Savepoint savepoint = conn.setSavepoint("integrity_check");
        try {
            for (String sql : statements) {
                try (PreparedStatement ps = conn.prepareStatement(sql)) {
                    binder.bind(ps);
                    ps.executeUpdate();
                } catch (SQLException e) {
                    return e.getMessage();
                }
            }
            return null;
        } finally {
            conn.rollback(savepoint);
            conn.releaseSavepoint(savepoint);
        }
    }

    /**
     * Runs a trial write with foreign keys checked only at commit, so its order number needs no
     * matching order row. Rolling back its savepoint also discards the pending violations.
     */
    private String withDeferredForeignKeys(Connection conn, TrialWrite trial) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            stmt.execute("PRAGMA defer_foreign_keys = ON");
            try {
                return trial.run();
            } finally {
                stmt.execute("PRAGMA defer_foreign_keys = OFF");
            }
        }
    }

    private long maxId(Connection conn, String table, String column) throws SQLException {
        return count(conn, "SELECT COALESCE(MAX(" + column + "), 0) FROM " + table);
    }

    private Long firstId(Connection conn, String table, String column) throws SQLException {
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT " + column + " FROM " + table + " ORDER BY " + column + " LIMIT 1")) {
            return rs.next() ? rs.getLong(1) : null;
        }
    }

    private long count(Connection conn, String sql) throws SQLException {
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(sql)) {
            return rs.next() ? rs.getLong(1) : 0;
        }
    }

    @FunctionalInterface
    private interface Check {
        IntegrityCheckResult run() throws SQLException;
    }

    @FunctionalInterface
    private interface TrialWrite {
        String run() throws SQLException;
    }

    @FunctionalInterface
    private interface TrialBinder {
        void bind(PreparedStatement ps) throws SQLException;
    }
}
