package com.ora.normalization.executor;

import com.ora.normalization.config.MigrationProperties;
import com.ora.normalization.model.IntegrityCheckResult;
import com.ora.normalization.model.ValidationReport;
import com.ora.normalization.orchestration.MigrationLog;
import com.ora.normalization.parser.SkuLotParser;
import com.ora.normalization.support.TestStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.Statement;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class IntegrityValidatorTest {

    @TempDir
    Path tempDir;

    private Path store;
    private MigrationProperties properties;
    private MigrationLog auditLog;
    private TableRebuilder rebuilder;

    @BeforeEach
    void setUp() throws Exception {
        store = TestStore.create(tempDir, "validate.db");
        properties = TestStore.properties();
        auditLog = TestStore.log();
        rebuilder = new TableRebuilder(properties, new SkuLotParser());

        ReferenceTableBuilder catalogs = new ReferenceTableBuilder(properties);
        try (Connection conn = TestStore.open(store)) {
            catalogs.buildEntityCatalog(conn, auditLog);
            catalogs.buildSubIdentifierCatalog(conn, auditLog);
        }
    }

    private IntegrityValidator validator(String instant) {
        return new IntegrityValidator(properties, Clock.fixed(Instant.parse(instant), ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Should pass all checks after a clean rebuild")
    void testCleanRebuildPasses() throws Exception {
        try (Connection conn = TestStore.open(store)) {
            conn.setAutoCommit(false);
            rebuilder.rebuild(conn, auditLog);

            ValidationReport report = validator("2025-10-20T12:00:00Z").validate(conn, auditLog);

            assertEquals(6, report.checks().size());
            assertEquals(6, report.passedCount());
            assertTrue(report.hardFailures().isEmpty());
            assertTrue(report.isCommitAllowed());
            conn.rollback();
        }
    }

    @Test
    @DisplayName("Should leave no trial rows behind")
    void testTrialWritesLeaveNoTrace() throws Exception {
        try (Connection conn = TestStore.open(store)) {
            conn.setAutoCommit(false);
            rebuilder.rebuild(conn, auditLog);
            long before = count(conn, "SELECT COUNT(*) FROM shipped_items");

            validator("2025-10-20T12:00:00Z").validate(conn, auditLog);

            assertEquals(before, count(conn, "SELECT COUNT(*) FROM shipped_items"));
            assertFalse(conn.getAutoCommit());
            conn.commit();
        }
        assertEquals(TestStore.MIGRATABLE_ROWS, TestStore.countRows(store, "shipped_items"));
    }

    @Test
    @DisplayName("Should enforce uniqueness and commit when no order exists yet")
    void testUniqueCheckWithEmptyOrderTable() throws Exception {
        TestStore.execute(store, "UPDATE shipped_items SET order_number = NULL");
        TestStore.execute(store, "DELETE FROM shipped_orders");

        try (Connection conn = TestStore.open(store)) {
            conn.setAutoCommit(false);
            rebuilder.rebuild(conn, auditLog);

            ValidationReport report = validator("2025-10-20T12:00:00Z").validate(conn, auditLog);

            IntegrityCheckResult unique = report.checks().get(2);
            assertTrue(unique.passed(), unique.detail());
            assertEquals("duplicate order line rejected", unique.detail());
            assertTrue(report.isCommitAllowed());
            assertDoesNotThrow(conn::commit);
        }
        assertEquals(0, TestStore.count(store,
            "SELECT COUNT(*) FROM shipped_items WHERE shipstation_sku_raw = '__INTEGRITY_CHECK__'"));
    }

    @Test
    @DisplayName("Should treat missing current-period data as advisory")
    void testRecentActivityAdvisory() throws Exception {
        try (Connection conn = TestStore.open(store)) {
            conn.setAutoCommit(false);
            rebuilder.rebuild(conn, auditLog);

            IntegrityCheckResult check = validator("2025-10-20T12:00:00Z").validate(conn, auditLog).checks().get(3);

            assertTrue(check.advisory());
            assertTrue(check.passed());
            conn.rollback();
        }
    }

    @Test
    @DisplayName("Should report shipments for today as passed")
    void testRecentActivityPresent() throws Exception {
        try (Connection conn = TestStore.open(store)) {
            conn.setAutoCommit(false);
            rebuilder.rebuild(conn, auditLog);

            IntegrityCheckResult check = validator("2025-10-03T12:00:00Z").validate(conn, auditLog).checks().get(3);

            assertFalse(check.advisory());
            assertTrue(check.passed());
            conn.rollback();
        }
    }

    @Test
    @DisplayName("Should flag recently created rows with old ship dates as advisory")
    void testSuspiciousDatesAdvisory() throws Exception {
        try (Connection conn = TestStore.open(store)) {
            conn.setAutoCommit(false);
            rebuilder.rebuild(conn, auditLog);
            try (Statement stmt = conn.createStatement()) {
                stmt.executeUpdate("UPDATE shipped_items SET ship_date = '2024-12-15', created_at = '2025-10-20 08:00:00' WHERE id = 1");
            }

            ValidationReport report = validator("2025-10-20T12:00:00Z").validate(conn, auditLog);

            assertTrue(report.checks().get(4).advisory());
            assertTrue(report.isCommitAllowed());
            conn.rollback();
        }
    }

    @Test
    @DisplayName("Should fail the foreign key check when enforcement is off")
    void testForeignKeysNotEnforced() throws Exception {
        try (Connection conn = TestStore.open(store)) {
            try (Statement stmt = conn.createStatement()) {
                stmt.execute("PRAGMA foreign_keys = OFF");
            }
            conn.setAutoCommit(false);
            rebuilder.rebuild(conn, auditLog);

            ValidationReport report = validator("2025-10-20T12:00:00Z").validate(conn, auditLog);

            assertFalse(report.checks().get(0).passed());
            assertTrue(report.checks().get(0).isHardFailure());
            assertFalse(report.isCommitAllowed());
            conn.rollback();
        }
    }

    @Test
    @DisplayName("Should detect orphaned rows")
    void testOrphans() throws Exception {
        try (Connection conn = TestStore.open(store)) {
            try (Statement stmt = conn.createStatement()) {
                stmt.execute("PRAGMA foreign_keys = OFF");
            }
            conn.setAutoCommit(false);
            rebuilder.rebuild(conn, auditLog);
            try (Statement stmt = conn.createStatement()) {
                stmt.executeUpdate("UPDATE shipped_items SET sku_id = 9999 WHERE id = 2");
            }

            IntegrityCheckResult check = validator("2025-10-20T12:00:00Z").validate(conn, auditLog).checks().get(1);

            assertFalse(check.passed());
            assertTrue(check.detail().startsWith("1 rows with unknown sku_id"));
            conn.rollback();
        }
    }

    @Test
    @DisplayName("Should fail the uniqueness check when the unique index is missing")
    void testUniquenessNotEnforced() throws Exception {
        try (Connection conn = TestStore.open(store)) {
            conn.setAutoCommit(false);
            rebuilder.rebuild(conn, auditLog);
            try (Statement stmt = conn.createStatement()) {
                stmt.execute("DROP INDEX uniq_shipped_items_key");
            }

            ValidationReport report = validator("2025-10-20T12:00:00Z").validate(conn, auditLog);

            assertFalse(report.checks().get(2).passed());
            assertFalse(report.isCommitAllowed());
            conn.rollback();
        }
    }

    @Test
    @DisplayName("Should apply the configured minimum of passing checks")
    void testConfigurableThreshold() throws Exception {
        properties.getValidation().setMinPassingChecks(7);

        try (Connection conn = TestStore.open(store)) {
            conn.setAutoCommit(false);
            rebuilder.rebuild(conn, auditLog);

            ValidationReport report = validator("2025-10-20T12:00:00Z").validate(conn, auditLog);

            assertTrue(report.hardFailures().isEmpty());
            assertFalse(report.isCommitAllowed());
            conn.rollback();
        }
    }

    private long count(Connection conn, String sql) throws Exception {
        try (Statement stmt = conn.createStatement(); var rs = stmt.executeQuery(sql)) {
            return rs.next() ? rs.getLong(1) : 0;
        }
    }
}
