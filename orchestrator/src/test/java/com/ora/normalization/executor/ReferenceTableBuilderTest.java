package com.ora.normalization.executor;

import com.ora.normalization.config.MigrationProperties;
import com.ora.normalization.exception.SchemaException;
import com.ora.normalization.model.EntityCatalogRow;
import com.ora.normalization.model.LotStatus;
import com.ora.normalization.model.SubIdentifierCatalogRow;
import com.ora.normalization.orchestration.MigrationLog;
import com.ora.normalization.support.TestStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.Connection;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReferenceTableBuilderTest {

    @TempDir
    Path tempDir;

    private Path store;
    private MigrationProperties properties;
    private ReferenceTableBuilder builder;
    private MigrationLog auditLog;

    @BeforeEach
    void setUp() throws Exception {
        store = TestStore.create(tempDir, "catalogs.db");
        properties = TestStore.properties();
        builder = new ReferenceTableBuilder(properties);
        auditLog = TestStore.log();
    }

    // ========== SKU Catalog ==========

    @Test
    @DisplayName("Should create the SKU catalog from current inventory")
    void testBuildEntityCatalog() throws Exception {
        try (Connection conn = TestStore.open(store)) {
            assertEquals(TestStore.SKU_COUNT, builder.buildEntityCatalog(conn, auditLog));
        }

        assertEquals(TestStore.SKU_COUNT, TestStore.countRows(store, "skus"));
        assertEquals(1, TestStore.count(store, "SELECT COUNT(*) FROM skus WHERE sku_code = '17612'"));
        assertEquals(1, TestStore.count(store,
            "SELECT COUNT(*) FROM sqlite_master WHERE type = 'index' AND name = 'idx_skus_code'"));
    }

    @Test
    @DisplayName("Should leave an existing SKU catalog untouched")
    void testEntityCatalogIdempotent() throws Exception {
        try (Connection conn = TestStore.open(store)) {
            builder.buildEntityCatalog(conn, auditLog);
        }
        TestStore.execute(store, "INSERT INTO inventory_current (sku, product_name) VALUES (19000, 'New')");

        try (Connection conn = TestStore.open(store)) {
            assertEquals(TestStore.SKU_COUNT, builder.buildEntityCatalog(conn, auditLog));
        }
        assertEquals(TestStore.SKU_COUNT, TestStore.countRows(store, "skus"));
    }

    @Test
    @DisplayName("Should fail and keep no catalog when the SKU count is unexpected")
    void testEntityCountTripwire() throws Exception {
        properties.getCatalog().setExpectedEntityCount(4);

        try (Connection conn = TestStore.open(store)) {
            SchemaException e = assertThrows(SchemaException.class, () -> builder.buildEntityCatalog(conn, auditLog));
            assertTrue(e.getMessage().contains("Expected 4 SKUs"));
            assertTrue(conn.getAutoCommit());
        }
        assertEquals(0, TestStore.count(store,
            "SELECT COUNT(*) FROM sqlite_master WHERE type = 'table' AND name = 'skus'"));
    }

    @Test
    @DisplayName("Should fail when the inventory source table is missing")
    void testMissingSource() throws Exception {
        TestStore.execute(store, "DROP TABLE inventory_current");

        try (Connection conn = TestStore.open(store)) {
            assertThrows(SchemaException.class, () -> builder.buildEntityCatalog(conn, auditLog));
        }
    }

    // ========== Lot Catalog ==========

    @Test
    @DisplayName("Should create the lot catalog joined to SKUs")
    void testBuildSubIdentifierCatalog() throws Exception {
        try (Connection conn = TestStore.open(store)) {
            builder.buildEntityCatalog(conn, auditLog);
            assertEquals(TestStore.LOT_COUNT, builder.buildSubIdentifierCatalog(conn, auditLog));
        }

        assertEquals(0, TestStore.count(store, """
            SELECT COUNT(*) FROM lots l
            LEFT JOIN skus s ON s.sku_id = l.sku_id
            WHERE s.sku_id IS NULL"""));
        assertEquals(1, TestStore.count(store, """
            SELECT COUNT(*) FROM lots l JOIN skus s ON s.sku_id = l.sku_id
            WHERE s.sku_code = '17904' AND l.lot_number = '250240'
              AND l.status = 'active' AND l.manual_adjustment = 0"""));
        assertEquals(1, TestStore.count(store, "SELECT COUNT(*) FROM lots WHERE status = 'inactive'"));
    }

    @Test
    @DisplayName("Should refuse to build lots before SKUs")
    void testLotsRequireSkus() throws Exception {
        try (Connection conn = TestStore.open(store)) {
            assertThrows(SchemaException.class, () -> builder.buildSubIdentifierCatalog(conn, auditLog));
        }
    }

    @Test
    @DisplayName("Should reject a duplicate lot for the same SKU")
    void testLotUniqueness() throws Exception {
        try (Connection conn = TestStore.open(store)) {
            builder.buildEntityCatalog(conn, auditLog);
            builder.buildSubIdentifierCatalog(conn, auditLog);
        }

        assertThrows(Exception.class, () -> TestStore.execute(store,
            "INSERT INTO lots (lot_number, sku_id) SELECT '250237', sku_id FROM skus WHERE sku_code = '17612'"));
    }

    @Test
    @DisplayName("Should return unchanged counts when run twice")
    void testCatalogsIdempotent() throws Exception {
        long skus;
        long lots;
        try (Connection conn = TestStore.open(store)) {
            skus = builder.buildEntityCatalog(conn, auditLog);
            lots = builder.buildSubIdentifierCatalog(conn, auditLog);
        }
        try (Connection conn = TestStore.open(store)) {
            assertEquals(skus, builder.buildEntityCatalog(conn, auditLog));
            assertEquals(lots, builder.buildSubIdentifierCatalog(conn, auditLog));
        }
        assertEquals(lots, TestStore.countRows(store, "lots"));
    }

    // ========== Reading Catalogs ==========

    @Test
    @DisplayName("Should read SKUs in id order with nullable columns")
    void testReadEntityCatalog() throws Exception {
        try (Connection conn = TestStore.open(store)) {
            builder.buildEntityCatalog(conn, auditLog);

            List<EntityCatalogRow> skus = builder.readEntityCatalog(conn);

            assertEquals(TestStore.SKU_COUNT, skus.size());
            assertEquals("17612", skus.get(0).skuCode());
            assertEquals("Olive Oil 1L", skus.get(0).productName());
            assertEquals(40, skus.get(0).reorderPoint());
            assertNull(skus.get(0).palletCount());
        }
    }

    @Test
    @DisplayName("Should read lots with their status")
    void testReadSubIdentifierCatalog() throws Exception {
        try (Connection conn = TestStore.open(store)) {
            builder.buildEntityCatalog(conn, auditLog);
            builder.buildSubIdentifierCatalog(conn, auditLog);

            List<SubIdentifierCatalogRow> lots = builder.readSubIdentifierCatalog(conn);

            assertEquals(TestStore.LOT_COUNT, lots.size());
            assertEquals(1, lots.stream().filter(lot -> lot.status() == LotStatus.INACTIVE).count());
            SubIdentifierCatalogRow inactive = lots.stream()
                .filter(lot -> lot.lotNumber().equals("250100"))
                .findFirst()
                .orElseThrow();
            assertEquals(LotStatus.INACTIVE, inactive.status());
            assertEquals(-5, inactive.manualAdjustment());
            assertEquals(300, inactive.initialQty());
        }
    }
}
