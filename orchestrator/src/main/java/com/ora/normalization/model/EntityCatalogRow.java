package com.ora.normalization.model;

/**
 * Row of the SKU (entity) catalog.
 */
public record EntityCatalogRow(
        long skuId,
        String skuCode,
        String productName,
        Integer reorderPoint,
        Integer palletCount
) {
}
