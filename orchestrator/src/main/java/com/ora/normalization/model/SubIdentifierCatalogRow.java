package com.ora.normalization.model;

/**
 * Row of the lot (sub-identifier) catalog. {@code (skuId, lotNumber)} is unique.
 */
public record SubIdentifierCatalogRow(
        long lotId,
        String lotNumber,
        long skuId,
        LotStatus status,
        String receivedDate,
        Integer initialQty,
        int manualAdjustment
) {
}
