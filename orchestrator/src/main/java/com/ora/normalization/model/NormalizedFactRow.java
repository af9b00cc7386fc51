package com.ora.normalization.model;

/**
 * One row of the fact table after normalization.
 *
 * @param id            source row id, kept across the rebuild
 * @param rawIdentifier audit copy of the identifier the row was parsed from
 * @param skuId         entity catalog reference
 * @param lotId         sub-identifier catalog reference, {@code null} when the identifier had no lot
 * @param orderNumber   order reference, {@code null} for internal or manual entries
 */
public record NormalizedFactRow(
        long id,
        String rawIdentifier,
        long skuId,
        Long lotId,
        long quantity,
        String orderNumber,
        String shipDate,
        String createdAt
) {
}
