package com.ora.normalization.model;

import org.apache.commons.lang3.StringUtils;

/**
 * One row of the fact table before normalization.
 * The SKU and lot are encoded together in {@code skuLot}, or only the SKU in {@code baseSku}.
 */
public record UnnormalizedFactRow(
        long id,
        String shipDate,
        String baseSku,
        String skuLot,
        Long quantity,
        String orderNumber,
        String createdAt
) {

    /**
     * The free-text identifier to parse: the SKU-lot value when present, otherwise the base SKU.
     */
    public String compoundIdentifier() {
        return StringUtils.isNotBlank(skuLot) ? skuLot : baseSku;
    }
}
