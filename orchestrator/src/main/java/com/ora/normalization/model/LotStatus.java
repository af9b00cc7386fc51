package com.ora.normalization.model;

import java.util.Locale;

/**
 * Lifecycle status of a lot in the sub-identifier catalog.
 */
public enum LotStatus {
    ACTIVE,
    INACTIVE;

    public static LotStatus fromColumnValue(String value) {
        if (value == null) {
            return ACTIVE;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
