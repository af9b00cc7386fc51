package com.ora.normalization.util;

import lombok.extern.slf4j.Slf4j;

/**
 * Utility class for SQL identifier validation.
 * Table names come from configuration and are spliced into DDL, so they must be plain identifiers.
 */
@Slf4j
public class SqlValidator {

    private SqlValidator() {
        // Utility class - prevent instantiation
    }

    /**
     * Allows letters, digits and underscores, not starting with a digit.
     */
    public static boolean isValidIdentifier(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            return false;
        }
        return identifier.matches("^[A-Za-z_][A-Za-z0-9_]*$");
    }

    /**
     * Throws exception if table name is invalid.
     */
    public static String validateTableName(String tableName) {
        if (!isValidIdentifier(tableName)) {
            throw new IllegalArgumentException("Invalid table name: " + tableName);
        }
        return tableName;
    }
}
