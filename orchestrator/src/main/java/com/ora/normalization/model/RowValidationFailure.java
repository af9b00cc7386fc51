package com.ora.normalization.model;

/**
 * A source row skipped during the rebuild.
 */
public record RowValidationFailure(long rowId, String rawIdentifier, String reason) {
}
