package com.ora.normalization.model;

import java.util.List;

/**
 * Outcome of the shadow table rebuild. Every source row is either migrated or skipped.
 */
public record RebuildReport(
        long sourceRows,
        long migratedRows,
        long lotsCreated,
        List<RowValidationFailure> failures,
        List<String> recreatedIndexes
) {

    public RebuildReport {
        failures = List.copyOf(failures);
        recreatedIndexes = List.copyOf(recreatedIndexes);
    }

    public long skippedRows() {
        return failures.size();
    }

    /**
     * Whether migrated plus skipped rows account for every source row.
     */
    public boolean isBalanced() {
        return sourceRows == migratedRows + skippedRows();
    }
}
