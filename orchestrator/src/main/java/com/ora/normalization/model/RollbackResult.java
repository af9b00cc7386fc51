package com.ora.normalization.model;

import java.nio.file.Path;

/**
 * Result of a restore attempt. {@code backupUsed} is {@code null} when nothing was restored.
 */
public record RollbackResult(boolean restored, Path backupUsed, String message) {

    public static RollbackResult restored(Path backupUsed, String message) {
        return new RollbackResult(true, backupUsed, message);
    }

    public static RollbackResult catastrophic(String message) {
        return new RollbackResult(false, null, message);
    }
}
