package com.ora.normalization.model;

/**
 * Result of one post-rebuild check. Advisory checks count as passed even when they warn.
 */
public record IntegrityCheckResult(int number, String name, boolean passed, boolean advisory, String detail) {

    public static IntegrityCheckResult passed(int number, String name, String detail) {
        return new IntegrityCheckResult(number, name, true, false, detail);
    }

    public static IntegrityCheckResult failed(int number, String name, String detail) {
        return new IntegrityCheckResult(number, name, false, false, detail);
    }

    public static IntegrityCheckResult advisory(int number, String name, String detail) {
        return new IntegrityCheckResult(number, name, true, true, detail);
    }

    /**
     * A non-advisory check that did not pass.
     */
    public boolean isHardFailure() {
        return !passed && !advisory;
    }
}
