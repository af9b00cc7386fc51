package com.ora.normalization.model;

import java.util.List;

/**
 * Results of the integrity battery and the gate decision.
 */
public record ValidationReport(List<IntegrityCheckResult> checks, int minPassingChecks) {

    public ValidationReport {
        checks = List.copyOf(checks);
    }

    public long passedCount() {
        return checks.stream().filter(IntegrityCheckResult::passed).count();
    }

    public List<IntegrityCheckResult> hardFailures() {
        return checks.stream().filter(IntegrityCheckResult::isHardFailure).toList();
    }

    /**
     * Commit is allowed only with no hard failure and enough passing checks.
     */
    public boolean isCommitAllowed() {
        return hardFailures().isEmpty() && passedCount() >= minPassingChecks;
    }
}
