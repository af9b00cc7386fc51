package com.ora.normalization.orchestration.steps;

import com.ora.normalization.exception.IntegrityException;
import com.ora.normalization.executor.IntegrityValidator;
import com.ora.normalization.model.IntegrityCheckResult;
import com.ora.normalization.model.ValidationReport;
import com.ora.normalization.orchestration.MigrationContext;
import com.ora.normalization.orchestration.MigrationStep;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.stream.Collectors;

/**
 * Commit gate: the integrity battery must allow the commit.
 */
@Component
@RequiredArgsConstructor
public class ValidationStep implements MigrationStep {

    private final IntegrityValidator integrityValidator;

    @Override
    public void execute(MigrationContext context) {
        ValidationReport report = integrityValidator.validate(context.getConnection(), context.getAuditLog());
        context.setValidationReport(report);

        if (!report.isCommitAllowed()) {
            String failed = report.hardFailures().stream()
                .map(IntegrityCheckResult::name)
                .collect(Collectors.joining(", "));
            throw new IntegrityException(String.format(
                "Validation failed: %d/%d checks passed (minimum %d)%s",
                report.passedCount(), report.checks().size(), report.minPassingChecks(),
                failed.isEmpty() ? "" : "; failed: " + failed));
        }
    }

    @Override
    public String getStepName() {
        return "Validate integrity";
    }
}
