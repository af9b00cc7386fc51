package com.ora.normalization.orchestration.steps;

import com.ora.normalization.exception.IntegrityException;
import com.ora.normalization.executor.TableRebuilder;
import com.ora.normalization.model.FailureCategory;
import com.ora.normalization.model.RebuildReport;
import com.ora.normalization.orchestration.MigrationContext;
import com.ora.normalization.orchestration.MigrationStep;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class RebuildStep implements MigrationStep {

    private final TableRebuilder tableRebuilder;

    @Override
    public void execute(MigrationContext context) {
        RebuildReport report = tableRebuilder.rebuild(context.getConnection(), context.getAuditLog());
        context.setRebuildReport(report);

        if (!report.isBalanced()) {
            throw new IntegrityException(String.format(
                "Row accounting mismatch: %d source rows, %d migrated, %d skipped",
                report.sourceRows(), report.migratedRows(), report.skippedRows()));
        }
        if (report.skippedRows() > 0) {
            context.recordFailure(FailureCategory.VALIDATION_FAILURE);
        }
        context.getAuditLog().info("  ✓ {} rows migrated, {} skipped, {} lots created",
            report.migratedRows(), report.skippedRows(), report.lotsCreated());
    }

    @Override
    public String getStepName() {
        return "Rebuild fact table";
    }
}
