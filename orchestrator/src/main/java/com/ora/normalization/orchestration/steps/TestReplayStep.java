package com.ora.normalization.orchestration.steps;

import com.ora.normalization.config.MigrationProperties;
import com.ora.normalization.exception.SchemaException;
import com.ora.normalization.executor.TableRebuilder;
import com.ora.normalization.infrastructure.database.DatabaseConnectionFactory;
import com.ora.normalization.model.MigrationOutcome;
import com.ora.normalization.orchestration.MigrationContext;
import com.ora.normalization.orchestration.MigrationStep;
import com.ora.normalization.orchestration.TestReplayRunner;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Last Prework step: the whole Migration phase, replayed on a disposable copy of the store.
 */
@Component
@RequiredArgsConstructor
public class TestReplayStep implements MigrationStep {

    private final TestReplayRunner testReplayRunner;
    private final MigrationProperties properties;
    private final TableRebuilder tableRebuilder;
    private final DatabaseConnectionFactory connectionFactory;

    @Override
    public void execute(MigrationContext context) throws SQLException {
        try (Connection conn = connectionFactory.createConnection(context.connectionConfig())) {
            if (tableRebuilder.isNormalized(conn)) {
                context.getAuditLog().info("  {} is already normalized, nothing to replay",
                    properties.getSchema().getFactTable());
                return;
            }
        }

        MigrationOutcome outcome = testReplayRunner.replay(context);
        if (!outcome.isSuccess()) {
            throw new SchemaException("Test replay did not commit: " + outcome.message());
        }
        context.getAuditLog().info("  ✓ Test replay committed: {} rows migrated, {} skipped, {} lots created",
            outcome.rowsMigrated(), outcome.rowsSkipped(), outcome.lotsCreated());
    }

    @Override
    public String getStepName() {
        return "Test replay";
    }

    @Override
    public boolean shouldSkip(MigrationContext context) {
        return !properties.getPrework().isTestReplayEnabled() || context.isTestMode();
    }
}
