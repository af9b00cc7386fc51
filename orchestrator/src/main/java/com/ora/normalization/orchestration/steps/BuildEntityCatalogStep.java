package com.ora.normalization.orchestration.steps;

import com.ora.normalization.executor.ReferenceTableBuilder;
import com.ora.normalization.infrastructure.database.DatabaseConnectionFactory;
import com.ora.normalization.orchestration.MigrationContext;
import com.ora.normalization.orchestration.MigrationStep;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.sql.Connection;

/**
 * Prework step creating the SKU catalog.
 */
@Component
@RequiredArgsConstructor
public class BuildEntityCatalogStep implements MigrationStep {

    private final ReferenceTableBuilder referenceTableBuilder;
    private final DatabaseConnectionFactory connectionFactory;

    @Override
    public void execute(MigrationContext context) throws Exception {
        try (Connection conn = connectionFactory.createConnection(context.connectionConfig())) {
            context.setEntityCatalogRows(referenceTableBuilder.buildEntityCatalog(conn, context.getAuditLog()));

            long withoutReorderPoint = referenceTableBuilder.readEntityCatalog(conn).stream()
                .filter(sku -> sku.reorderPoint() == null)
                .count();
            if (withoutReorderPoint > 0) {
                context.getAuditLog().warn("  {} SKUs have no reorder point", withoutReorderPoint);
            }
        }
    }

    @Override
    public String getStepName() {
        return "Build SKU catalog";
    }
}
