package com.ora.normalization.orchestration.steps;

import com.ora.normalization.executor.ReferenceTableBuilder;
import com.ora.normalization.infrastructure.database.DatabaseConnectionFactory;
import com.ora.normalization.model.LotStatus;
import com.ora.normalization.model.SubIdentifierCatalogRow;
import com.ora.normalization.orchestration.MigrationContext;
import com.ora.normalization.orchestration.MigrationStep;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.sql.Connection;
import java.util.List;

/**
 * Prework step creating the lot catalog. Requires the SKU catalog.
 */
@Component
@RequiredArgsConstructor
public class BuildLotCatalogStep implements MigrationStep {

    private final ReferenceTableBuilder referenceTableBuilder;
    private final DatabaseConnectionFactory connectionFactory;

    @Override
    public void execute(MigrationContext context) throws Exception {
        try (Connection conn = connectionFactory.createConnection(context.connectionConfig())) {
            context.setSubIdentifierCatalogRows(referenceTableBuilder.buildSubIdentifierCatalog(conn, context.getAuditLog()));

            List<SubIdentifierCatalogRow> lots = referenceTableBuilder.readSubIdentifierCatalog(conn);
            long inactive = lots.stream().filter(lot -> lot.status() == LotStatus.INACTIVE).count();
            context.getAuditLog().info("  Lots: {} active, {} inactive", lots.size() - inactive, inactive);
        }
    }

    @Override
    public String getStepName() {
        return "Build lot catalog";
    }
}
