package com.ora.normalization.orchestration.steps;

import com.ora.normalization.infrastructure.database.DatabaseConnectionFactory;
import com.ora.normalization.orchestration.MigrationContext;
import com.ora.normalization.orchestration.MigrationStep;
import com.ora.normalization.util.SqliteSupport;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Opens the connection that holds the rebuild transaction until commit.
 * The transaction begins IMMEDIATE, so no other writer can start once it is open.
 */
@Component
@RequiredArgsConstructor
public class OpenTransactionStep implements MigrationStep {

    private final DatabaseConnectionFactory connectionFactory;

    @Override
    public void execute(MigrationContext context) throws SQLException {
        Connection conn = connectionFactory.createConnection(context.connectionConfig());
        try {
            SqliteSupport.checkpoint(conn);
            conn.setAutoCommit(false);
        } catch (SQLException e) {
            conn.close();
            throw e;
        }
        context.setConnection(conn);
        context.getAuditLog().info("  Transaction opened on {}", context.getDatabasePath());
    }

    @Override
    public String getStepName() {
        return "Open rebuild transaction";
    }
}
