package com.ora.normalization.orchestration.steps;

import com.ora.normalization.orchestration.MigrationContext;
import com.ora.normalization.orchestration.MigrationStep;
import com.ora.normalization.util.SqliteSupport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Commits the rebuild transaction and folds the write-ahead log into the store file.
 */
@Component
@Slf4j
public class CommitStep implements MigrationStep {

    @Override
    public void execute(MigrationContext context) throws SQLException {
        Connection conn = context.getConnection();
        conn.commit();
        context.setCommitted(true);
        context.getAuditLog().info("  ✓ Transaction committed");

        try {
            conn.setAutoCommit(true);
            SqliteSupport.checkpoint(conn);
            context.getAuditLog().info("  Final checkpoint complete");
        } catch (SQLException e) {
            // Committed data is safe in the WAL; the next writer checkpoints it
            context.getAuditLog().warn("  Final checkpoint failed: {}", e.getMessage());
        } finally {
            context.setConnection(null);
            closeQuietly(conn, context);
        }
    }

    private void closeQuietly(Connection conn, MigrationContext context) {
        try {
            conn.close();
        } catch (SQLException e) {
            log.warn("[Run-{}] Could not close connection after commit: {}", context.getRunId(), e.getMessage());
        }
    }

    @Override
    public String getStepName() {
        return "Commit";
    }
}
