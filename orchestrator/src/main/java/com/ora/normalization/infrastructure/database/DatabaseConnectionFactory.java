package com.ora.normalization.infrastructure.database;

import com.ora.normalization.exception.ConnectionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.sqlite.SQLiteConfig;

import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;

/**
 * Factory for SQLite store connections with the pragmas the migration relies on.
 */
@Component
@Slf4j
public class DatabaseConnectionFactory {

    /**
     * Create a connection from configuration. The store file must already exist;
     * SQLite would otherwise silently create an empty one.
     */
    public Connection createConnection(DatabaseConnectionConfig config) {
        if (!Files.isRegularFile(config.getPath())) {
            throw new ConnectionException("Store file not found: " + config.getPath());
        }

        SQLiteConfig sqliteConfig = new SQLiteConfig();
        sqliteConfig.enforceForeignKeys(config.isForeignKeys());
        sqliteConfig.setBusyTimeout(config.getBusyTimeoutMs());
        if (config.isWalMode()) {
            sqliteConfig.setJournalMode(SQLiteConfig.JournalMode.WAL);
        }
        if (config.isImmediateTransactions()) {
            sqliteConfig.setTransactionMode(SQLiteConfig.TransactionMode.IMMEDIATE);
        }

        String jdbcUrl = config.getJdbcUrl();
        log.debug("Creating connection to: {}", jdbcUrl);

        try {
            return DriverManager.getConnection(jdbcUrl, sqliteConfig.toProperties());
        } catch (SQLException e) {
            throw new ConnectionException("Failed to open store: " + config.getPath(), e);
        }
    }
}
