package com.ora.normalization.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for normalization migration runs.
 */
@Configuration
@ConfigurationProperties(prefix = "migration")
@Validated
@Data
public class MigrationProperties {

    /**
     * Live store location and connection settings.
     */
    @Valid
    private DatabaseConfig database = new DatabaseConfig();

    /**
     * Table names of the source/destination schema pair.
     */
    @Valid
    private SchemaConfig schema = new SchemaConfig();

    /**
     * Reference catalog population.
     */
    @Valid
    private CatalogConfig catalog = new CatalogConfig();

    /**
     * Shadow table rebuild.
     */
    @Valid
    private RebuildConfig rebuild = new RebuildConfig();

    /**
     * Post-rebuild integrity gate.
     */
    @Valid
    private ValidationConfig validation = new ValidationConfig();

    @Valid
    private BackupConfig backup = new BackupConfig();

    /**
     * External ingestion workflows paused during the migration window.
     */
    @Valid
    private WorkflowConfig workflows = new WorkflowConfig();

    @Valid
    private PreworkConfig prework = new PreworkConfig();

    /**
     * Operator marker files and run logs.
     */
    @Valid
    private OutputConfig output = new OutputConfig();

    @Data
    public static class DatabaseConfig {
        /**
         * Path of the SQLite store used when no --database option is given.
         */
        @NotBlank
        private String path = "ora.db";

        /**
         * How long a statement waits on a locked store before failing.
         */
        @Min(0)
        private int busyTimeoutMs = 30000;
    }

    @Data
    public static class SchemaConfig {
        private String factTable = "shipped_items";
        private String entityTable = "skus";
        private String entitySourceTable = "inventory_current";
        private String subIdentifierTable = "lots";
        private String subIdentifierSourceTable = "lot_inventory";
        private String orderTable = "shipped_orders";

        /**
         * Whether the rebuilt fact table references the order table.
         */
        private boolean orderForeignKey = true;

        /**
         * Tables whose row counts are recorded at the freeze point.
         */
        @NotEmpty
        private List<String> keyTables = new ArrayList<>(List.of("shipped_items", "shipped_orders"));

        public String getShadowTable() {
            return factTable + "_new";
        }
    }

    @Data
    public static class CatalogConfig {
        /**
         * Number of SKUs the entity catalog must hold after population.
         */
        @Min(0)
        private int expectedEntityCount = 5;
    }

    @Data
    public static class RebuildConfig {
        /**
         * Rows per JDBC batch when filling the shadow table.
         */
        @Min(1)
        private int batchSize = 500;
    }

    @Data
    public static class ValidationConfig {
        /**
         * Number of the six checks that must pass before commit.
         * Hard checks abort the commit regardless of this value.
         */
        @Min(0)
        private int minPassingChecks = 5;

        /**
         * Ship dates before this day are suspicious when the row was created recently.
         */
        @NotNull
        private LocalDate suspiciousBefore = LocalDate.of(2025, 1, 1);
    }

    @Data
    public static class BackupConfig {
        @NotBlank
        private String directory = "backups";
    }

    @Data
    public static class WorkflowConfig {
        /**
         * Workflows paused before the destructive phase.
         */
        private List<String> names = new ArrayList<>(List.of(
            "scheduled_xml_import",
            "scheduled_shipstation_upload",
            "shipstation_status_sync"
        ));

        /**
         * Regex prefix a command line must match before the workflow name.
         */
        @NotBlank
        private String interpreterPattern = "python";

        /**
         * Pattern matching every workflow process, used by rollback.
         */
        @NotBlank
        private String stopAllPattern = "python.*src/";

        /**
         * Wait after each termination signal before re-checking.
         */
        @NotNull
        private Duration gracePeriod = Duration.ofSeconds(5);

        /**
         * Command that relaunches the workflow supervisor.
         */
        @NotEmpty
        private List<String> supervisorCommand = new ArrayList<>(List.of("bash", "start_all.sh"));
    }

    @Data
    public static class PreworkConfig {
        /**
         * Replay the full migration against a disposable copy at the end of Prework.
         */
        private boolean testReplayEnabled = true;

        /**
         * Identifier the record parser must split correctly before Prework completes.
         */
        @NotBlank
        private String parserSample = "17612 - 250300";

        @NotBlank
        private String parserSampleBase = "17612";

        @NotBlank
        private String parserSampleSub = "250300";
    }

    @Data
    public static class OutputConfig {
        /**
         * Directory of the freeze marker files.
         */
        @NotBlank
        private String markerDirectory = "migration";

        /**
         * Directory of the per-run logs and summaries.
         */
        @NotBlank
        private String logDirectory = "migration/logs";
    }
}
