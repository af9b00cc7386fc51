package com.ora.normalization.cli;

import com.ora.normalization.config.MigrationProperties;
import com.ora.normalization.exception.ConfigurationException;
import com.ora.normalization.model.MigrationOutcome;
import com.ora.normalization.orchestration.MigrationOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Command line entry point. Exit codes: 0 success, 1 failed run, 2 usage error.
 */
@Component
@ConditionalOnProperty(prefix = "migration.cli", name = "enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
@RequiredArgsConstructor
public class MigrationCommandLineRunner implements ApplicationRunner, ExitCodeGenerator {

    static final int EXIT_SUCCESS = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private final MigrationOrchestrator orchestrator;
    private final MigrationProperties properties;

    private int exitCode = EXIT_SUCCESS;

    @Override
    public void run(ApplicationArguments args) {
        CommandLineOptions options;
        try {
            options = CommandLineOptions.parse(args);
        } catch (ConfigurationException e) {
            System.err.println("Error: " + e.getMessage());
            System.err.println(CommandLineOptions.USAGE);
            exitCode = EXIT_USAGE;
            return;
        }

        Path database = options.database() != null
            ? options.database()
            : Paths.get(properties.getDatabase().getPath());

        try {
            MigrationOutcome outcome = orchestrator.run(options.mode(), database);
            exitCode = outcome.isSuccess() ? EXIT_SUCCESS : EXIT_FAILURE;
        } catch (RuntimeException e) {
            log.error("Run aborted: {}", e.getMessage(), e);
            exitCode = EXIT_FAILURE;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
