package com.ora.normalization.cli;

import com.ora.normalization.model.FailureCategory;
import com.ora.normalization.model.MigrationOutcome;
import com.ora.normalization.model.MigrationState;
import com.ora.normalization.model.RunMode;
import com.ora.normalization.orchestration.MigrationOrchestrator;
import com.ora.normalization.support.TestStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class MigrationCommandLineRunnerTest {

    private MigrationOrchestrator orchestrator;
    private MigrationCommandLineRunner runner;

    @BeforeEach
    void setUp() {
        orchestrator = mock(MigrationOrchestrator.class);
        runner = new MigrationCommandLineRunner(orchestrator, TestStore.properties());
    }

    private static MigrationOutcome outcome(RunMode mode, MigrationState state, Set<FailureCategory> failures) {
        return new MigrationOutcome("20261019_120000", mode, state, failures, 0, 0, 0, "done", null);
    }

    @Test
    @DisplayName("Should exit 0 when the migration commits")
    void testSuccessExitCode() {
        when(orchestrator.run(RunMode.MIGRATE, Paths.get("data/ora.db")))
            .thenReturn(outcome(RunMode.MIGRATE, MigrationState.COMMITTED, Set.of()));

        runner.run(new DefaultApplicationArguments("--migrate", "--database=data/ora.db"));

        assertEquals(MigrationCommandLineRunner.EXIT_SUCCESS, runner.getExitCode());
    }

    @Test
    @DisplayName("Should exit 1 when the migration was rolled back")
    void testFailureExitCode() {
        when(orchestrator.run(any(), any()))
            .thenReturn(outcome(RunMode.MIGRATE, MigrationState.ROLLED_BACK, Set.of(FailureCategory.INTEGRITY_FAILURE)));

        runner.run(new DefaultApplicationArguments("--migrate"));

        assertEquals(MigrationCommandLineRunner.EXIT_FAILURE, runner.getExitCode());
    }

    @Test
    @DisplayName("Should exit 1 when a run is already in progress")
    void testRunAborted() {
        when(orchestrator.run(any(), any())).thenThrow(new IllegalStateException("A run is already in progress"));

        runner.run(new DefaultApplicationArguments("--rollback"));

        assertEquals(MigrationCommandLineRunner.EXIT_FAILURE, runner.getExitCode());
    }

    @Test
    @DisplayName("Should exit 2 without running anything on a usage error")
    void testUsageExitCode() {
        runner.run(new DefaultApplicationArguments("--prework", "--migrate"));

        assertEquals(MigrationCommandLineRunner.EXIT_USAGE, runner.getExitCode());
        verifyNoInteractions(orchestrator);
    }

    @Test
    @DisplayName("Should fall back to the configured store path")
    void testDefaultDatabase() {
        when(orchestrator.run(any(), any()))
            .thenReturn(outcome(RunMode.PREWORK, MigrationState.IDLE, Set.of()));

        runner.run(new DefaultApplicationArguments("--prework"));

        verify(orchestrator).run(RunMode.PREWORK, Path.of("ora.db"));
        assertEquals(MigrationCommandLineRunner.EXIT_SUCCESS, runner.getExitCode());
    }
}
