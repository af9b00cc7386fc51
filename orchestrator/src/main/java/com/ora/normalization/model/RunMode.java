package com.ora.normalization.model;

/**
 * Entry points of the orchestrator.
 */
public enum RunMode {
    PREWORK("prework"),
    MIGRATE("migrate"),
    ROLLBACK("rollback"),
    TEST_REPLAY("test-mode");

    private final String optionName;

    RunMode(String optionName) {
        this.optionName = optionName;
    }

    /**
     * Command line option selecting this mode, without leading dashes.
     */
    public String getOptionName() {
        return optionName;
    }
}
