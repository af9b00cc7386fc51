package com.ora.normalization.cli;

import com.ora.normalization.exception.ConfigurationException;
import com.ora.normalization.model.RunMode;
import org.springframework.boot.ApplicationArguments;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

/**
 * Parsed command line: exactly one mode option and an optional store path.
 *
 * @param database store path from {@code --database}, {@code null} for the configured default
 */
public record CommandLineOptions(RunMode mode, Path database) {

    static final String DATABASE_OPTION = "database";

    public static final String USAGE = String.join(System.lineSeparator(),
        "Usage: ora-normalization (--prework | --migrate | --rollback | --test-mode) [--database=<path>]",
        "  --prework     build the SKU and lot catalogs and replay the migration on a copy",
        "  --migrate     back up, pause workflows, rebuild shipped_items, validate and commit",
        "  --rollback    restore the newest verified backup",
        "  --test-mode   run the migration against a disposable copy of the store",
        "  --database    store to migrate (default from migration.database.path)");

    /**
     * Options that Spring Boot itself understands and that are not ours to reject.
     */
    private static final Set<String> PASSTHROUGH_PREFIXES = Set.of("spring.", "logging.", "migration.", "debug", "trace");

    /**
     * @throws ConfigurationException when the arguments are not a valid command line
     */
    public static CommandLineOptions parse(ApplicationArguments args) {
        List<RunMode> modes = new ArrayList<>();
        for (String option : args.getOptionNames()) {
            RunMode mode = modeFor(option);
            if (mode != null) {
                if (!args.getOptionValues(option).isEmpty()) {
                    throw new ConfigurationException("--" + option + " takes no value");
                }
                modes.add(mode);
            } else if (!DATABASE_OPTION.equals(option) && !isPassthrough(option)) {
                throw new ConfigurationException("Unknown option: --" + option);
            }
        }

        if (modes.size() != 1) {
            throw new ConfigurationException(modes.isEmpty()
                ? "One of --prework, --migrate, --rollback or --test-mode is required"
                : "Options " + modes.stream().map(m -> "--" + m.getOptionName()).toList() + " are mutually exclusive");
        }

        return new CommandLineOptions(modes.get(0), database(args));
    }

    /**
     * Accepts both {@code --database=<path>} and {@code --database <path>}.
     */
    private static Path database(ApplicationArguments args) {
        List<String> extra = args.getNonOptionArgs();
        if (!args.containsOption(DATABASE_OPTION)) {
            if (!extra.isEmpty()) {
                throw new ConfigurationException("Unexpected arguments: " + extra);
            }
            return null;
        }

        List<String> values = args.getOptionValues(DATABASE_OPTION);
        if (values.size() > 1) {
            throw new ConfigurationException("--database given more than once");
        }
        if (values.size() == 1 && extra.isEmpty()) {
            return toPath(values.get(0));
        }
        if (values.isEmpty() && extra.size() == 1) {
            return toPath(extra.get(0));
        }
        throw new ConfigurationException(values.isEmpty()
            ? "--database requires a path"
            : "Unexpected arguments: " + extra);
    }

    private static Path toPath(String value) {
        if (value.isBlank()) {
            throw new ConfigurationException("--database requires a path");
        }
        return Paths.get(value);
    }

    private static RunMode modeFor(String option) {
        return Arrays.stream(RunMode.values())
            .filter(mode -> mode.getOptionName().equals(option))
            .findFirst()
            .orElse(null);
    }

    private static boolean isPassthrough(String option) {
        return PASSTHROUGH_PREFIXES.stream().anyMatch(option::startsWith);
    }
}
