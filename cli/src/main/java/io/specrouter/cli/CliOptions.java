package io.specrouter.cli;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Parsed command line of the contract validator.
 *
 * @param path       contract file, or directory scanned for {@code **}{@code /*.json}
 * @param validators validator names run after the baseline, in order
 * @param modules    jars searched for additional validator providers
 * @param strict     generate strict instead of lax models
 */
public record CliOptions(Path path, List<String> validators, List<Path> modules, boolean strict) {

    static final String USAGE = String.join(
            System.lineSeparator(),
            "Usage: spec-validator --path <dir> [--validator <name>]... [--module <jar>]... [--strict]",
            "  -p, --path <dir>         directory with contract files (required)",
            "  -v, --validator <name>   extra validator to run, repeatable",
            "  -m, --module <jar>       jar with validator providers, repeatable",
            "      --strict             validate request models in strict mode");

    public CliOptions {
        Objects.requireNonNull(path, "path must not be null");
        validators = List.copyOf(validators);
        modules = List.copyOf(modules);
    }

    /**
     * Parses the arguments.
     *
     * @throws IllegalArgumentException with the usage text for unknown options, missing values
     *                                  or a missing {@code --path}
     */
    public static CliOptions parse(String[] args) {
        Path path = null;
        List<String> validators = new ArrayList<>();
        List<Path> modules = new ArrayList<>();
        boolean strict = false;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--path", "-p" -> path = Path.of(value(args, ++i, arg));
                case "--validator", "-v" -> validators.add(value(args, ++i, arg));
                case "--module", "-m" -> modules.add(Path.of(value(args, ++i, arg)));
                case "--strict" -> strict = true;
                default -> throw usage("Unknown option: " + arg);
            }
        }
        if (path == null) {
            throw usage("Missing required option: --path");
        }
        return new CliOptions(path, validators, modules, strict);
    }

    private static String value(String[] args, int index, String option) {
        if (index >= args.length || args[index].startsWith("-")) {
            throw usage(option + " requires a value");
        }
        return args[index];
    }

    private static IllegalArgumentException usage(String problem) {
        return new IllegalArgumentException(problem + System.lineSeparator() + USAGE);
    }
}
