package io.specrouter.cli;

import io.specrouter.core.error.ContractReadException;
import io.specrouter.core.error.UnknownValidatorException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the batch contract validator.
 *
 * <p>Exit status: {@code 0} when every contract passes, {@code 1} when any fails or the root
 * cannot be read, {@code 2} for bad arguments or unknown validators.
 */
public final class SpecValidatorMain {

    private static final Logger LOG = LoggerFactory.getLogger(SpecValidatorMain.class);

    static final int EXIT_BAD_ARGUMENTS = 2;

    private SpecValidatorMain() {
        // utility class
    }

    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        System.exit(run(args));
    }

    /** Runs the validator and returns the exit status instead of exiting. */
    static int run(String[] args) {
        CliOptions options;
        try {
            options = CliOptions.parse(args);
        } catch (IllegalArgumentException e) {
            LOG.error(e.getMessage());
            return EXIT_BAD_ARGUMENTS;
        }

        try (ValidatorLoader loader = new ValidatorLoader(options.modules())) {
            SpecValidationRunner runner = new SpecValidationRunner(loader.chain(options.validators()), options.strict());
            return runner.run(options.path()).exitCode();
        } catch (UnknownValidatorException e) {
            LOG.error("{}. Available validators: {}", e.getMessage(), availableValidators(options));
            return EXIT_BAD_ARGUMENTS;
        } catch (IllegalArgumentException e) {
            LOG.error(e.getMessage());
            return EXIT_BAD_ARGUMENTS;
        } catch (ContractReadException e) {
            LOG.error(e.getMessage());
            return 1;
        }
    }

    private static String availableValidators(CliOptions options) {
        try (ValidatorLoader loader = new ValidatorLoader(options.modules())) {
            return String.join(", ", loader.available());
        }
    }
}
