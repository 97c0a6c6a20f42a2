package io.specrouter.cli;

import io.specrouter.core.engine.SpecRouter;
import io.specrouter.core.engine.SpecRouterOptions;
import io.specrouter.core.error.ContractReadException;
import io.specrouter.core.validator.ValidatorChain;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs every contract below a root through the full load pipeline and reports each file as
 * {@code [PASSED]} or {@code [FAILED]}, followed by a summary. A failing file never stops the run.
 */
public final class SpecValidationRunner {

    private static final Logger LOG = LoggerFactory.getLogger(SpecValidationRunner.class);

    private static final String RULE = "=".repeat(79);
    private static final String SEPARATOR = "-".repeat(79);

    private final SpecRouterOptions options;

    public SpecValidationRunner(ValidatorChain chain, boolean strict) {
        Objects.requireNonNull(chain, "chain must not be null");
        this.options = SpecRouterOptions.builder().chain(chain).strict(strict).build();
    }

    /**
     * @param root a contract file or a directory searched recursively for {@code *.json}
     * @throws ContractReadException if the root does not exist or cannot be listed
     */
    public ValidationSummary run(Path root) {
        List<Path> files = discover(root);

        LOG.info(RULE);
        LOG.info("OpenAPI specs root path: {}", root);
        LOG.info("Validators: {}", String.join(", ", options.chain().names()));
        LOG.info(RULE);

        int passed = 0;
        int failed = 0;
        for (Path file : files) {
            LOG.info("File: {}", file);
            try {
                SpecRouter.load(file, options);
                LOG.info("[PASSED]");
                passed++;
            } catch (RuntimeException e) {
                LOG.error("{}: {}", e.getClass().getSimpleName(), e.getMessage());
                LOG.debug("Failure detail", e);
                LOG.error("[FAILED]");
                failed++;
            }
            LOG.info(SEPARATOR);
        }

        ValidationSummary summary = new ValidationSummary(passed, failed);
        if (failed > 0) {
            LOG.error(RULE);
            LOG.error("Summary:");
            LOG.error("Total : {}", summary.total());
            LOG.error("Passed: {}", passed);
            LOG.error("Failed: {}", failed);
            LOG.error(RULE);
        } else {
            LOG.info(RULE);
            LOG.info("Summary:");
            LOG.info("Total : {}", summary.total());
            LOG.info("Passed: {}", passed);
            LOG.info("Failed: {}", failed);
            LOG.info(RULE);
        }
        return summary;
    }

    private static List<Path> discover(Path root) {
        if (Files.isRegularFile(root)) {
            return List.of(root);
        }
        if (!Files.isDirectory(root)) {
            throw new ContractReadException("Contract path does not exist: " + root, null, root.toString());
        }
        try (Stream<Path> walk = Files.walk(root)) {
            return walk.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(".json"))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new ContractReadException("Failed to list contracts under " + root, e, root.toString());
        }
    }
}
