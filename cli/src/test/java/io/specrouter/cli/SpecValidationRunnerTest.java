package io.specrouter.cli;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.specrouter.core.error.ContractReadException;
import io.specrouter.core.validator.StandardsValidator;
import io.specrouter.core.validator.ValidatorChain;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

/** Tests for {@link SpecValidationRunner}, asserting on its log output. */
class SpecValidationRunnerTest {

    private static final Path CONTRACTS = Path.of("src/test/resources/contracts");

    private ListAppender<ILoggingEvent> appender;
    private Logger logger;

    @BeforeEach
    void attachAppender() {
        logger = (Logger) LoggerFactory.getLogger(SpecValidationRunner.class);
        appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void detachAppender() {
        logger.detachAppender(appender);
    }

    private List<String> messages(Level level) {
        return appender.list.stream()
                .filter(e -> e.getLevel() == level)
                .map(ILoggingEvent::getFormattedMessage)
                .toList();
    }

    @Test
    void everyContractPassesBaseline() {
        ValidationSummary summary = new SpecValidationRunner(ValidatorChain.baseline(), false).run(CONTRACTS);

        assertThat(summary.total()).isEqualTo(2);
        assertThat(summary.passed()).isEqualTo(2);
        assertThat(summary.exitCode()).isZero();
        assertThat(messages(Level.INFO)).filteredOn("[PASSED]"::equals).hasSize(2);
        assertThat(messages(Level.INFO)).contains("Validators: baseline", "Total : 2", "Passed: 2", "Failed: 0");
        assertThat(messages(Level.ERROR)).isEmpty();
    }

    @Test
    void failingFileDoesNotStopTheRun() {
        ValidatorChain chain = ValidatorChain.of(StandardsValidator.strict());

        ValidationSummary summary = new SpecValidationRunner(chain, false).run(CONTRACTS);

        assertThat(summary.passed()).isEqualTo(1);
        assertThat(summary.failed()).isEqualTo(1);
        assertThat(summary.exitCode()).isEqualTo(1);
        assertThat(messages(Level.ERROR))
                .contains("[FAILED]", "Summary:", "Total : 2", "Passed: 1", "Failed: 1")
                .anySatisfy(m -> assertThat(m).startsWith("CompanionFileException: "));
    }

    @Test
    void invalidJsonReportedAsFailure(@TempDir Path dir) throws IOException {
        Files.writeString(dir.resolve("broken.json"), "{\"openapi\": ");

        ValidationSummary summary = new SpecValidationRunner(ValidatorChain.baseline(), false).run(dir);

        assertThat(summary.failed()).isEqualTo(1);
        assertThat(messages(Level.ERROR)).anySatisfy(m -> assertThat(m).startsWith("InvalidJsonException: "));
    }

    @Test
    void emptyDirectoryPasses(@TempDir Path dir) {
        ValidationSummary summary = new SpecValidationRunner(ValidatorChain.baseline(), true).run(dir);

        assertThat(summary.total()).isZero();
        assertThat(summary.exitCode()).isZero();
    }

    @Test
    void missingRootRejected(@TempDir Path dir) {
        SpecValidationRunner runner = new SpecValidationRunner(ValidatorChain.baseline(), false);

        assertThatThrownBy(() -> runner.run(dir.resolve("absent"))).isInstanceOf(ContractReadException.class);
    }
}
