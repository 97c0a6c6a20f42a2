package io.specrouter.cli;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;
import org.junit.jupiter.api.Test;

class CliOptionsTest {

    @Test
    void longOptions() {
        CliOptions options = CliOptions.parse(new String[] {
            "--path", "contracts", "--validator", "standards", "--validator", "companion-files", "--module", "x.jar",
            "--strict"
        });

        assertThat(options.path()).isEqualTo(Path.of("contracts"));
        assertThat(options.validators()).containsExactly("standards", "companion-files");
        assertThat(options.modules()).containsExactly(Path.of("x.jar"));
        assertThat(options.strict()).isTrue();
    }

    @Test
    void shortOptions() {
        CliOptions options = CliOptions.parse(new String[] {"-p", "specs", "-v", "standards-strict", "-m", "a.jar"});

        assertThat(options.path()).isEqualTo(Path.of("specs"));
        assertThat(options.validators()).containsExactly("standards-strict");
        assertThat(options.modules()).containsExactly(Path.of("a.jar"));
        assertThat(options.strict()).isFalse();
    }

    @Test
    void pathIsRequired() {
        assertThatThrownBy(() -> CliOptions.parse(new String[] {"-v", "standards"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Missing required option: --path")
                .hasMessageContaining("Usage:");
    }

    @Test
    void optionWithoutValueRejected() {
        assertThatThrownBy(() -> CliOptions.parse(new String[] {"--path"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("--path requires a value");
        assertThatThrownBy(() -> CliOptions.parse(new String[] {"-p", "specs", "-v", "--strict"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("-v requires a value");
    }

    @Test
    void unknownOptionRejected() {
        assertThatThrownBy(() -> CliOptions.parse(new String[] {"-p", "specs", "--verbose"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown option: --verbose");
    }
}
