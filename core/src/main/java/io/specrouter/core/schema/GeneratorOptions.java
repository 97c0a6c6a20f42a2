package io.specrouter.core.schema;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Options for one model generation.
 *
 * @param mode           lax or strict coercion
 * @param formatCode     pretty-print the emitted schema bundle
 * @param retainArtifact keep the emitted bundle on disk after loading it
 * @param artifactDir    directory for the emitted bundle; {@code null} means the system temp dir
 */
public record GeneratorOptions(ValidationMode mode, boolean formatCode, boolean retainArtifact, Path artifactDir) {

    public GeneratorOptions {
        Objects.requireNonNull(mode, "mode must not be null");
    }

    /** Lax mode, formatted, artifact deleted after loading. */
    public static GeneratorOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link GeneratorOptions}. */
    public static final class Builder {

        private ValidationMode mode = ValidationMode.LAX;
        private boolean formatCode = true;
        private boolean retainArtifact;
        private Path artifactDir;

        private Builder() {}

        public Builder mode(ValidationMode mode) {
            this.mode = mode;
            return this;
        }

        /** Shorthand for {@code mode(strict ? STRICT : LAX)}. */
        public Builder strict(boolean strict) {
            this.mode = strict ? ValidationMode.STRICT : ValidationMode.LAX;
            return this;
        }

        public Builder formatCode(boolean formatCode) {
            this.formatCode = formatCode;
            return this;
        }

        public Builder retainArtifact(boolean retainArtifact) {
            this.retainArtifact = retainArtifact;
            return this;
        }

        public Builder artifactDir(Path artifactDir) {
            this.artifactDir = artifactDir;
            return this;
        }

        public GeneratorOptions build() {
            return new GeneratorOptions(mode, formatCode, retainArtifact, artifactDir);
        }
    }
}
