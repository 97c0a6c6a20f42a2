package io.specrouter.core.engine;

import io.specrouter.core.schema.GeneratorOptions;
import io.specrouter.core.validator.ValidatorChain;
import java.util.Objects;

/**
 * Load settings for a {@link SpecRouter}.
 *
 * @param chain     validators every contract must pass before it is parsed
 * @param generator model generation settings, shared by every contract of the router
 */
public record SpecRouterOptions(ValidatorChain chain, GeneratorOptions generator) {

    public SpecRouterOptions {
        Objects.requireNonNull(chain, "chain must not be null");
        Objects.requireNonNull(generator, "generator must not be null");
    }

    /** Baseline validation only, lax models. */
    public static SpecRouterOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private ValidatorChain chain = ValidatorChain.baseline();
        private GeneratorOptions generator = GeneratorOptions.defaults();

        private Builder() {}

        public Builder chain(ValidatorChain chain) {
            this.chain = chain;
            return this;
        }

        public Builder generator(GeneratorOptions generator) {
            this.generator = generator;
            return this;
        }

        /** Shorthand for lax or strict models with otherwise default generator settings. */
        public Builder strict(boolean strict) {
            this.generator = GeneratorOptions.builder().strict(strict).build();
            return this;
        }

        public SpecRouterOptions build() {
            return new SpecRouterOptions(chain, generator);
        }
    }
}
