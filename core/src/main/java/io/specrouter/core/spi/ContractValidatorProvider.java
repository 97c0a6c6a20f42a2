package io.specrouter.core.spi;

import io.specrouter.core.validator.ContractValidator;

/**
 * Service Provider Interface for contributing named contract validators from external jars.
 *
 * <p>Implementations are discovered with {@link java.util.ServiceLoader} and must be listed in
 * {@code META-INF/services/io.specrouter.core.spi.ContractValidatorProvider}. They are looked up
 * by {@link #name()} when a validator chain is configured; nothing else about the jar is
 * inspected.
 */
public interface ContractValidatorProvider {

    /** Name the validator is requested by, e.g. {@code "standards"}. */
    String name();

    /** Creates a fresh validator instance. */
    ContractValidator create();
}
