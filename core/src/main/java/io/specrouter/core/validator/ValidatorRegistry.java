package io.specrouter.core.validator;

import io.specrouter.core.error.UnknownValidatorException;
import io.specrouter.core.spi.ContractValidatorProvider;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registry of named validator constructors. Names are resolved when a chain is configured, so an
 * unknown name fails before any contract is read. Thread-safe.
 */
public final class ValidatorRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(ValidatorRegistry.class);

    private final Map<String, Supplier<ContractValidator>> constructors = new ConcurrentHashMap<>();

    /** A registry pre-populated with {@code standards}, {@code standards-strict} and {@code companion-files}. */
    public static ValidatorRegistry withBuiltins() {
        ValidatorRegistry registry = new ValidatorRegistry();
        registry.register(StandardsValidator.NAME, StandardsValidator::new);
        registry.register(StandardsValidator.STRICT_NAME, StandardsValidator::strict);
        registry.register(CompanionFilesValidator.NAME, CompanionFilesValidator::new);
        return registry;
    }

    /**
     * Registers a validator constructor. An existing registration under the same name is replaced.
     *
     * @throws IllegalArgumentException if name is empty
     */
    public void register(String name, Supplier<ContractValidator> constructor) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(constructor, "constructor must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("validator name must not be empty");
        }
        constructors.put(name, constructor);
    }

    /**
     * Registers every {@link ContractValidatorProvider} visible to the class loader.
     *
     * @return the number of providers registered
     */
    public int loadProviders(ClassLoader classLoader) {
        int count = 0;
        for (ContractValidatorProvider provider : ServiceLoader.load(ContractValidatorProvider.class, classLoader)) {
            register(provider.name(), provider::create);
            LOG.debug("Registered validator provider '{}' ({})", provider.name(), provider.getClass().getName());
            count++;
        }
        return count;
    }

    /** Creates the validator registered under the name, if any. */
    public Optional<ContractValidator> create(String name) {
        Supplier<ContractValidator> constructor = constructors.get(name);
        return constructor != null ? Optional.of(constructor.get()) : Optional.empty();
    }

    /**
     * Creates the validator registered under the name.
     *
     * @throws UnknownValidatorException if nothing is registered under it
     */
    public ContractValidator require(String name) {
        return create(name).orElseThrow(() -> new UnknownValidatorException(name));
    }

    /**
     * Builds a chain of the named validators, in the given order, after the baseline.
     *
     * @throws UnknownValidatorException for the first unknown name
     */
    public ValidatorChain chain(List<String> names) {
        List<ContractValidator> validators = new ArrayList<>(names.size());
        for (String name : names) {
            validators.add(require(name));
        }
        return ValidatorChain.of(validators);
    }

    public boolean has(String name) {
        return constructors.containsKey(name);
    }

    /** Registered names, sorted. */
    public List<String> names() {
        return List.copyOf(new TreeSet<>(constructors.keySet()));
    }

    public int size() {
        return constructors.size();
    }
}
