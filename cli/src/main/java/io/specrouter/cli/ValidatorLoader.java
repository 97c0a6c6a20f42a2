package io.specrouter.cli;

import io.specrouter.core.error.UnknownValidatorException;
import io.specrouter.core.validator.ValidatorChain;
import io.specrouter.core.validator.ValidatorRegistry;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.MalformedURLException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves validator names against the built-in validators plus the
 * {@link io.specrouter.core.spi.ContractValidatorProvider}s found in extra jars. The jars stay
 * open until {@link #close()}, so validators can load their classes lazily.
 */
final class ValidatorLoader implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ValidatorLoader.class);

    private final ValidatorRegistry registry = ValidatorRegistry.withBuiltins();
    private final URLClassLoader classLoader;

    /**
     * @param modules jars to search for providers
     * @throws IllegalArgumentException if a jar does not exist
     */
    ValidatorLoader(List<Path> modules) {
        List<URL> urls = new ArrayList<>(modules.size());
        for (Path module : modules) {
            if (!Files.isRegularFile(module)) {
                throw new IllegalArgumentException("Validator module not found: " + module);
            }
            try {
                urls.add(module.toUri().toURL());
            } catch (MalformedURLException e) {
                throw new IllegalArgumentException("Invalid validator module path: " + module, e);
            }
        }
        this.classLoader = new URLClassLoader(urls.toArray(new URL[0]), ValidatorLoader.class.getClassLoader());
        int providers = registry.loadProviders(classLoader);
        LOG.debug("Loaded {} validator provider(s) from {} module(s)", providers, modules.size());
    }

    /**
     * Builds the chain: the baseline validator, then the named ones in order.
     *
     * @throws UnknownValidatorException for the first name nothing is registered under
     */
    ValidatorChain chain(List<String> names) {
        return registry.chain(names);
    }

    /** Registered validator names, sorted. */
    List<String> available() {
        return registry.names();
    }

    @Override
    public void close() {
        try {
            classLoader.close();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to close validator modules", e);
        }
    }
}
