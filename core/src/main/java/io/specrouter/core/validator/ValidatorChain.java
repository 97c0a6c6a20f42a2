package io.specrouter.core.validator;

import io.specrouter.core.error.OpenApiValidationException;
import io.specrouter.core.model.ContractDocument;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ordered, immutable sequence of {@link ContractValidator}s gating a contract. The baseline
 * version check is always the first entry; further validators run in registration order.
 *
 * <p>The chain is fail-fast: the first validator to raise ends validation of that document and
 * its error propagates unchanged. Every validator receives its own deep copy of the document, so
 * the document the parser later sees is the one that was loaded. Stateless between documents and
 * safe to reuse across threads.
 */
public final class ValidatorChain {

    private static final Logger LOG = LoggerFactory.getLogger(ValidatorChain.class);

    private final List<ContractValidator> validators;

    private ValidatorChain(List<ContractValidator> validators) {
        this.validators = Collections.unmodifiableList(validators);
    }

    /** A chain with only the baseline validator. */
    public static ValidatorChain baseline() {
        return of(List.of());
    }

    /** A chain running the baseline validator followed by the given validators in order. */
    public static ValidatorChain of(ContractValidator... validators) {
        return of(List.of(validators));
    }

    /** A chain running the baseline validator followed by the given validators in order. */
    public static ValidatorChain of(List<ContractValidator> validators) {
        Objects.requireNonNull(validators, "validators must not be null");
        List<ContractValidator> ordered = new ArrayList<>(validators.size() + 1);
        ordered.add(new BaselineValidator());
        for (ContractValidator validator : validators) {
            Objects.requireNonNull(validator, "validator must not be null");
            if (validator instanceof BaselineValidator) {
                continue;
            }
            ordered.add(validator);
        }
        return new ValidatorChain(ordered);
    }

    /**
     * Loads the contract at {@code path} and runs every validator over it.
     *
     * @return the loaded document, green-lit for parsing
     * @throws OpenApiValidationException from the first validator that fails, or if the file is
     *                                    not valid JSON
     */
    public ContractDocument validate(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        ContractDocument document = ContractDocument.load(path);
        validate(document);
        return document;
    }

    /**
     * Runs every validator over an already loaded document.
     *
     * @throws OpenApiValidationException from the first validator that fails
     */
    public void validate(ContractDocument document) {
        Objects.requireNonNull(document, "document must not be null");
        for (ContractValidator validator : validators) {
            LOG.debug("Running validator '{}' on {}", validator.name(), document.source());
            validator.validate(new ContractDocument(document.source(), document.text(), document.copyOfRoot()));
        }
    }

    /** Validators in execution order, baseline first. */
    public List<ContractValidator> validators() {
        return validators;
    }

    /** Names of the validators in execution order. */
    public List<String> names() {
        return validators.stream().map(ContractValidator::name).toList();
    }

    @Override
    public String toString() {
        return "ValidatorChain" + names();
    }
}
