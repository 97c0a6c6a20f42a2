package io.specrouter.core.validator;

import io.specrouter.core.error.OpenApiValidationException;
import io.specrouter.core.model.ContractDocument;

/**
 * A structural check run over a contract before anything is built from it.
 *
 * <p>Implementations raise a typed {@link OpenApiValidationException} on the first rule they find
 * violated and return normally otherwise. The document they receive is a private copy; changes to
 * it are never seen by later validators or by the parser.
 */
public interface ContractValidator {

    /** Name the validator is registered and reported under. */
    String name();

    /**
     * Checks the document.
     *
     * @throws OpenApiValidationException on the first violated rule
     */
    void validate(ContractDocument document);
}
