package io.specrouter.core.error;

/** Thrown when a validator is requested by a name no registry entry or provider answers to. */
public final class UnknownValidatorException extends ContractLoadException {

    private static final long serialVersionUID = 1L;

    private final String validatorName;

    public UnknownValidatorException(String validatorName) {
        super("Failed to load validator: " + validatorName, null);
        this.validatorName = validatorName;
    }

    public String validatorName() {
        return validatorName;
    }
}
