package io.specrouter.core.error;

/** Thrown when a validated contract still has a shape the parser cannot map to routes. */
public final class ContractParseException extends ContractLoadException {

    private static final long serialVersionUID = 1L;

    public ContractParseException(String message, String source) {
        super(message, source);
    }
}
