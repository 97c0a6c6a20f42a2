package io.specrouter.core.error;

/**
 * Abstract parent for every rule violation reported by a contract validator. Subclasses name the
 * violated rule; the CLI prints the simple class name next to the message.
 */
public abstract class OpenApiValidationException extends ContractLoadException {

    private static final long serialVersionUID = 1L;

    protected OpenApiValidationException(String message, String source) {
        super(message, source);
    }

    protected OpenApiValidationException(String message, Throwable cause, String source) {
        super(message, cause, source);
    }
}
