package io.specrouter.core.error;

/**
 * Abstract parent for errors raised while a contract file is loaded: validation, parsing, model
 * generation and route table construction. Carries the file or resource that caused the error.
 * Loading is all-or-nothing, so no partial route table exists once one of these is thrown.
 */
public abstract class ContractLoadException extends SpecRouterException {

    private static final long serialVersionUID = 1L;

    private final String source;

    protected ContractLoadException(String message, String source) {
        super(message, Phase.LOAD);
        this.source = source;
    }

    protected ContractLoadException(String message, Throwable cause, String source) {
        super(message, cause, Phase.LOAD);
        this.source = source;
    }

    /** The file path or resource identifier that caused the error, or {@code null} if unknown. */
    public String source() {
        return source;
    }
}
