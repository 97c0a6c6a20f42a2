package io.specrouter.core.error;

/** Thrown when a contract file, or a directory of contracts, cannot be read. */
public final class ContractReadException extends ContractLoadException {

    private static final long serialVersionUID = 1L;

    public ContractReadException(String message, Throwable cause, String source) {
        super(message, cause, source);
    }
}
