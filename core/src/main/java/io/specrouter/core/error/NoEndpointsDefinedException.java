package io.specrouter.core.error;

/** Thrown when the contract declares no paths. */
public final class NoEndpointsDefinedException extends StandardsViolationException {

    private static final long serialVersionUID = 1L;

    public NoEndpointsDefinedException(String message, String source) {
        super(message, source);
    }
}
