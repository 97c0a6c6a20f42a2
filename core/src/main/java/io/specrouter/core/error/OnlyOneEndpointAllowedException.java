package io.specrouter.core.error;

/** Thrown when the contract declares more than one path. */
public final class OnlyOneEndpointAllowedException extends StandardsViolationException {

    private static final long serialVersionUID = 1L;

    public OnlyOneEndpointAllowedException(String message, String source) {
        super(message, source);
    }
}
