package io.specrouter.core.error;

/** Thrown by validators that require a request body when none is declared. */
public final class RequestBodyMissingException extends StandardsViolationException {

    private static final long serialVersionUID = 1L;

    public RequestBodyMissingException(String message, String source) {
        super(message, source);
    }
}
