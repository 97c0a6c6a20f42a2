package io.specrouter.core.error;

/** Thrown when a request or response body is not declared as {@code application/json}. */
public final class WrongContentTypeException extends StandardsViolationException {

    private static final long serialVersionUID = 1L;

    public WrongContentTypeException(String message, String source) {
        super(message, source);
    }
}
