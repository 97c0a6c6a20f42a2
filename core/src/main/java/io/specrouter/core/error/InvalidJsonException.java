package io.specrouter.core.error;

/** Thrown when contract text cannot be parsed as JSON. */
public final class InvalidJsonException extends OpenApiValidationException {

    private static final long serialVersionUID = 1L;

    public InvalidJsonException(String message, Throwable cause, String source) {
        super(message, cause, source);
    }
}
