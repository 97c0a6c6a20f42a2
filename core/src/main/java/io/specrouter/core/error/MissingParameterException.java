package io.specrouter.core.error;

/** Thrown when a parameter object has no {@code name}. */
public final class MissingParameterException extends OpenApiValidationException {

    private static final long serialVersionUID = 1L;

    public MissingParameterException(String message, String source) {
        super(message, source);
    }
}
