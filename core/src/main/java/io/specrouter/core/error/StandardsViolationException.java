package io.specrouter.core.error;

/** Abstract parent for violations of the single-endpoint house convention. */
public abstract class StandardsViolationException extends OpenApiValidationException {

    private static final long serialVersionUID = 1L;

    protected StandardsViolationException(String message, String source) {
        super(message, source);
    }
}
