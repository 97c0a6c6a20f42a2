package io.specrouter.core.error;

/** Thrown when a body schema reference is absent, foreign, or points to an undefined component. */
public final class SchemaMissingException extends StandardsViolationException {

    private static final long serialVersionUID = 1L;

    public SchemaMissingException(String message, String source) {
        super(message, source);
    }
}
