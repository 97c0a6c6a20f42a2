package io.specrouter.core.error;

/** Thrown when the single path has no {@code post} operation. */
public final class PostMethodIsMissingException extends StandardsViolationException {

    private static final long serialVersionUID = 1L;

    public PostMethodIsMissingException(String message, String source) {
        super(message, source);
    }
}
