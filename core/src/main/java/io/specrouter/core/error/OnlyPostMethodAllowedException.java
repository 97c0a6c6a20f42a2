package io.specrouter.core.error;

/** Thrown when the single path declares any method besides {@code post}. */
public final class OnlyPostMethodAllowedException extends StandardsViolationException {

    private static final long serialVersionUID = 1L;

    public OnlyPostMethodAllowedException(String message, String source) {
        super(message, source);
    }
}
