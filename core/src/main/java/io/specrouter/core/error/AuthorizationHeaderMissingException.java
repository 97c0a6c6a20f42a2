package io.specrouter.core.error;

/** Thrown when the {@code Authorization} header parameter is not declared. */
public final class AuthorizationHeaderMissingException extends StandardsViolationException {

    private static final long serialVersionUID = 1L;

    public AuthorizationHeaderMissingException(String message, String source) {
        super(message, source);
    }
}
