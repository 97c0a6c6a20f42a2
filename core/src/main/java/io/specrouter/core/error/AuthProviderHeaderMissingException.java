package io.specrouter.core.error;

/** Thrown when the {@code X-Authorization-Provider} header parameter is not declared. */
public final class AuthProviderHeaderMissingException extends StandardsViolationException {

    private static final long serialVersionUID = 1L;

    public AuthProviderHeaderMissingException(String message, String source) {
        super(message, source);
    }
}
