package io.specrouter.core.error;

/** Thrown when the contract declares a {@code servers} section. */
public final class ServersShouldNotBeDefinedException extends StandardsViolationException {

    private static final long serialVersionUID = 1L;

    public ServersShouldNotBeDefinedException(String message, String source) {
        super(message, source);
    }
}
