package io.specrouter.core.error;

/** Thrown when the contract or its operation declares a {@code security} section. */
public final class SecurityShouldNotBeDefinedException extends StandardsViolationException {

    private static final long serialVersionUID = 1L;

    public SecurityShouldNotBeDefinedException(String message, String source) {
        super(message, source);
    }
}
