package io.specrouter.core.error;

/** Thrown when the declared {@code openapi} version is absent or not a 3.x version. */
public final class UnsupportedVersionException extends OpenApiValidationException {

    private static final long serialVersionUID = 1L;

    public UnsupportedVersionException(String message, String source) {
        super(message, source);
    }
}
