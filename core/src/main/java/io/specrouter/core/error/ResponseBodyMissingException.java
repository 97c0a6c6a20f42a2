package io.specrouter.core.error;

/** Thrown when the {@code 200} response is absent or declares no content. */
public final class ResponseBodyMissingException extends StandardsViolationException {

    private static final long serialVersionUID = 1L;

    public ResponseBodyMissingException(String message, String source) {
        super(message, source);
    }
}
