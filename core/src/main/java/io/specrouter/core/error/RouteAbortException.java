package io.specrouter.core.error;

/**
 * Thrown by a route dependency to stop request handling with a given status. The transport
 * answers with {@code {"detail": <message>}}.
 */
public final class RouteAbortException extends RequestEvaluationException {

    private static final long serialVersionUID = 1L;

    private final int status;

    public RouteAbortException(int status, String detail) {
        super(detail);
        if (status < 100 || status > 599) {
            throw new IllegalArgumentException("status must be a valid HTTP status code, got: " + status);
        }
        this.status = status;
    }

    @Override
    public int status() {
        return status;
    }
}
