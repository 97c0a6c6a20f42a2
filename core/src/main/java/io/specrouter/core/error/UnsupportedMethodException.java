package io.specrouter.core.error;

/**
 * Thrown when a route is requested for an HTTP method other than GET or POST. Lookups never
 * answer such a request with an empty result.
 */
public final class UnsupportedMethodException extends SpecRouterException {

    private static final long serialVersionUID = 1L;

    private final String method;

    public UnsupportedMethodException(String method) {
        super("Unsupported HTTP method: " + method, Phase.LOAD);
        this.method = method;
    }

    public String method() {
        return method;
    }
}
