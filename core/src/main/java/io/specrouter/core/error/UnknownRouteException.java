package io.specrouter.core.error;

/** Thrown when an override is registered for a path/method the contract does not declare. */
public final class UnknownRouteException extends ContractLoadException {

    private static final long serialVersionUID = 1L;

    private final String path;
    private final String method;

    public UnknownRouteException(String path, String method, String source) {
        super("No " + method + " operation declared for path '" + path + "'", source);
        this.path = path;
        this.method = method;
    }

    public String path() {
        return path;
    }

    public String method() {
        return method;
    }
}
