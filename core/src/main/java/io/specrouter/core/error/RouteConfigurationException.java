package io.specrouter.core.error;

/** Thrown when route registrations or contract paths conflict while the route table is built. */
public final class RouteConfigurationException extends ContractLoadException {

    private static final long serialVersionUID = 1L;

    public RouteConfigurationException(String message, String source) {
        super(message, source);
    }
}
