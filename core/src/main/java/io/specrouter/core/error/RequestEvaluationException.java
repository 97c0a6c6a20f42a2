package io.specrouter.core.error;

/**
 * Abstract parent for errors raised while a bound route handles a request. The transport maps
 * these to HTTP responses; they never abort a contract load.
 */
public abstract class RequestEvaluationException extends SpecRouterException {

    private static final long serialVersionUID = 1L;

    protected RequestEvaluationException(String message) {
        super(message, Phase.EVALUATION);
    }

    /** HTTP status the transport should answer with. */
    public abstract int status();
}
