package io.specrouter.core.error;

/**
 * Abstract base for all spec-router exceptions. Never thrown directly; use the concrete subclasses
 * under {@link ContractLoadException} or {@link RequestEvaluationException}.
 */
public abstract class SpecRouterException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        LOAD,
        EVALUATION
    }

    private final Phase phase;

    protected SpecRouterException(String message, Phase phase) {
        super(message);
        this.phase = phase;
    }

    protected SpecRouterException(String message, Throwable cause, Phase phase) {
        super(message, cause);
        this.phase = phase;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
