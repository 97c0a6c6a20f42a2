package io.specrouter.core.error;

/**
 * Thrown when component schemas cannot be turned into model types: unresolved {@code $ref},
 * malformed schema constructs, unknown model names, or module identifier collisions.
 */
public final class ModelGenerationException extends ContractLoadException {

    private static final long serialVersionUID = 1L;

    private final String component;

    public ModelGenerationException(String message, String component, String source) {
        super(message, source);
        this.component = component;
    }

    public ModelGenerationException(String message, Throwable cause, String component, String source) {
        super(message, cause, source);
        this.component = component;
    }

    /** The schema component that failed, or {@code null} if the failure is module-wide. */
    public String component() {
        return component;
    }
}
