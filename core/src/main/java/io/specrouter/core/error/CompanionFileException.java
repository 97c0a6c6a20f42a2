package io.specrouter.core.error;

import java.util.Objects;

/**
 * Thrown when a resource that must sit next to the contract file (same base name, different
 * extension) is missing, empty, or unreadable as its expected format.
 */
public final class CompanionFileException extends StandardsViolationException {

    private static final long serialVersionUID = 1L;

    /** What is wrong with the companion file. */
    public enum Reason {
        MISSING,
        EMPTY,
        MALFORMED
    }

    private final String companion;
    private final Reason reason;

    public CompanionFileException(String message, String source, String companion, Reason reason) {
        super(message, source);
        this.companion = Objects.requireNonNull(companion, "companion must not be null");
        this.reason = Objects.requireNonNull(reason, "reason must not be null");
    }

    /** Path of the offending companion file. */
    public String companion() {
        return companion;
    }

    public Reason reason() {
        return reason;
    }
}
