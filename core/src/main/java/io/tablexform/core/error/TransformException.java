package io.tablexform.core.error;

/**
 * Abstract base for all table-xform exceptions. Never thrown directly; use the concrete
 * subclasses under {@link TransformParseException} or {@link TransformApplyException}.
 */
public abstract class TransformException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        PARSE,
        APPLY
    }

    private final Phase phase;

    protected TransformException(String message, Phase phase) {
        super(message);
        this.phase = phase;
    }

    protected TransformException(String message, Throwable cause, Phase phase) {
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
