package io.tablexform.core.error;

/**
 * Abstract parent for failures while applying a transform to a table. Engines throw these
 * without a step index; the dispatcher rethrows them through {@link #atStep(int)} so that the
 * caller learns which position of the sequence failed.
 */
public abstract class TransformApplyException extends TransformException {

    private static final long serialVersionUID = 1L;

    private final Integer step;
    private final String column;
    private final String operator;

    protected TransformApplyException(String message, Integer step, String column, String operator) {
        super(message, Phase.APPLY);
        this.step = step;
        this.column = column;
        this.operator = operator;
    }

    protected TransformApplyException(
            String message, Throwable cause, Integer step, String column, String operator) {
        super(message, cause, Phase.APPLY);
        this.step = step;
        this.column = column;
        this.operator = operator;
    }

    /** Zero-based index of the failing transform in the submitted sequence, or {@code null}. */
    public Integer step() {
        return step;
    }

    /** Column involved in the failure, or {@code null}. */
    public String column() {
        return column;
    }

    /** Operator or transform kind involved in the failure, or {@code null}. */
    public String operator() {
        return operator;
    }

    /**
     * Returns an exception of the same concrete type and context, annotated with the given step
     * index. The stack trace and cause of this exception are preserved.
     */
    public abstract TransformApplyException atStep(int step);

    /** Copies this exception's stack trace onto an annotated copy. */
    protected final <E extends TransformApplyException> E withTrace(E copy) {
        copy.setStackTrace(getStackTrace());
        return copy;
    }

    @Override
    public String getMessage() {
        String message = super.getMessage();
        return step == null ? message : "step " + step + ": " + message;
    }

    @Override
    public String detail() {
        return super.getMessage();
    }
}
