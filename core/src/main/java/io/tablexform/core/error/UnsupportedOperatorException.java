package io.tablexform.core.error;

/**
 * Thrown when an operator or aggregation cannot be applied to a column of the given element type.
 */
public final class UnsupportedOperatorException extends TransformApplyException {

    private static final long serialVersionUID = 1L;

    public UnsupportedOperatorException(String message, String column, String operator) {
        super(message, null, column, operator);
    }

    private UnsupportedOperatorException(String message, Throwable cause, Integer step, String column, String operator) {
        super(message, cause, step, column, operator);
    }

    @Override
    public UnsupportedOperatorException atStep(int step) {
        return withTrace(new UnsupportedOperatorException(detail(), getCause(), step, column(), operator()));
    }
}
