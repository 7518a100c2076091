package io.tablexform.core.error;

/**
 * Thrown when a transform references a column that is not in the table.
 */
public final class UnknownColumnException extends TransformApplyException {

    private static final long serialVersionUID = 1L;

    public UnknownColumnException(String message, String column, String operator) {
        super(message, null, column, operator);
    }

    private UnknownColumnException(String message, Throwable cause, Integer step, String column, String operator) {
        super(message, cause, step, column, operator);
    }

    @Override
    public UnknownColumnException atStep(int step) {
        return withTrace(new UnknownColumnException(detail(), getCause(), step, column(), operator()));
    }
}
