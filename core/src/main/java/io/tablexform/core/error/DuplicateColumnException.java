package io.tablexform.core.error;

/**
 * Thrown when a rename would give two columns the same name.
 */
public final class DuplicateColumnException extends TransformApplyException {

    private static final long serialVersionUID = 1L;

    public DuplicateColumnException(String message, String column, String operator) {
        super(message, null, column, operator);
    }

    private DuplicateColumnException(String message, Throwable cause, Integer step, String column, String operator) {
        super(message, cause, step, column, operator);
    }

    @Override
    public DuplicateColumnException atStep(int step) {
        return withTrace(new DuplicateColumnException(detail(), getCause(), step, column(), operator()));
    }
}
