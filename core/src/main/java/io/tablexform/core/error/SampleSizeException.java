package io.tablexform.core.error;

/**
 * Thrown when a sample asks for more rows than can be drawn (without replacement, or from an empty table).
 */
public final class SampleSizeException extends TransformApplyException {

    private static final long serialVersionUID = 1L;

    public SampleSizeException(String message, String column, String operator) {
        super(message, null, column, operator);
    }

    private SampleSizeException(String message, Throwable cause, Integer step, String column, String operator) {
        super(message, cause, step, column, operator);
    }

    @Override
    public SampleSizeException atStep(int step) {
        return withTrace(new SampleSizeException(detail(), getCause(), step, column(), operator()));
    }
}
