package io.tablexform.core.error;

/**
 * Thrown when a value cannot be converted to a column's element type: a cell under the
 * {@code raise} error policy of a column conversion, or a filter operand that does not fit the
 * column it is compared against.
 */
public final class ConversionException extends TransformApplyException {

    private static final long serialVersionUID = 1L;

    private final Integer row;

    public ConversionException(String message, String column, String operator, Integer row) {
        super(message, null, column, operator);
        this.row = row;
    }

    public ConversionException(String message, Throwable cause, String column, String operator, Integer row) {
        super(message, cause, null, column, operator);
        this.row = row;
    }

    private ConversionException(
            String message, Throwable cause, Integer step, String column, String operator, Integer row) {
        super(message, cause, step, column, operator);
        this.row = row;
    }

    /** Row of the failing cell, or {@code null} when the failing value is an operand. */
    public Integer row() {
        return row;
    }

    @Override
    public ConversionException atStep(int step) {
        return withTrace(new ConversionException(detail(), getCause(), step, column(), operator(), row));
    }
}
