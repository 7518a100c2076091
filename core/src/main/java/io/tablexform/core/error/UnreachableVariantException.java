package io.tablexform.core.error;

/**
 * Thrown when dispatch meets a transform kind that no engine method covers. This is a programming
 * defect, never a user error, and is always fatal to the call.
 */
public final class UnreachableVariantException extends TransformApplyException {

    private static final long serialVersionUID = 1L;

    public UnreachableVariantException(String message, String column, String operator) {
        super(message, null, column, operator);
    }

    private UnreachableVariantException(String message, Throwable cause, Integer step, String column, String operator) {
        super(message, cause, step, column, operator);
    }

    @Override
    public UnreachableVariantException atStep(int step) {
        return withTrace(new UnreachableVariantException(detail(), getCause(), step, column(), operator()));
    }
}
