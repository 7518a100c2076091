package io.tablexform.core.error;

/**
 * Thrown when a wire transform sequence is malformed: invalid JSON or YAML, an unknown
 * discriminator or key, a missing required field, or a value the transform model rejects.
 */
public final class TransformParseException extends TransformException {

    private static final long serialVersionUID = 1L;

    private final String source;
    private final Integer element;

    public TransformParseException(String message, String source, Integer element) {
        super(message, Phase.PARSE);
        this.source = source;
        this.element = element;
    }

    public TransformParseException(String message, Throwable cause, String source, Integer element) {
        super(message, cause, Phase.PARSE);
        this.source = source;
        this.element = element;
    }

    /** File path or other identifier of the input, or {@code null} for in-memory input. */
    public String source() {
        return source;
    }

    /** Index of the offending element in the sequence, or {@code null} if not element-specific. */
    public Integer element() {
        return element;
    }
}
