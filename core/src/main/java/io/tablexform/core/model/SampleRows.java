package io.tablexform.core.model;

/**
 * Random sample of {@code count} rows.
 *
 * @param count           number of rows to draw, at least zero
 * @param seed            random seed, or {@code null} for a non-reproducible sample
 * @param withReplacement whether a row may be drawn more than once
 */
public record SampleRows(int count, Long seed, boolean withReplacement) implements Transform {

    public SampleRows {
        if (count < 0) {
            throw new IllegalArgumentException("count must not be negative, got: " + count);
        }
    }

    @Override
    public TransformType type() {
        return TransformType.SAMPLE_ROWS;
    }
}
