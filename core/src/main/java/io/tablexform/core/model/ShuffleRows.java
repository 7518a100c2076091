package io.tablexform.core.model;

/**
 * Random permutation of all rows.
 *
 * @param seed random seed, or {@code null} for a non-reproducible shuffle
 */
public record ShuffleRows(Long seed) implements Transform {

    public static ShuffleRows seeded(long seed) {
        return new ShuffleRows(seed);
    }

    public static ShuffleRows unseeded() {
        return new ShuffleRows(null);
    }

    @Override
    public TransformType type() {
        return TransformType.SHUFFLE_ROWS;
    }
}
