package io.tablexform.core.model;

import java.util.Objects;

/**
 * Stable sort of all rows by one column.
 *
 * @param column       sort key
 * @param ascending    direction of non-missing values
 * @param nullPosition where missing values go, independent of direction
 */
public record SortColumn(String column, boolean ascending, NullPosition nullPosition) implements Transform {

    /** Placement of missing values in the sorted output. */
    public enum NullPosition {
        FIRST("first"),
        LAST("last");

        private final String wireName;

        NullPosition(String wireName) {
            this.wireName = wireName;
        }

        public String wireName() {
            return wireName;
        }

        public static NullPosition fromWireName(String name) {
            for (NullPosition position : values()) {
                if (position.wireName.equals(name)) {
                    return position;
                }
            }
            throw new IllegalArgumentException("Unknown null position: '" + name + "'");
        }
    }

    public SortColumn {
        Objects.requireNonNull(column, "column must not be null");
        Objects.requireNonNull(nullPosition, "nullPosition must not be null");
    }

    @Override
    public TransformType type() {
        return TransformType.SORT_COLUMN;
    }
}
