package io.tablexform.core.model;

import java.util.Objects;

/**
 * Casts one column to a target element type.
 *
 * @param column      column to convert
 * @param targetType  element type after conversion
 * @param errorPolicy what happens to values that cannot be converted
 */
public record ColumnConversion(String column, ColumnType targetType, ErrorPolicy errorPolicy) implements Transform {

    /** Treatment of values that fail conversion. */
    public enum ErrorPolicy {
        /** Fail the whole transform. */
        RAISE("raise"),
        /** Replace the failing value with the engine's null sentinel. */
        COERCE("coerce"),
        /** Keep the original value; the column becomes {@link ColumnType#MIXED}. */
        IGNORE("ignore");

        private final String wireName;

        ErrorPolicy(String wireName) {
            this.wireName = wireName;
        }

        public String wireName() {
            return wireName;
        }

        public static ErrorPolicy fromWireName(String name) {
            for (ErrorPolicy policy : values()) {
                if (policy.wireName.equals(name)) {
                    return policy;
                }
            }
            if ("coerce-with-fallback".equals(name)) {
                return COERCE;
            }
            throw new IllegalArgumentException("Unknown error policy: '" + name + "'");
        }
    }

    public ColumnConversion {
        Objects.requireNonNull(column, "column must not be null");
        Objects.requireNonNull(targetType, "targetType must not be null");
        Objects.requireNonNull(errorPolicy, "errorPolicy must not be null");
    }

    @Override
    public TransformType type() {
        return TransformType.COLUMN_CONVERSION;
    }
}
