package io.tablexform.core.model;

/** Reducers available to {@link GroupBy} and {@link Aggregate}. */
public enum Aggregation {
    COUNT("count"),
    SUM("sum"),
    MEAN("mean"),
    MEDIAN("median"),
    MIN("min"),
    MAX("max");

    private final String wireName;

    Aggregation(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /** Whether this reducer can consume a column of the given type. */
    public boolean appliesTo(ColumnType type) {
        return switch (this) {
            case COUNT -> true;
            case SUM, MEAN, MEDIAN -> type.isNumeric();
            case MIN, MAX -> type.isOrderable();
        };
    }

    /** Element type of the reduced value for an input column of the given type. */
    public ColumnType resultType(ColumnType input) {
        return switch (this) {
            case COUNT -> ColumnType.INTEGER;
            case SUM -> input == ColumnType.FLOAT ? ColumnType.FLOAT : ColumnType.INTEGER;
            case MEAN, MEDIAN -> ColumnType.FLOAT;
            case MIN, MAX -> input;
        };
    }

    public static Aggregation fromWireName(String name) {
        for (Aggregation aggregation : values()) {
            if (aggregation.wireName.equals(name)) {
                return aggregation;
            }
        }
        throw new IllegalArgumentException("Unknown aggregation: '" + name + "'");
    }
}
