package io.tablexform.core.model;

import java.util.List;

/**
 * Reduces the whole table to a single summary row.
 *
 * <p>
 * One output column is produced per (column, function) pair, named
 * {@code <column>_<function>}, ordered by column and then by function.
 *
 * @param columns   columns to reduce, no duplicates
 * @param functions reducers to apply to each column, no duplicates
 */
public record Aggregate(List<String> columns, List<Aggregation> functions) implements Transform {

    public Aggregate {
        columns = ModelChecks.distinct(columns, "columns", false);
        functions = ModelChecks.distinct(functions, "functions", false);
    }

    /** Output column name for one (column, function) pair. */
    public static String outputName(String column, Aggregation function) {
        return column + "_" + function.wireName();
    }

    @Override
    public TransformType type() {
        return TransformType.AGGREGATE;
    }
}
