package io.tablexform.core.model;

import java.util.List;

/**
 * Projects the table onto the given columns. The output column order is the requested order.
 *
 * @param columns ordered column names, no duplicates
 */
public record SelectColumns(List<String> columns) implements Transform {

    public SelectColumns {
        columns = ModelChecks.distinct(columns, "columns", true);
    }

    public static SelectColumns of(String... columns) {
        return new SelectColumns(List.of(columns));
    }

    @Override
    public TransformType type() {
        return TransformType.SELECT_COLUMNS;
    }
}
