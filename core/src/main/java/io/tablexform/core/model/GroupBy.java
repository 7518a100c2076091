package io.tablexform.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Groups rows by one or more key columns and reduces every other column with one aggregation.
 *
 * <p>
 * The output has one row per distinct key combination. The key columns come first, in the
 * requested order, followed by the aggregated columns the reducer applies to.
 *
 * @param groupColumns   ordered key columns, no duplicates
 * @param aggregation    reducer applied to the remaining columns
 * @param dropNullGroups drop rows whose key has a missing component; otherwise missing keys form
 *                       their own group
 */
public record GroupBy(List<String> groupColumns, Aggregation aggregation, boolean dropNullGroups)
        implements Transform {

    public GroupBy {
        groupColumns = ModelChecks.distinct(groupColumns, "groupColumns", false);
        Objects.requireNonNull(aggregation, "aggregation must not be null");
    }

    @Override
    public TransformType type() {
        return TransformType.GROUP_BY;
    }
}
