package io.tablexform.core.engine;

import io.tablexform.core.model.Aggregation;
import io.tablexform.core.model.ColumnType;
import java.util.Arrays;
import java.util.List;

/**
 * Reducers behind {@link io.tablexform.core.model.GroupBy} and
 * {@link io.tablexform.core.model.Aggregate}. Callers pass only the values their engine treats
 * as present; missing values never reach a reducer.
 */
public final class Aggregations {

    private Aggregations() {}

    /**
     * Reduces present values of a column.
     *
     * @param aggregation reducer, which must {@linkplain Aggregation#appliesTo apply} to {@code type}
     * @param type        element type of the column
     * @param values      present values, in row order
     * @return the reduced value of type {@link Aggregation#resultType}, or {@code null} when a
     *         mean, median, min or max has nothing to reduce
     */
    public static Object reduce(Aggregation aggregation, ColumnType type, List<Object> values) {
        if (!aggregation.appliesTo(type)) {
            throw new IllegalArgumentException(aggregation.wireName() + " does not apply to " + type);
        }
        return switch (aggregation) {
            case COUNT -> (long) values.size();
            case SUM -> sum(type, values);
            case MEAN -> values.isEmpty() ? null : Arrays.stream(doubles(values)).sum() / values.size();
            case MEDIAN -> median(values);
            case MIN -> values.stream().min(ValueOrdering.NATURAL).orElse(null);
            case MAX -> values.stream().max(ValueOrdering.NATURAL).orElse(null);
        };
    }

    private static Object sum(ColumnType type, List<Object> values) {
        if (type == ColumnType.FLOAT) {
            double total = 0.0;
            for (Object value : values) {
                total += (Double) value;
            }
            return total;
        }
        long total = 0L;
        for (Object value : values) {
            total += value instanceof Boolean b ? (b ? 1L : 0L) : (Long) value;
        }
        return total;
    }

    private static Object median(List<Object> values) {
        if (values.isEmpty()) {
            return null;
        }
        double[] sorted = doubles(values);
        Arrays.sort(sorted);
        int mid = sorted.length / 2;
        if (sorted.length % 2 == 1) {
            return sorted[mid];
        }
        return (sorted[mid - 1] + sorted[mid]) / 2.0;
    }

    private static double[] doubles(List<Object> values) {
        double[] result = new double[values.size()];
        for (int i = 0; i < result.length; i++) {
            Object value = values.get(i);
            if (value instanceof Boolean b) {
                result[i] = b ? 1.0 : 0.0;
            } else {
                result[i] = ((Number) value).doubleValue();
            }
        }
        return result;
    }
}
