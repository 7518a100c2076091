package io.tablexform.core.engine.columnar;

import io.tablexform.core.engine.Aggregations;
import io.tablexform.core.engine.CompiledCondition;
import io.tablexform.core.engine.ValueCoercion;
import io.tablexform.core.engine.ValueOrdering;
import io.tablexform.core.error.ConversionException;
import io.tablexform.core.error.DuplicateColumnException;
import io.tablexform.core.error.SampleSizeException;
import io.tablexform.core.error.UnsupportedOperatorException;
import io.tablexform.core.model.Aggregate;
import io.tablexform.core.model.Aggregation;
import io.tablexform.core.model.ColumnConversion;
import io.tablexform.core.model.ColumnData;
import io.tablexform.core.model.ColumnType;
import io.tablexform.core.model.Condition;
import io.tablexform.core.model.ConditionOperator;
import io.tablexform.core.model.FilterRows;
import io.tablexform.core.model.GroupBy;
import io.tablexform.core.model.RenameColumn;
import io.tablexform.core.model.SampleRows;
import io.tablexform.core.model.SelectColumns;
import io.tablexform.core.model.ShuffleRows;
import io.tablexform.core.model.SortColumn;
import io.tablexform.core.model.TransformType;
import io.tablexform.core.spi.TableEngine;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SplittableRandom;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Columnar engine over typed {@link Series} with validity bitmaps and native
 * {@link BooleanMask}s.
 *
 * <p>
 * Native semantics this adapter reconciles with the shared behaviour:
 * <ul>
 * <li>only null slots are missing; a float {@code NaN} is a value, so {@code is_null} does not
 * match it and it forms its own group</li>
 * <li>comparisons propagate nulls through three-valued masks; the adapter fills each
 * condition's nulls with {@code false} before combining, so a null never satisfies a
 * condition under either keep or remove</li>
 * <li>grouping keeps null keys by default; the adapter drops them when asked to</li>
 * <li>shuffles and samples draw from {@link SplittableRandom}</li>
 * </ul>
 */
public final class ColumnarTableEngine implements TableEngine<ColumnarFrame> {

    /** Engine identifier used in configuration. */
    public static final String ENGINE_ID = "columnar";

    private static final Logger LOG = LoggerFactory.getLogger(ColumnarTableEngine.class);

    @Override
    public String id() {
        return ENGINE_ID;
    }

    @Override
    public ColumnarFrame load(List<ColumnData> columns) {
        int rows = columns.isEmpty() ? 0 : columns.get(0).size();
        List<Series> series = new ArrayList<>(columns.size());
        for (ColumnData column : columns) {
            series.add(Series.of(column.name(), column.type(), column.values()));
        }
        return new ColumnarFrame(series, rows);
    }

    @Override
    public ColumnarFrame convertColumn(ColumnarFrame table, ColumnConversion transform) {
        String operator = TransformType.COLUMN_CONVERSION.wireName();
        Series source = table.series(transform.column(), operator);
        ColumnType target = transform.targetType();
        List<Object> converted = new ArrayList<>(source.length());
        boolean leftUnconverted = false;
        for (int row = 0; row < source.length(); row++) {
            Object value = source.get(row);
            if (value == null) {
                converted.add(null);
                continue;
            }
            Optional<Object> result = ValueCoercion.convert(value, target);
            if (result.isPresent()) {
                converted.add(result.get());
            } else if (transform.errorPolicy() == ColumnConversion.ErrorPolicy.RAISE) {
                throw new ConversionException(
                        "Cannot convert value '" + value + "' in column '" + source.name() + "' (row " + row
                                + ") to " + target.wireName(),
                        source.name(),
                        operator,
                        row);
            } else if (transform.errorPolicy() == ColumnConversion.ErrorPolicy.COERCE) {
                converted.add(null);
            } else {
                converted.add(value);
                leftUnconverted = true;
            }
        }
        ColumnType resultType = leftUnconverted ? ColumnType.MIXED : target;
        if (leftUnconverted) {
            LOG.debug("Column {} left partially unconverted; type is now {}", source.name(), resultType);
        }
        Series replacement = Series.of(source.name(), resultType, converted);
        return replace(table, source.name(), replacement);
    }

    @Override
    public ColumnarFrame renameColumn(ColumnarFrame table, RenameColumn transform) {
        String operator = TransformType.RENAME_COLUMN.wireName();
        Series source = table.series(transform.column(), operator);
        if (source.name().equals(transform.newName())) {
            return table;
        }
        if (table.hasColumn(transform.newName())) {
            throw new DuplicateColumnException(
                    "Cannot rename column '" + source.name() + "' to '" + transform.newName()
                            + "': a column with that name already exists",
                    transform.newName(),
                    operator);
        }
        return replace(table, source.name(), source.rename(transform.newName()));
    }

    @Override
    public ColumnarFrame sortColumn(ColumnarFrame table, SortColumn transform) {
        String operator = TransformType.SORT_COLUMN.wireName();
        Series key = table.series(transform.column(), operator);
        if (!key.type().isOrderable()) {
            throw new UnsupportedOperatorException(
                    "Cannot sort column '" + key.name() + "' of type " + key.type().wireName(), key.name(), operator);
        }
        Comparator<Object> order = ValueOrdering.nullsAt(transform.nullPosition(), transform.ascending());
        Integer[] positions = new Integer[key.length()];
        for (int i = 0; i < positions.length; i++) {
            positions[i] = i;
        }
        Arrays.sort(positions, (a, b) -> order.compare(key.get(a), key.get(b)));
        return table.take(Arrays.stream(positions).mapToInt(Integer::intValue).toArray());
    }

    @Override
    public ColumnarFrame filterRows(ColumnarFrame table, FilterRows transform) {
        BooleanMask combined = null;
        for (Condition condition : transform.conditions()) {
            BooleanMask mask = mask(table, condition).fillNull(false);
            if (combined == null) {
                combined = mask;
            } else if (transform.operation() == FilterRows.Operation.KEEP) {
                combined = combined.and(mask);
            } else {
                combined = combined.or(mask);
            }
        }
        if (transform.operation() == FilterRows.Operation.REMOVE) {
            combined = combined.not();
        }
        return table.filter(combined);
    }

    @Override
    public ColumnarFrame groupBy(ColumnarFrame table, GroupBy transform) {
        String operator = TransformType.GROUP_BY.wireName();
        List<Series> keys = new ArrayList<>();
        for (String name : transform.groupColumns()) {
            Series key = table.series(name, operator);
            if (!key.type().isOrderable()) {
                throw new UnsupportedOperatorException(
                        "Cannot group by column '" + name + "' of type " + key.type().wireName(), name, operator);
            }
            keys.add(key);
        }

        Map<List<Object>, List<Integer>> groups = new LinkedHashMap<>();
        for (int row = 0; row < table.rowCount(); row++) {
            List<Object> key = new ArrayList<>(keys.size());
            boolean hasNull = false;
            for (Series series : keys) {
                Object value = series.get(row);
                hasNull |= value == null;
                key.add(ValueOrdering.groupKeyComponent(value));
            }
            if (hasNull && transform.dropNullGroups()) {
                continue;
            }
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(row);
        }
        List<List<Object>> ordered = new ArrayList<>(groups.keySet());
        ordered.sort(ValueOrdering.keyOrder());

        List<Series> output = new ArrayList<>();
        for (int k = 0; k < keys.size(); k++) {
            List<Object> values = new ArrayList<>(ordered.size());
            for (List<Object> key : ordered) {
                values.add(key.get(k));
            }
            output.add(Series.of(keys.get(k).name(), keys.get(k).type(), values));
        }
        Aggregation aggregation = transform.aggregation();
        for (Series column : table.series()) {
            if (transform.groupColumns().contains(column.name()) || !aggregation.appliesTo(column.type())) {
                continue;
            }
            List<Object> reduced = new ArrayList<>(ordered.size());
            for (List<Object> key : ordered) {
                reduced.add(Aggregations.reduce(aggregation, column.type(), validValues(column, groups.get(key))));
            }
            output.add(Series.of(column.name(), aggregation.resultType(column.type()), reduced));
        }
        return new ColumnarFrame(output, ordered.size());
    }

    @Override
    public ColumnarFrame aggregate(ColumnarFrame table, Aggregate transform) {
        String operator = TransformType.AGGREGATE.wireName();
        List<Series> output = new ArrayList<>();
        for (String name : transform.columns()) {
            Series column = table.series(name, operator);
            List<Object> values = validValues(column, null);
            for (Aggregation function : transform.functions()) {
                if (!function.appliesTo(column.type())) {
                    throw new UnsupportedOperatorException(
                            "Aggregation '" + function.wireName() + "' does not apply to column '" + name
                                    + "' of type " + column.type().wireName(),
                            name,
                            function.wireName());
                }
                Object value = Aggregations.reduce(function, column.type(), values);
                output.add(Series.of(
                        Aggregate.outputName(name, function),
                        function.resultType(column.type()),
                        Arrays.asList(value)));
            }
        }
        return new ColumnarFrame(output, 1);
    }

    @Override
    public ColumnarFrame selectColumns(ColumnarFrame table, SelectColumns transform) {
        String operator = TransformType.SELECT_COLUMNS.wireName();
        List<Series> selected = new ArrayList<>(transform.columns().size());
        for (String name : transform.columns()) {
            selected.add(table.series(name, operator));
        }
        return new ColumnarFrame(selected, table.rowCount());
    }

    @Override
    public ColumnarFrame shuffleRows(ColumnarFrame table, ShuffleRows transform) {
        SplittableRandom random = random(transform.seed());
        int[] positions = new int[table.rowCount()];
        for (int i = 0; i < positions.length; i++) {
            int j = random.nextInt(i + 1);
            positions[i] = positions[j];
            positions[j] = i;
        }
        return table.take(positions);
    }

    @Override
    public ColumnarFrame sampleRows(ColumnarFrame table, SampleRows transform) {
        int rows = table.rowCount();
        int count = transform.count();
        String operator = TransformType.SAMPLE_ROWS.wireName();
        if (transform.withReplacement()) {
            if (rows == 0 && count > 0) {
                throw new SampleSizeException("Cannot sample " + count + " rows from an empty table", null, operator);
            }
            if (count == 0) {
                return table.take(new int[0]);
            }
            SplittableRandom random = random(transform.seed());
            return table.take(random.ints(count, 0, rows).toArray());
        }
        if (count > rows) {
            throw new SampleSizeException(
                    "Cannot sample " + count + " rows without replacement from a table of " + rows + " rows",
                    null,
                    operator);
        }
        SplittableRandom random = random(transform.seed());
        int[] pool = new int[rows];
        for (int i = 0; i < rows; i++) {
            pool[i] = i;
        }
        for (int i = 0; i < count; i++) {
            int j = random.nextInt(i, rows);
            int tmp = pool[i];
            pool[i] = pool[j];
            pool[j] = tmp;
        }
        return table.take(Arrays.copyOf(pool, count));
    }

    private static BooleanMask mask(ColumnarFrame table, Condition condition) {
        Series series = table.series(condition.column(), condition.operator().wireName());
        CompiledCondition compiled = CompiledCondition.compile(condition, series.type());
        if (compiled.testsMissing()) {
            BooleanMask nulls = BooleanMask.isNull(series);
            return condition.operator() == ConditionOperator.IS_NULL ? nulls : nulls.not();
        }
        return BooleanMask.evaluate(series, row -> compiled.test(series.get(row)));
    }

    /** Non-null values of a series at the given rows, or at every row when {@code rows} is null. */
    private static List<Object> validValues(Series series, List<Integer> rows) {
        List<Object> values = new ArrayList<>();
        if (rows == null) {
            for (int row = 0; row < series.length(); row++) {
                if (series.isValid(row)) {
                    values.add(series.get(row));
                }
            }
        } else {
            for (int row : rows) {
                if (series.isValid(row)) {
                    values.add(series.get(row));
                }
            }
        }
        return values;
    }

    private static ColumnarFrame replace(ColumnarFrame table, String name, Series replacement) {
        List<Series> columns = new ArrayList<>(table.series().size());
        for (Series column : table.series()) {
            columns.add(column.name().equals(name) ? replacement : column);
        }
        return new ColumnarFrame(columns, table.rowCount());
    }

    private static SplittableRandom random(Long seed) {
        return seed != null ? new SplittableRandom(seed) : new SplittableRandom();
    }
}
