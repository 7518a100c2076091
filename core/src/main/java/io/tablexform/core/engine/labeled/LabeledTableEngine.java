package io.tablexform.core.engine.labeled;

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
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Row-label aware, eager engine. Every transform materializes a new {@link LabeledFrame}.
 *
 * <p>
 * Native semantics this adapter reconciles with the shared behaviour:
 * <ul>
 * <li>{@code null} and float {@code NaN} are one and the same missing value, so
 * {@code is_null} matches both and they fall into a single group</li>
 * <li>a raw comparison against a missing cell yields {@code false} for every operator except
 * inequality; the adapter masks missing cells out so that {@code ne} never matches them
 * either</li>
 * <li>grouping drops missing keys by default; the adapter keeps them when asked to</li>
 * <li>shuffles and samples draw from {@link Random}</li>
 * </ul>
 */
public final class LabeledTableEngine implements TableEngine<LabeledFrame> {

    /** Engine identifier used in configuration. */
    public static final String ENGINE_ID = "labeled";

    private static final Logger LOG = LoggerFactory.getLogger(LabeledTableEngine.class);

    @Override
    public String id() {
        return ENGINE_ID;
    }

    @Override
    public LabeledFrame load(List<ColumnData> columns) {
        int rows = columns.isEmpty() ? 0 : columns.get(0).size();
        List<Object> labels = new ArrayList<>(rows);
        for (long i = 0; i < rows; i++) {
            labels.add(i);
        }
        LabeledFrame.Builder builder = LabeledFrame.builder(labels);
        for (ColumnData column : columns) {
            Object[] cells = column.values().toArray();
            for (int i = 0; i < cells.length; i++) {
                if (cells[i] == null) {
                    cells[i] = LabeledFrame.missing(column.type());
                }
            }
            builder.column(column.name(), column.type(), cells);
        }
        return builder.build();
    }

    @Override
    public LabeledFrame convertColumn(LabeledFrame table, ColumnConversion transform) {
        String column = transform.column();
        String operator = TransformType.COLUMN_CONVERSION.wireName();
        Object[] source = table.cells(column, operator);
        ColumnType target = transform.targetType();
        Object[] converted = new Object[source.length];
        boolean leftUnconverted = false;
        for (int row = 0; row < source.length; row++) {
            Object cell = source[row];
            if (LabeledFrame.isMissing(cell)) {
                converted[row] = LabeledFrame.missing(target);
                continue;
            }
            Optional<Object> result = ValueCoercion.convert(cell, target);
            if (result.isPresent()) {
                converted[row] = result.get();
                continue;
            }
            switch (transform.errorPolicy()) {
                case RAISE -> throw new ConversionException(
                        "Cannot convert value '" + cell + "' in column '" + column + "' (row " + row + ") to "
                                + target.wireName(),
                        column,
                        operator,
                        row);
                case COERCE -> converted[row] = LabeledFrame.missing(target);
                case IGNORE -> {
                    converted[row] = cell;
                    leftUnconverted = true;
                }
            }
        }
        ColumnType resultType = leftUnconverted ? ColumnType.MIXED : target;
        if (leftUnconverted) {
            LOG.debug("Column {} left partially unconverted; type is now {}", column, resultType);
        }
        return replaceColumn(table, column, column, resultType, converted);
    }

    @Override
    public LabeledFrame renameColumn(LabeledFrame table, RenameColumn transform) {
        String operator = TransformType.RENAME_COLUMN.wireName();
        Object[] cells = table.cells(transform.column(), operator);
        if (transform.column().equals(transform.newName())) {
            return table;
        }
        if (table.hasColumn(transform.newName())) {
            throw new DuplicateColumnException(
                    "Cannot rename column '" + transform.column() + "' to '" + transform.newName()
                            + "': a column with that name already exists",
                    transform.newName(),
                    operator);
        }
        return replaceColumn(
                table, transform.column(), transform.newName(), table.columnType(transform.column()), cells.clone());
    }

    @Override
    public LabeledFrame sortColumn(LabeledFrame table, SortColumn transform) {
        String operator = TransformType.SORT_COLUMN.wireName();
        ColumnType type = table.requireType(transform.column(), operator);
        if (!type.isOrderable()) {
            throw new UnsupportedOperatorException(
                    "Cannot sort column '" + transform.column() + "' of type " + type.wireName(),
                    transform.column(),
                    operator);
        }
        Object[] cells = table.cells(transform.column(), operator);
        Comparator<Object> order = ValueOrdering.nullsAt(transform.nullPosition(), transform.ascending());
        Integer[] positions = new Integer[cells.length];
        for (int i = 0; i < positions.length; i++) {
            positions[i] = i;
        }
        // Arrays.sort on objects is stable, so equal keys keep their current order.
        Arrays.sort(positions, (a, b) -> order.compare(present(cells[a]), present(cells[b])));
        return table.take(Arrays.stream(positions).mapToInt(Integer::intValue).toArray());
    }

    @Override
    public LabeledFrame filterRows(LabeledFrame table, FilterRows transform) {
        LabeledFrame current = table;
        for (Condition condition : transform.conditions()) {
            boolean[] mask = mask(current, condition);
            boolean keepMatching = transform.operation() == FilterRows.Operation.KEEP;
            int[] retained = new int[mask.length];
            int count = 0;
            for (int row = 0; row < mask.length; row++) {
                if (mask[row] == keepMatching) {
                    retained[count++] = row;
                }
            }
            current = current.take(Arrays.copyOf(retained, count));
        }
        return current;
    }

    @Override
    public LabeledFrame groupBy(LabeledFrame table, GroupBy transform) {
        String operator = TransformType.GROUP_BY.wireName();
        List<String> keys = transform.groupColumns();
        List<Object[]> keyCells = new ArrayList<>(keys.size());
        for (String key : keys) {
            ColumnType type = table.requireType(key, operator);
            if (!type.isOrderable()) {
                throw new UnsupportedOperatorException(
                        "Cannot group by column '" + key + "' of type " + type.wireName(), key, operator);
            }
            keyCells.add(table.cells(key, operator));
        }

        Map<List<Object>, List<Integer>> groups = new LinkedHashMap<>();
        for (int row = 0; row < table.rowCount(); row++) {
            List<Object> key = new ArrayList<>(keys.size());
            boolean hasMissing = false;
            for (Object[] cells : keyCells) {
                Object cell = present(cells[row]);
                hasMissing |= cell == null;
                key.add(ValueOrdering.groupKeyComponent(cell));
            }
            if (hasMissing && transform.dropNullGroups()) {
                continue;
            }
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(row);
        }
        List<List<Object>> ordered = new ArrayList<>(groups.keySet());
        ordered.sort(ValueOrdering.keyOrder());

        List<Object> labels = new ArrayList<>(ordered.size());
        for (List<Object> key : ordered) {
            labels.add(Collections.unmodifiableList(key));
        }
        LabeledFrame.Builder builder = LabeledFrame.builder(labels);
        for (int k = 0; k < keys.size(); k++) {
            ColumnType type = table.columnType(keys.get(k));
            Object[] values = new Object[ordered.size()];
            for (int g = 0; g < ordered.size(); g++) {
                Object value = ordered.get(g).get(k);
                values[g] = value == null ? LabeledFrame.missing(type) : value;
            }
            builder.column(keys.get(k), type, values);
        }
        Aggregation aggregation = transform.aggregation();
        for (String column : table.columnNames()) {
            ColumnType type = table.columnType(column);
            if (keys.contains(column) || !aggregation.appliesTo(type)) {
                continue;
            }
            Object[] cells = table.cells(column, operator);
            ColumnType resultType = aggregation.resultType(type);
            Object[] reduced = new Object[ordered.size()];
            for (int g = 0; g < ordered.size(); g++) {
                List<Object> present = new ArrayList<>();
                for (int row : groups.get(ordered.get(g))) {
                    if (!LabeledFrame.isMissing(cells[row])) {
                        present.add(cells[row]);
                    }
                }
                Object value = Aggregations.reduce(aggregation, type, present);
                reduced[g] = value == null ? LabeledFrame.missing(resultType) : value;
            }
            builder.column(column, resultType, reduced);
        }
        return builder.build();
    }

    @Override
    public LabeledFrame aggregate(LabeledFrame table, Aggregate transform) {
        String operator = TransformType.AGGREGATE.wireName();
        LabeledFrame.Builder builder = LabeledFrame.builder(List.of(0L));
        for (String column : transform.columns()) {
            ColumnType type = table.requireType(column, operator);
            Object[] cells = table.cells(column, operator);
            List<Object> present = new ArrayList<>();
            for (Object cell : cells) {
                if (!LabeledFrame.isMissing(cell)) {
                    present.add(cell);
                }
            }
            for (Aggregation function : transform.functions()) {
                if (!function.appliesTo(type)) {
                    throw new UnsupportedOperatorException(
                            "Aggregation '" + function.wireName() + "' does not apply to column '" + column
                                    + "' of type " + type.wireName(),
                            column,
                            function.wireName());
                }
                ColumnType resultType = function.resultType(type);
                Object value = Aggregations.reduce(function, type, present);
                builder.column(
                        Aggregate.outputName(column, function),
                        resultType,
                        new Object[] {value == null ? LabeledFrame.missing(resultType) : value});
            }
        }
        return builder.build();
    }

    @Override
    public LabeledFrame selectColumns(LabeledFrame table, SelectColumns transform) {
        String operator = TransformType.SELECT_COLUMNS.wireName();
        LabeledFrame.Builder builder = LabeledFrame.builder(table.rowLabels());
        for (String column : transform.columns()) {
            builder.column(column, table.requireType(column, operator), table.cells(column, operator));
        }
        return builder.build();
    }

    @Override
    public LabeledFrame shuffleRows(LabeledFrame table, ShuffleRows transform) {
        Random random = random(transform.seed());
        int[] positions = identity(table.rowCount());
        for (int i = positions.length - 1; i > 0; i--) {
            swap(positions, i, random.nextInt(i + 1));
        }
        return table.take(positions);
    }

    @Override
    public LabeledFrame sampleRows(LabeledFrame table, SampleRows transform) {
        int rows = table.rowCount();
        int count = transform.count();
        if (!transform.withReplacement() && count > rows) {
            throw new SampleSizeException(
                    "Cannot sample " + count + " rows without replacement from a table of " + rows + " rows",
                    null,
                    TransformType.SAMPLE_ROWS.wireName());
        }
        if (transform.withReplacement() && rows == 0 && count > 0) {
            throw new SampleSizeException(
                    "Cannot sample " + count + " rows from an empty table", null, TransformType.SAMPLE_ROWS.wireName());
        }
        Random random = random(transform.seed());
        int[] picked = new int[count];
        if (transform.withReplacement()) {
            for (int i = 0; i < count; i++) {
                picked[i] = random.nextInt(rows);
            }
        } else {
            int[] positions = identity(rows);
            for (int i = 0; i < count; i++) {
                swap(positions, i, i + random.nextInt(rows - i));
                picked[i] = positions[i];
            }
        }
        return table.take(picked);
    }

    private static boolean[] mask(LabeledFrame table, Condition condition) {
        String column = condition.column();
        ColumnType type = table.requireType(column, condition.operator().wireName());
        CompiledCondition compiled = CompiledCondition.compile(condition, type);
        Object[] cells = table.cells(column, condition.operator().wireName());
        boolean[] mask = new boolean[cells.length];
        for (int row = 0; row < cells.length; row++) {
            Object cell = cells[row];
            mask[row] = LabeledFrame.isMissing(cell) ? compiled.matchesMissing() : compiled.test(cell);
        }
        return mask;
    }

    private static LabeledFrame replaceColumn(
            LabeledFrame table, String column, String newName, ColumnType type, Object[] values) {
        LabeledFrame.Builder builder = LabeledFrame.builder(table.rowLabels());
        for (String existing : table.columnNames()) {
            if (existing.equals(column)) {
                builder.column(newName, type, values);
            } else {
                builder.column(existing, table.columnType(existing), table.cells(existing, null));
            }
        }
        return builder.build();
    }

    private static Object present(Object cell) {
        return LabeledFrame.isMissing(cell) ? null : cell;
    }

    private static Random random(Long seed) {
        return seed != null ? new Random(seed) : new Random();
    }

    private static int[] identity(int n) {
        int[] positions = new int[n];
        for (int i = 0; i < n; i++) {
            positions[i] = i;
        }
        return positions;
    }

    private static void swap(int[] values, int i, int j) {
        int tmp = values[i];
        values[i] = values[j];
        values[j] = tmp;
    }
}
