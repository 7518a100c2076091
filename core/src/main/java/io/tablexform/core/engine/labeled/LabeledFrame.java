package io.tablexform.core.engine.labeled;

import io.tablexform.core.error.UnknownColumnException;
import io.tablexform.core.model.ColumnType;
import io.tablexform.core.model.Table;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Native frame of the {@code labeled} engine: named cell arrays plus one label per row.
 *
 * <p>
 * Row labels identify a row independently of its position. They start as the row positions of
 * the loaded table and travel with their rows through filters, sorts and samples; a group-by
 * relabels each output row with its group key.
 *
 * <p>
 * Missing values are stored as {@code null}, except in float columns where the sentinel is
 * {@link Double#NaN}. The engine does not distinguish the two: a {@code NaN} anywhere is
 * missing, and reads as {@code null} through the {@link Table} view.
 *
 * <p>
 * Immutable once built.
 */
public final class LabeledFrame implements Table {

    private final List<String> columns;
    private final Map<String, ColumnType> types;
    private final Map<String, Object[]> cells;
    private final List<Object> labels;

    private LabeledFrame(
            List<String> columns, Map<String, ColumnType> types, Map<String, Object[]> cells, List<Object> labels) {
        this.columns = Collections.unmodifiableList(columns);
        this.types = types;
        this.cells = cells;
        this.labels = Collections.unmodifiableList(labels);
    }

    static Builder builder(List<Object> labels) {
        return new Builder(labels);
    }

    /** Labels of the rows, top to bottom. */
    public List<Object> rowLabels() {
        return labels;
    }

    @Override
    public List<String> columnNames() {
        return columns;
    }

    @Override
    public boolean hasColumn(String column) {
        return types.containsKey(column);
    }

    @Override
    public ColumnType columnType(String column) {
        return requireType(column, null);
    }

    @Override
    public int rowCount() {
        return labels.size();
    }

    @Override
    public Object value(int row, String column) {
        Object cell = cells(column, null)[row];
        return isMissing(cell) ? null : cell;
    }

    /** {@code true} for this engine's missing sentinels: {@code null} and float {@code NaN}. */
    static boolean isMissing(Object cell) {
        return cell == null || (cell instanceof Double d && d.isNaN());
    }

    /** Missing sentinel for a column of the given type. */
    static Object missing(ColumnType type) {
        return type == ColumnType.FLOAT ? Double.NaN : null;
    }

    ColumnType requireType(String column, String operator) {
        ColumnType type = types.get(column);
        if (type == null) {
            throw unknownColumn(column, operator);
        }
        return type;
    }

    Object[] cells(String column, String operator) {
        Object[] values = cells.get(column);
        if (values == null) {
            throw unknownColumn(column, operator);
        }
        return values;
    }

    /** New frame holding the given rows, in the given order; positions may repeat. */
    LabeledFrame take(int[] rows) {
        List<Object> taken = new ArrayList<>(rows.length);
        for (int row : rows) {
            taken.add(labels.get(row));
        }
        Builder builder = builder(taken);
        for (String column : columns) {
            Object[] source = cells.get(column);
            Object[] target = new Object[rows.length];
            for (int i = 0; i < rows.length; i++) {
                target[i] = source[rows[i]];
            }
            builder.column(column, types.get(column), target);
        }
        return builder.build();
    }

    private UnknownColumnException unknownColumn(String column, String operator) {
        return new UnknownColumnException(
                "Column '" + column + "' not found; available columns: " + columns, column, operator);
    }

    /** Assembles a frame column by column. Cell arrays are owned by the frame once added. */
    static final class Builder {

        private final List<Object> labels;
        private final List<String> columns = new ArrayList<>();
        private final Map<String, ColumnType> types = new LinkedHashMap<>();
        private final Map<String, Object[]> cells = new LinkedHashMap<>();

        private Builder(List<Object> labels) {
            this.labels = new ArrayList<>(labels);
        }

        Builder column(String name, ColumnType type, Object[] values) {
            if (values.length != labels.size()) {
                throw new IllegalArgumentException("Column '" + name + "' has " + values.length + " values, expected "
                        + labels.size());
            }
            if (types.putIfAbsent(name, type) != null) {
                throw new IllegalArgumentException("Duplicate column name: '" + name + "'");
            }
            columns.add(name);
            cells.put(name, values);
            return this;
        }

        LabeledFrame build() {
            return new LabeledFrame(columns, types, cells, labels);
        }
    }
}
