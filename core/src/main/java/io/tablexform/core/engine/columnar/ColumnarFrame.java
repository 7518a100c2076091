package io.tablexform.core.engine.columnar;

import io.tablexform.core.error.UnknownColumnException;
import io.tablexform.core.model.ColumnType;
import io.tablexform.core.model.Table;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Native frame of the {@code columnar} engine: an ordered list of equally long {@link Series}.
 * There are no row labels; a row is its position.
 *
 * <p>
 * Null and {@code NaN} are distinct: a null slot reads as {@code null}, a {@code NaN} reads as
 * {@link Double#NaN}.
 *
 * <p>
 * Immutable.
 */
public final class ColumnarFrame implements Table {

    private final List<Series> series;
    private final Map<String, Series> byName;
    private final int rowCount;

    ColumnarFrame(List<Series> series, int rowCount) {
        Map<String, Series> index = new LinkedHashMap<>();
        for (Series column : series) {
            if (column.length() != rowCount) {
                throw new IllegalArgumentException("Column '" + column.name() + "' has " + column.length()
                        + " values, expected " + rowCount);
            }
            if (index.putIfAbsent(column.name(), column) != null) {
                throw new IllegalArgumentException("Duplicate column name: '" + column.name() + "'");
            }
        }
        this.series = Collections.unmodifiableList(new ArrayList<>(series));
        this.byName = index;
        this.rowCount = rowCount;
    }

    /** The columns, in display order. */
    public List<Series> series() {
        return series;
    }

    @Override
    public List<String> columnNames() {
        return List.copyOf(byName.keySet());
    }

    @Override
    public boolean hasColumn(String column) {
        return byName.containsKey(column);
    }

    @Override
    public ColumnType columnType(String column) {
        return series(column, null).type();
    }

    @Override
    public int rowCount() {
        return rowCount;
    }

    @Override
    public Object value(int row, String column) {
        return series(column, null).get(row);
    }

    Series series(String column, String operator) {
        Series found = byName.get(column);
        if (found == null) {
            throw new UnknownColumnException(
                    "Column '" + column + "' not found; available columns: " + byName.keySet(), column, operator);
        }
        return found;
    }

    ColumnarFrame take(int[] positions) {
        List<Series> taken = new ArrayList<>(series.size());
        for (Series column : series) {
            taken.add(column.take(positions));
        }
        return new ColumnarFrame(taken, positions.length);
    }

    ColumnarFrame filter(BooleanMask mask) {
        return take(mask.fillNull(false).selected());
    }
}
