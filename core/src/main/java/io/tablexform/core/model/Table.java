package io.tablexform.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Engine-agnostic read view of a table. Every engine's native frame implements this interface,
 * so callers never inspect engine-specific storage.
 *
 * <p>
 * Values are returned as {@link Long}, {@link Double}, {@link Boolean} or {@link String}. A
 * missing value reads as {@code null}.
 */
public interface Table {

    /** Column names in display order. */
    List<String> columnNames();

    /**
     * Element type of the named column.
     *
     * @throws io.tablexform.core.error.UnknownColumnException if the column does not exist
     */
    ColumnType columnType(String column);

    int rowCount();

    /**
     * Value at the given row of the named column.
     *
     * @throws io.tablexform.core.error.UnknownColumnException if the column does not exist
     * @throws IndexOutOfBoundsException if the row is out of range
     */
    Object value(int row, String column);

    default boolean hasColumn(String column) {
        return columnNames().contains(column);
    }

    default int columnCount() {
        return columnNames().size();
    }

    /** All values of one column, top to bottom. */
    default List<Object> column(String column) {
        List<Object> values = new ArrayList<>(rowCount());
        for (int row = 0; row < rowCount(); row++) {
            values.add(value(row, column));
        }
        return values;
    }

    /** All values of one row, in column order. */
    default List<Object> row(int row) {
        List<Object> values = new ArrayList<>(columnCount());
        for (String column : columnNames()) {
            values.add(value(row, column));
        }
        return values;
    }

    /** Every row, top to bottom. */
    default List<List<Object>> rows() {
        List<List<Object>> rows = new ArrayList<>(rowCount());
        for (int row = 0; row < rowCount(); row++) {
            rows.add(row(row));
        }
        return rows;
    }
}
