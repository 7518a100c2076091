package io.tablexform.core.spi;

import io.tablexform.core.model.Aggregate;
import io.tablexform.core.model.ColumnConversion;
import io.tablexform.core.model.ColumnData;
import io.tablexform.core.model.FilterRows;
import io.tablexform.core.model.GroupBy;
import io.tablexform.core.model.RenameColumn;
import io.tablexform.core.model.SampleRows;
import io.tablexform.core.model.SelectColumns;
import io.tablexform.core.model.ShuffleRows;
import io.tablexform.core.model.SortColumn;
import io.tablexform.core.model.Table;
import java.util.List;

/**
 * Pluggable table-compute engine SPI. An implementation applies every transform kind against
 * one native frame type and resolves that engine's own semantics (missing-value sentinels,
 * grouping defaults, string matching) into the behaviour shared by all engines.
 *
 * <p>
 * Implementations MUST be stateless and MUST NOT mutate the frame they receive: every method
 * returns a new frame. Failures are reported as {@link io.tablexform.core.error.TransformApplyException}
 * subclasses and are never swallowed.
 *
 * @param <T> the engine's native frame type
 */
public interface TableEngine<T extends Table> {

    /**
     * Returns the engine identifier, e.g. {@code "labeled"}, {@code "columnar"}.
     *
     * @return a non-null, non-empty identifier (lowercase, no spaces)
     */
    String id();

    /**
     * Builds a native frame from engine-neutral columns.
     *
     * @throws IllegalArgumentException if column names repeat or lengths differ
     */
    T load(List<ColumnData> columns);

    T convertColumn(T table, ColumnConversion transform);

    T renameColumn(T table, RenameColumn transform);

    T sortColumn(T table, SortColumn transform);

    T filterRows(T table, FilterRows transform);

    T groupBy(T table, GroupBy transform);

    T aggregate(T table, Aggregate transform);

    T selectColumns(T table, SelectColumns transform);

    T shuffleRows(T table, ShuffleRows transform);

    T sampleRows(T table, SampleRows transform);
}
