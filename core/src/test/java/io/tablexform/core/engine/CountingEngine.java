package io.tablexform.core.engine;

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
import io.tablexform.core.model.TransformType;
import io.tablexform.core.spi.TableEngine;
import java.util.ArrayList;
import java.util.List;

/** Delegating engine that records every transform it is asked to run. */
final class CountingEngine<T extends Table> implements TableEngine<T> {

    private final TableEngine<T> delegate;
    private final List<TransformType> calls = new ArrayList<>();

    CountingEngine(TableEngine<T> delegate) {
        this.delegate = delegate;
    }

    List<TransformType> calls() {
        return calls;
    }

    int count() {
        return calls.size();
    }

    void clear() {
        calls.clear();
    }

    @Override
    public String id() {
        return delegate.id();
    }

    @Override
    public T load(List<ColumnData> columns) {
        return delegate.load(columns);
    }

    @Override
    public T convertColumn(T table, ColumnConversion transform) {
        calls.add(transform.type());
        return delegate.convertColumn(table, transform);
    }

    @Override
    public T renameColumn(T table, RenameColumn transform) {
        calls.add(transform.type());
        return delegate.renameColumn(table, transform);
    }

    @Override
    public T sortColumn(T table, SortColumn transform) {
        calls.add(transform.type());
        return delegate.sortColumn(table, transform);
    }

    @Override
    public T filterRows(T table, FilterRows transform) {
        calls.add(transform.type());
        return delegate.filterRows(table, transform);
    }

    @Override
    public T groupBy(T table, GroupBy transform) {
        calls.add(transform.type());
        return delegate.groupBy(table, transform);
    }

    @Override
    public T aggregate(T table, Aggregate transform) {
        calls.add(transform.type());
        return delegate.aggregate(table, transform);
    }

    @Override
    public T selectColumns(T table, SelectColumns transform) {
        calls.add(transform.type());
        return delegate.selectColumns(table, transform);
    }

    @Override
    public T shuffleRows(T table, ShuffleRows transform) {
        calls.add(transform.type());
        return delegate.shuffleRows(table, transform);
    }

    @Override
    public T sampleRows(T table, SampleRows transform) {
        calls.add(transform.type());
        return delegate.sampleRows(table, transform);
    }
}
