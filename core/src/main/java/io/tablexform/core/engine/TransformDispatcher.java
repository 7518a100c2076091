package io.tablexform.core.engine;

import io.tablexform.core.error.TransformApplyException;
import io.tablexform.core.error.UnreachableVariantException;
import io.tablexform.core.model.Aggregate;
import io.tablexform.core.model.ColumnConversion;
import io.tablexform.core.model.FilterRows;
import io.tablexform.core.model.GroupBy;
import io.tablexform.core.model.RenameColumn;
import io.tablexform.core.model.SampleRows;
import io.tablexform.core.model.SelectColumns;
import io.tablexform.core.model.ShuffleRows;
import io.tablexform.core.model.SortColumn;
import io.tablexform.core.model.Table;
import io.tablexform.core.model.Transform;
import io.tablexform.core.model.TransformSequence;
import io.tablexform.core.model.TransformType;
import io.tablexform.core.spi.TableEngine;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routes transforms to the matching {@link TableEngine} method and folds sequences over a
 * table.
 *
 * <p>
 * Routing is an exhaustive {@code switch} over {@link TransformType}: adding a kind without a
 * route is a compile error. A transform whose record class does not match its declared kind is
 * a defect and fails with {@link UnreachableVariantException}.
 *
 * <p>
 * Stateless, thread-safe.
 */
public final class TransformDispatcher {

    private static final Logger LOG = LoggerFactory.getLogger(TransformDispatcher.class);

    /** Step duration above which a step is logged at WARN, when no threshold is given. */
    public static final long DEFAULT_SLOW_STEP_WARN_MS = 1000;

    private TransformDispatcher() {}

    /**
     * Applies a single transform.
     *
     * @throws TransformApplyException if the engine rejects the transform (no step index)
     */
    public static <T extends Table> T apply(TableEngine<T> engine, T table, Transform transform) {
        Objects.requireNonNull(transform, "transform must not be null");
        return route(engine, table, transform.type(), transform);
    }

    /** Applies a whole sequence, starting at step 0. */
    public static <T extends Table> T applyAll(TableEngine<T> engine, T table, TransformSequence sequence) {
        return applyAll(engine, table, sequence.transforms(), 0, DEFAULT_SLOW_STEP_WARN_MS);
    }

    /**
     * Applies {@code transforms} in order; the first element is step {@code firstIndex} of the
     * enclosing sequence.
     */
    public static <T extends Table> T applyAll(
            TableEngine<T> engine, T table, List<Transform> transforms, int firstIndex) {
        return applyAll(engine, table, transforms, firstIndex, DEFAULT_SLOW_STEP_WARN_MS);
    }

    /**
     * Applies {@code transforms} in order and stops at the first failure.
     *
     * @param engine         the engine executing every step
     * @param table          the input table; never mutated
     * @param transforms     the steps to run
     * @param firstIndex     absolute index of {@code transforms.get(0)} in the enclosing sequence
     * @param slowStepWarnMs steps taking longer than this are logged at WARN
     * @return the table produced by the last step, or {@code table} if there are no steps
     * @throws TransformApplyException of the original type, annotated with the absolute index of
     *                                 the failing step
     */
    public static <T extends Table> T applyAll(
            TableEngine<T> engine, T table, List<Transform> transforms, int firstIndex, long slowStepWarnMs) {
        Objects.requireNonNull(engine, "engine must not be null");
        Objects.requireNonNull(table, "table must not be null");
        Objects.requireNonNull(transforms, "transforms must not be null");
        T current = table;
        for (int i = 0; i < transforms.size(); i++) {
            int step = firstIndex + i;
            Transform transform = transforms.get(i);
            long start = System.nanoTime();
            try {
                current = route(engine, current, transform.type(), transform);
            } catch (TransformApplyException e) {
                throw e.atStep(step);
            }
            long durationMs = (System.nanoTime() - start) / 1_000_000;
            if (durationMs > slowStepWarnMs) {
                LOG.warn(
                        "transform.slow_step engine={} step={} type={} duration_ms={} threshold_ms={}",
                        engine.id(),
                        step,
                        transform.type().wireName(),
                        durationMs,
                        slowStepWarnMs);
            } else {
                LOG.debug(
                        "transform.step engine={} step={} type={} rows={} columns={} duration_ms={}",
                        engine.id(),
                        step,
                        transform.type().wireName(),
                        current.rowCount(),
                        current.columnCount(),
                        durationMs);
            }
        }
        return current;
    }

    /** Routes {@code transform} as if it were of kind {@code type}. */
    static <T extends Table> T route(TableEngine<T> engine, T table, TransformType type, Transform transform) {
        if (type == null) {
            throw unreachable("Transform " + describe(transform) + " declares no type", null);
        }
        return switch (type) {
            case COLUMN_CONVERSION -> engine.convertColumn(table, expect(ColumnConversion.class, type, transform));
            case RENAME_COLUMN -> engine.renameColumn(table, expect(RenameColumn.class, type, transform));
            case SORT_COLUMN -> engine.sortColumn(table, expect(SortColumn.class, type, transform));
            case FILTER_ROWS -> engine.filterRows(table, expect(FilterRows.class, type, transform));
            case GROUP_BY -> engine.groupBy(table, expect(GroupBy.class, type, transform));
            case AGGREGATE -> engine.aggregate(table, expect(Aggregate.class, type, transform));
            case SELECT_COLUMNS -> engine.selectColumns(table, expect(SelectColumns.class, type, transform));
            case SHUFFLE_ROWS -> engine.shuffleRows(table, expect(ShuffleRows.class, type, transform));
            case SAMPLE_ROWS -> engine.sampleRows(table, expect(SampleRows.class, type, transform));
        };
    }

    private static <R extends Transform> R expect(Class<R> modelClass, TransformType type, Transform transform) {
        if (!modelClass.isInstance(transform)) {
            throw unreachable(
                    "Transform " + describe(transform) + " does not match declared type '" + type.wireName()
                            + "' (expected " + modelClass.getSimpleName() + ")",
                    type.wireName());
        }
        return modelClass.cast(transform);
    }

    private static UnreachableVariantException unreachable(String message, String operator) {
        LOG.error("transform.unreachable_variant {}", message);
        return new UnreachableVariantException(message, null, operator);
    }

    private static String describe(Transform transform) {
        return transform == null ? "null" : transform.getClass().getSimpleName();
    }
}
