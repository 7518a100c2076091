package io.tablexform.core.model;

/**
 * One declarative table operation with fixed parameters.
 *
 * <p>
 * The hierarchy is closed: each permitted record is an immutable value compared
 * structurally (kind plus every field). {@link io.tablexform.core.engine.TransformPipeline}
 * relies on that equality to decide whether a cached snapshot can be reused.
 */
public sealed interface Transform
        permits ColumnConversion,
                RenameColumn,
                SortColumn,
                FilterRows,
                GroupBy,
                Aggregate,
                SelectColumns,
                ShuffleRows,
                SampleRows {

    /** The kind of this transform. */
    TransformType type();
}
