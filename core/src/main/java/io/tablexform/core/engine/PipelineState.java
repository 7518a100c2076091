package io.tablexform.core.engine;

import io.tablexform.core.model.Table;
import io.tablexform.core.model.TransformSequence;
import java.util.Objects;

/**
 * Immutable snapshot of a {@link TransformPipeline}: the table it was opened with, the last
 * sequence applied successfully, and the table that sequence produced.
 *
 * @param original the table the pipeline was opened with; never replaced
 * @param applied  the last successfully applied sequence
 * @param snapshot result of applying {@code applied} to {@code original}
 * @param <T>      the engine's native frame type
 */
public record PipelineState<T extends Table>(T original, TransformSequence applied, T snapshot) {

    public PipelineState {
        Objects.requireNonNull(original, "original must not be null");
        Objects.requireNonNull(applied, "applied must not be null");
        Objects.requireNonNull(snapshot, "snapshot must not be null");
    }

    /** State of a freshly opened pipeline: nothing applied, snapshot is the original. */
    public static <T extends Table> PipelineState<T> initial(T original) {
        return new PipelineState<>(original, TransformSequence.empty(), original);
    }
}
