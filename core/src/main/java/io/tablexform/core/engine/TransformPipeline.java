package io.tablexform.core.engine;

import io.tablexform.core.config.PipelineConfig;
import io.tablexform.core.error.TransformApplyException;
import io.tablexform.core.error.TransformException;
import io.tablexform.core.model.Table;
import io.tablexform.core.model.TransformSequence;
import io.tablexform.core.spi.PipelineListener;
import io.tablexform.core.spi.TableEngine;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Incremental pipeline over one original table and one engine.
 *
 * <p>
 * Each call to {@link #apply} submits a complete sequence. When the last applied sequence is a
 * prefix of the new one, only the new tail runs, starting from the cached snapshot. Any other
 * sequence is replayed from the original table. Submitting the current sequence again returns
 * the snapshot without calling the engine.
 *
 * <p>
 * The state is an immutable {@link PipelineState} held in an {@link AtomicReference}: a failed
 * apply never installs a partial result, and readers always see a consistent snapshot. Calls to
 * {@link #apply} on one instance are serialized.
 *
 * @param <T> the engine's native frame type
 */
public final class TransformPipeline<T extends Table> {

    private static final Logger LOG = LoggerFactory.getLogger(TransformPipeline.class);

    /** MDC key carrying the pipeline id for the duration of an apply. */
    static final String MDC_PIPELINE_ID = "pipelineId";

    private final String id;
    private final TableEngine<T> engine;
    private final PipelineConfig config;
    private final PipelineListener listener;
    private final AtomicReference<PipelineState<T>> stateRef;

    public TransformPipeline(String id, TableEngine<T> engine, T original) {
        this(id, engine, original, PipelineConfig.DEFAULT, null);
    }

    /**
     * Creates a pipeline.
     *
     * @param id       identifier used in logs and listener events
     * @param engine   the engine executing every transform
     * @param original the table every replay starts from
     * @param config   pipeline settings
     * @param listener observability hook, or {@code null}
     */
    public TransformPipeline(
            String id, TableEngine<T> engine, T original, PipelineConfig config, PipelineListener listener) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.listener = listener;
        this.stateRef = new AtomicReference<>(PipelineState.initial(original));
    }

    /**
     * Produces the table for {@code sequence} applied to the original table.
     *
     * @return the resulting table, which also becomes the new snapshot
     * @throws TransformApplyException annotated with the failing step; the state is unchanged
     */
    public synchronized T apply(TransformSequence sequence) {
        Objects.requireNonNull(sequence, "sequence must not be null");
        PipelineState<T> state = stateRef.get();
        long start = System.currentTimeMillis();
        MDC.put(MDC_PIPELINE_ID, id);
        try {
            notifyStarted(sequence);

            if (config.incremental() && sequence.equals(state.applied())) {
                LOG.debug("pipeline.apply pipeline_id={} mode=unchanged sequence_length={}", id, sequence.size());
                notifyCompleted(sequence, sequence.size(), 0, true, System.currentTimeMillis() - start);
                return state.snapshot();
            }

            boolean incremental = config.incremental() && state.applied().isPrefixOf(sequence);
            int reused = incremental ? state.applied().size() : 0;
            T base = incremental ? state.snapshot() : state.original();

            T result;
            try {
                result = TransformDispatcher.applyAll(
                        engine, base, sequence.suffixAfter(reused), reused, config.slowStepWarnMs());
            } catch (RuntimeException e) {
                long durationMs = System.currentTimeMillis() - start;
                Integer step = e instanceof TransformApplyException tae ? tae.step() : null;
                String detail = e instanceof TransformException te ? te.detail() : e.getMessage();
                LOG.warn(
                        "pipeline.apply_failed pipeline_id={} engine={} step={} error_type={} detail={}",
                        id,
                        engine.id(),
                        step,
                        e.getClass().getSimpleName(),
                        detail);
                notifyFailed(step, e.getClass().getSimpleName(), detail, durationMs);
                throw e;
            }

            stateRef.set(new PipelineState<>(state.original(), sequence, result));
            long durationMs = System.currentTimeMillis() - start;
            LOG.info(
                    "pipeline.apply pipeline_id={} engine={} mode={} sequence_length={} reused_steps={} "
                            + "applied_steps={} duration_ms={}",
                    id,
                    engine.id(),
                    incremental ? "incremental" : "replay",
                    sequence.size(),
                    reused,
                    sequence.size() - reused,
                    durationMs);
            notifyCompleted(sequence, reused, sequence.size() - reused, incremental, durationMs);
            return result;
        } finally {
            MDC.remove(MDC_PIPELINE_ID);
        }
    }

    /** Clears the applied sequence; equivalent to applying the empty sequence. */
    public T reset() {
        return apply(TransformSequence.empty());
    }

    public String id() {
        return id;
    }

    public TableEngine<T> engine() {
        return engine;
    }

    public PipelineConfig config() {
        return config;
    }

    /** The table the pipeline was opened with. */
    public T original() {
        return stateRef.get().original();
    }

    /** The last sequence applied successfully. */
    public TransformSequence appliedSequence() {
        return stateRef.get().applied();
    }

    /** The table produced by {@link #appliedSequence()}. */
    public T snapshot() {
        return stateRef.get().snapshot();
    }

    /** The current state, read atomically. */
    public PipelineState<T> state() {
        return stateRef.get();
    }

    // Listener exceptions are caught and logged; they never affect the apply.

    private void notifyStarted(TransformSequence sequence) {
        if (listener == null) return;
        try {
            listener.onApplyStarted(new PipelineListener.ApplyStartedEvent(id, engine.id(), sequence.size()));
        } catch (Exception e) {
            LOG.warn("PipelineListener.onApplyStarted failed", e);
        }
    }

    private void notifyCompleted(
            TransformSequence sequence, int reused, int applied, boolean incremental, long durationMs) {
        if (listener == null) return;
        try {
            listener.onApplyCompleted(new PipelineListener.ApplyCompletedEvent(
                    id, engine.id(), sequence.size(), reused, applied, incremental, durationMs));
        } catch (Exception e) {
            LOG.warn("PipelineListener.onApplyCompleted failed", e);
        }
    }

    private void notifyFailed(Integer step, String errorType, String detail, long durationMs) {
        if (listener == null) return;
        try {
            listener.onApplyFailed(
                    new PipelineListener.ApplyFailedEvent(id, engine.id(), step, errorType, detail, durationMs));
        } catch (Exception e) {
            LOG.warn("PipelineListener.onApplyFailed failed", e);
        }
    }
}
