package io.tablexform.core.spi;

/**
 * SPI for observability hooks on {@link io.tablexform.core.engine.TransformPipeline}.
 *
 * <p>
 * Hosts bridge these events to their metrics or tracing system. The core has no telemetry
 * dependency. Exceptions thrown by a listener are caught and logged by the pipeline; they never
 * affect the apply.
 */
public interface PipelineListener {

    /** Called before an apply starts. */
    default void onApplyStarted(ApplyStartedEvent event) {}

    /** Called after an apply succeeded and the new state was installed. */
    default void onApplyCompleted(ApplyCompletedEvent event) {}

    /** Called after an apply failed; the pipeline state is unchanged. */
    default void onApplyFailed(ApplyFailedEvent event) {}

    // --- Event records ---

    /** Event emitted when an apply starts. */
    record ApplyStartedEvent(String pipelineId, String engineId, int sequenceLength) {}

    /**
     * Event emitted when an apply completes.
     *
     * @param reusedSteps  number of leading transforms served from the cached snapshot
     * @param appliedSteps number of transforms actually executed by the engine
     * @param incremental  whether the cached snapshot was the starting point
     */
    record ApplyCompletedEvent(
            String pipelineId,
            String engineId,
            int sequenceLength,
            int reusedSteps,
            int appliedSteps,
            boolean incremental,
            long durationMs) {}

    /** Event emitted when an apply fails. {@code step} is {@code null} if no transform was at fault. */
    record ApplyFailedEvent(
            String pipelineId, String engineId, Integer step, String errorType, String errorDetail, long durationMs) {}
}
