package io.tablexform.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.tablexform.core.config.PipelineConfig;
import io.tablexform.core.engine.columnar.ColumnarFrame;
import io.tablexform.core.engine.columnar.ColumnarTableEngine;
import io.tablexform.core.error.UnknownColumnException;
import io.tablexform.core.model.ColumnData;
import io.tablexform.core.model.ColumnType;
import io.tablexform.core.model.SelectColumns;
import io.tablexform.core.model.ShuffleRows;
import io.tablexform.core.model.TransformSequence;
import io.tablexform.core.spi.PipelineListener;
import io.tablexform.core.spi.PipelineListener.ApplyCompletedEvent;
import io.tablexform.core.spi.PipelineListener.ApplyFailedEvent;
import io.tablexform.core.spi.PipelineListener.ApplyStartedEvent;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Tests for the {@link PipelineListener} SPI as driven by {@link TransformPipeline}. */
@DisplayName("PipelineListenerTest")
class PipelineListenerTest {

    private CapturingListener listener;
    private TransformPipeline<ColumnarFrame> pipeline;

    @BeforeEach
    void setUp() {
        listener = new CapturingListener();
        ColumnarTableEngine engine = new ColumnarTableEngine();
        ColumnarFrame original = engine.load(List.of(
                ColumnData.of("id", ColumnType.INTEGER, 1, 2, 3), ColumnData.of("name", ColumnType.TEXT, "a", "b", "c")));
        pipeline = new TransformPipeline<>("events", engine, original, PipelineConfig.DEFAULT, listener);
    }

    @Test
    @DisplayName("successful apply emits started then completed with step counts")
    void completedEvents() {
        TransformSequence first = TransformSequence.of(ShuffleRows.seeded(1));
        pipeline.apply(first);
        pipeline.apply(first.append(SelectColumns.of("id")));

        assertThat(listener.started)
                .containsExactly(new ApplyStartedEvent("events", "columnar", 1), new ApplyStartedEvent("events", "columnar", 2));
        assertThat(listener.completed).hasSize(2);

        ApplyCompletedEvent replay = listener.completed.get(0);
        assertThat(replay.reusedSteps()).isZero();
        assertThat(replay.appliedSteps()).isEqualTo(1);
        assertThat(replay.sequenceLength()).isEqualTo(1);

        ApplyCompletedEvent incremental = listener.completed.get(1);
        assertThat(incremental.incremental()).isTrue();
        assertThat(incremental.reusedSteps()).isEqualTo(1);
        assertThat(incremental.appliedSteps()).isEqualTo(1);
        assertThat(incremental.durationMs()).isNotNegative();
    }

    @Test
    @DisplayName("unchanged sequence reports every step reused and none applied")
    void unchangedEvent() {
        TransformSequence sequence = TransformSequence.of(SelectColumns.of("name"));
        pipeline.apply(sequence);
        pipeline.apply(sequence);

        ApplyCompletedEvent unchanged = listener.completed.get(1);
        assertThat(unchanged.reusedSteps()).isEqualTo(1);
        assertThat(unchanged.appliedSteps()).isZero();
    }

    @Test
    @DisplayName("failed apply emits a failed event with step and error type")
    void failedEvent() {
        assertThatThrownBy(() -> pipeline.apply(TransformSequence.of(ShuffleRows.seeded(1), SelectColumns.of("ghost"))))
                .isInstanceOf(UnknownColumnException.class);

        assertThat(listener.completed).isEmpty();
        assertThat(listener.failed).hasSize(1);
        ApplyFailedEvent event = listener.failed.get(0);
        assertThat(event.pipelineId()).isEqualTo("events");
        assertThat(event.engineId()).isEqualTo("columnar");
        assertThat(event.step()).isEqualTo(1);
        assertThat(event.errorType()).isEqualTo("UnknownColumnException");
        assertThat(event.errorDetail()).contains("ghost").doesNotStartWith("step");
    }

    @Test
    @DisplayName("a throwing listener does not affect the apply")
    void throwingListenerIsIsolated() {
        ColumnarTableEngine engine = new ColumnarTableEngine();
        ColumnarFrame original = engine.load(List.of(ColumnData.of("id", ColumnType.INTEGER, 1, 2)));
        PipelineListener broken = new PipelineListener() {
            @Override
            public void onApplyStarted(ApplyStartedEvent event) {
                throw new IllegalStateException("listener failure");
            }

            @Override
            public void onApplyCompleted(ApplyCompletedEvent event) {
                throw new IllegalStateException("listener failure");
            }
        };
        TransformPipeline<ColumnarFrame> guarded =
                new TransformPipeline<>("guarded", engine, original, PipelineConfig.DEFAULT, broken);

        ColumnarFrame result = guarded.apply(TransformSequence.of(SelectColumns.of("id")));

        assertThat(result.column("id")).containsExactly(1L, 2L);
        assertThat(guarded.appliedSequence().size()).isEqualTo(1);
    }

    private static final class CapturingListener implements PipelineListener {

        final List<ApplyStartedEvent> started = new ArrayList<>();
        final List<ApplyCompletedEvent> completed = new ArrayList<>();
        final List<ApplyFailedEvent> failed = new ArrayList<>();

        @Override
        public void onApplyStarted(ApplyStartedEvent event) {
            started.add(event);
        }

        @Override
        public void onApplyCompleted(ApplyCompletedEvent event) {
            completed.add(event);
        }

        @Override
        public void onApplyFailed(ApplyFailedEvent event) {
            failed.add(event);
        }
    }
}
