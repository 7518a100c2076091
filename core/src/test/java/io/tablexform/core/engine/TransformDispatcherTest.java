package io.tablexform.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.tablexform.core.engine.columnar.ColumnarFrame;
import io.tablexform.core.engine.columnar.ColumnarTableEngine;
import io.tablexform.core.error.TransformApplyException;
import io.tablexform.core.error.UnknownColumnException;
import io.tablexform.core.error.UnreachableVariantException;
import io.tablexform.core.model.ColumnData;
import io.tablexform.core.model.ColumnType;
import io.tablexform.core.model.RenameColumn;
import io.tablexform.core.model.SelectColumns;
import io.tablexform.core.model.SortColumn;
import io.tablexform.core.model.SortColumn.NullPosition;
import io.tablexform.core.model.Transform;
import io.tablexform.core.model.TransformSequence;
import io.tablexform.core.model.TransformType;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

/** Tests for {@link TransformDispatcher}: routing, step annotation and unreachable variants. */
@DisplayName("TransformDispatcherTest")
class TransformDispatcherTest {

    private CountingEngine<ColumnarFrame> engine;
    private ColumnarFrame table;
    private ListAppender<ILoggingEvent> logAppender;
    private Logger dispatcherLogger;

    @BeforeEach
    void setUp() {
        engine = new CountingEngine<>(new ColumnarTableEngine());
        table = engine.load(List.of(
                ColumnData.of("id", ColumnType.INTEGER, 3, 1, 2), ColumnData.of("name", ColumnType.TEXT, "c", "a", "b")));

        dispatcherLogger = (Logger) LoggerFactory.getLogger(TransformDispatcher.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        dispatcherLogger.addAppender(logAppender);
    }

    @AfterEach
    void tearDown() {
        dispatcherLogger.detachAppender(logAppender);
        logAppender.stop();
    }

    @Nested
    @DisplayName("Routing")
    class Routing {

        @Test
        @DisplayName("every transform reaches the engine method of its kind")
        void routesByKind() {
            ColumnarFrame result = TransformDispatcher.applyAll(
                    engine,
                    table,
                    TransformSequence.of(
                            new SortColumn("id", true, NullPosition.LAST),
                            new RenameColumn("name", "label"),
                            SelectColumns.of("label")));

            assertThat(engine.calls())
                    .containsExactly(TransformType.SORT_COLUMN, TransformType.RENAME_COLUMN, TransformType.SELECT_COLUMNS);
            assertThat(result.columnNames()).containsExactly("label");
            assertThat(result.column("label")).containsExactly("a", "b", "c");
        }

        @Test
        @DisplayName("empty sequence returns the input table unchanged")
        void emptySequence() {
            assertThat(TransformDispatcher.applyAll(engine, table, TransformSequence.empty())).isSameAs(table);
            assertThat(engine.count()).isZero();
        }

        @Test
        @DisplayName("single apply leaves the failure without a step")
        void singleApplyHasNoStep() {
            assertThatThrownBy(() -> TransformDispatcher.apply(engine, table, SelectColumns.of("ghost")))
                    .isInstanceOf(UnknownColumnException.class)
                    .satisfies(e -> assertThat(((TransformApplyException) e).step()).isNull());
        }
    }

    @Nested
    @DisplayName("Step annotation")
    class StepAnnotation {

        @Test
        @DisplayName("failure is annotated with its index and later steps never run")
        void annotatesIndex() {
            TransformSequence sequence = TransformSequence.of(
                    new RenameColumn("name", "label"), SelectColumns.of("name"), SelectColumns.of("id"));

            assertThatThrownBy(() -> TransformDispatcher.applyAll(engine, table, sequence))
                    .isInstanceOf(UnknownColumnException.class)
                    .satisfies(e -> {
                        UnknownColumnException failure = (UnknownColumnException) e;
                        assertThat(failure.step()).isEqualTo(1);
                        assertThat(failure.column()).isEqualTo("name");
                    });
            assertThat(engine.calls()).containsExactly(TransformType.RENAME_COLUMN, TransformType.SELECT_COLUMNS);
        }

        @Test
        @DisplayName("first index offsets the reported step")
        void firstIndexOffset() {
            List<Transform> tail = List.of(SelectColumns.of("id"), SelectColumns.of("ghost"));

            assertThatThrownBy(() -> TransformDispatcher.applyAll(engine, table, tail, 4))
                    .isInstanceOf(UnknownColumnException.class)
                    .satisfies(e -> assertThat(((TransformApplyException) e).step()).isEqualTo(5))
                    .hasMessageStartingWith("step 5: ");
        }

        @Test
        @DisplayName("steps over the threshold are logged at WARN")
        void slowStepWarns() {
            TransformDispatcher.applyAll(engine, table, List.of(SelectColumns.of("id")), 0, -1);

            assertThat(logAppender.list)
                    .filteredOn(e -> e.getLevel() == Level.WARN)
                    .singleElement()
                    .satisfies(e -> assertThat(e.getFormattedMessage())
                            .startsWith("transform.slow_step")
                            .contains("type=select_columns"));
        }
    }

    @Nested
    @DisplayName("Unreachable variant")
    class Unreachable {

        @Test
        @DisplayName("transform whose record does not match the routed kind fails and logs ERROR")
        void mismatchedKind() {
            assertThatThrownBy(() -> TransformDispatcher.route(
                            engine, table, TransformType.SORT_COLUMN, new RenameColumn("id", "key")))
                    .isInstanceOf(UnreachableVariantException.class)
                    .hasMessageContaining("RenameColumn")
                    .hasMessageContaining("sort_column");

            assertThat(engine.count()).isZero();
            assertThat(logAppender.list)
                    .filteredOn(e -> e.getLevel() == Level.ERROR)
                    .singleElement()
                    .satisfies(e -> assertThat(e.getFormattedMessage()).startsWith("transform.unreachable_variant"));
        }

        @Test
        @DisplayName("transform without a kind fails")
        void missingKind() {
            assertThatThrownBy(() -> TransformDispatcher.route(engine, table, null, SelectColumns.of("id")))
                    .isInstanceOf(UnreachableVariantException.class)
                    .hasMessageContaining("declares no type");
        }

        @Test
        @DisplayName("every kind has a route")
        void everyKindRouted() {
            for (TransformType type : TransformType.values()) {
                assertThatThrownBy(() -> TransformDispatcher.route(engine, table, type, null))
                        .as("kind %s", type)
                        .isInstanceOf(UnreachableVariantException.class)
                        .hasMessageContaining(type.wireName());
            }
        }
    }
}
