package io.tablexform.core.engine.labeled;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.tablexform.core.model.Aggregate;
import io.tablexform.core.model.Aggregation;
import io.tablexform.core.model.ColumnConversion;
import io.tablexform.core.model.ColumnData;
import io.tablexform.core.model.ColumnType;
import io.tablexform.core.model.Condition;
import io.tablexform.core.model.ConditionOperator;
import io.tablexform.core.model.FilterRows;
import io.tablexform.core.model.GroupBy;
import io.tablexform.core.model.SampleRows;
import io.tablexform.core.model.SelectColumns;
import io.tablexform.core.model.SortColumn;
import io.tablexform.core.model.SortColumn.NullPosition;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Behaviour specific to the {@code labeled} engine: {@code NaN} is missing, and row labels
 * travel with their rows. Shared behaviour is covered by the engine conformance suite.
 */
@DisplayName("LabeledTableEngineTest")
class LabeledTableEngineTest {

    private LabeledTableEngine engine;
    private LabeledFrame table;

    @BeforeEach
    void setUp() {
        engine = new LabeledTableEngine();
        table = engine.load(List.of(
                ColumnData.of("key", ColumnType.TEXT, "a", "b", "a", "c"),
                ColumnData.of("x", ColumnType.FLOAT, 1.0, Double.NaN, null, 4.0)));
    }

    @Nested
    @DisplayName("Missing values")
    class MissingValues {

        @Test
        @DisplayName("NaN and null both read as null")
        void nanReadsAsNull() {
            assertThat(table.column("x")).containsExactly(1.0, null, null, 4.0);
        }

        @Test
        @DisplayName("is_null matches NaN as well as null")
        void isNullMatchesNan() {
            LabeledFrame result = engine.filterRows(table, FilterRows.keep(Condition.of("x", ConditionOperator.IS_NULL)));

            assertThat(result.column("key")).containsExactly("b", "a");
        }

        @Test
        @DisplayName("NaN keys fall into the missing group")
        void nanGroupKey() {
            LabeledFrame floats = engine.load(List.of(
                    ColumnData.of("k", ColumnType.FLOAT, Double.NaN, null, 1.0),
                    ColumnData.of("v", ColumnType.INTEGER, 1, 2, 3)));

            LabeledFrame kept = engine.groupBy(floats, new GroupBy(List.of("k"), Aggregation.SUM, false));
            LabeledFrame dropped = engine.groupBy(floats, new GroupBy(List.of("k"), Aggregation.SUM, true));

            assertThat(kept.rows()).containsExactly(List.of(1.0, 3L), Arrays.asList(null, 3L));
            assertThat(dropped.rows()).containsExactly(List.of(1.0, 3L));
        }

        @Test
        @DisplayName("coerced float failures become NaN and read as null")
        void coercedToNan() {
            LabeledFrame text = engine.load(List.of(ColumnData.of("s", ColumnType.TEXT, "1.5", "n/a")));

            LabeledFrame result =
                    engine.convertColumn(text, new ColumnConversion("s", ColumnType.FLOAT, ColumnConversion.ErrorPolicy.COERCE));

            assertThat(result.columnType("s")).isEqualTo(ColumnType.FLOAT);
            assertThat(result.column("s")).containsExactly(1.5, null);
        }

        @Test
        @DisplayName("mean skips NaN")
        void meanSkipsNan() {
            LabeledFrame result = engine.aggregate(table, new Aggregate(List.of("x"), List.of(Aggregation.MEAN, Aggregation.COUNT)));

            assertThat(result.row(0)).containsExactly(2.5, 2L);
        }
    }

    @Nested
    @DisplayName("Row labels")
    class RowLabels {

        @Test
        @DisplayName("loaded rows are labeled by position")
        void initialLabels() {
            assertThat(table.rowLabels()).containsExactly(0L, 1L, 2L, 3L);
        }

        @Test
        @DisplayName("filter and sort carry labels with their rows")
        void labelsTravel() {
            LabeledFrame filtered = engine.filterRows(table, FilterRows.remove(Condition.of("key", ConditionOperator.EQ, "b")));
            LabeledFrame sorted = engine.sortColumn(filtered, new SortColumn("key", false, NullPosition.LAST));

            assertThat(filtered.rowLabels()).containsExactly(0L, 2L, 3L);
            assertThat(sorted.rowLabels()).containsExactly(3L, 0L, 2L);
            assertThat(engine.selectColumns(sorted, SelectColumns.of("x")).rowLabels()).containsExactly(3L, 0L, 2L);
        }

        @Test
        @DisplayName("sampling with replacement repeats labels")
        void sampleRepeatsLabels() {
            LabeledFrame sample = engine.sampleRows(table, new SampleRows(12, 3L, true));

            assertThat(sample.rowCount()).isEqualTo(12);
            assertThat(sample.rowLabels()).allSatisfy(label -> assertThat(label).isIn(0L, 1L, 2L, 3L));
            for (int i = 0; i < sample.rowCount(); i++) {
                long label = (Long) sample.rowLabels().get(i);
                assertThat(sample.value(i, "key")).isEqualTo(table.value((int) label, "key"));
            }
        }

        @Test
        @DisplayName("group-by labels rows with their group key")
        void groupLabels() {
            LabeledFrame grouped = engine.groupBy(table, new GroupBy(List.of("key"), Aggregation.COUNT, true));

            assertThat(grouped.rowLabels()).containsExactly(List.of("a"), List.of("b"), List.of("c"));
            assertThat(grouped.column("x")).containsExactly(1L, 0L, 1L);
        }

        @Test
        @DisplayName("group-by labels cannot be modified")
        void groupLabelsAreReadOnly() {
            LabeledFrame grouped = engine.groupBy(table, new GroupBy(List.of("key"), Aggregation.COUNT, false));

            @SuppressWarnings("unchecked")
            List<Object> label = (List<Object>) grouped.rowLabels().get(0);
            assertThatThrownBy(() -> label.add("z")).isInstanceOf(UnsupportedOperationException.class);
            assertThat(grouped.rowLabels().get(0)).isEqualTo(List.of("a"));
        }

        @Test
        @DisplayName("aggregate produces a single row labeled 0")
        void aggregateLabel() {
            LabeledFrame summary = engine.aggregate(table, new Aggregate(List.of("x"), List.of(Aggregation.MAX)));

            assertThat(summary.rowLabels()).containsExactly(0L);
            assertThat(summary.column("x_max")).containsExactly(4.0);
        }
    }
}
