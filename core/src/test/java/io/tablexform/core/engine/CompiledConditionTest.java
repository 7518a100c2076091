package io.tablexform.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.tablexform.core.error.ConversionException;
import io.tablexform.core.error.UnsupportedOperatorException;
import io.tablexform.core.model.ColumnType;
import io.tablexform.core.model.Condition;
import io.tablexform.core.model.ConditionOperator;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Tests for {@link CompiledCondition}: operand coercion and operator/type compatibility. */
@DisplayName("CompiledConditionTest")
class CompiledConditionTest {

    private static CompiledCondition compile(String column, ConditionOperator op, Object operand, ColumnType type) {
        return CompiledCondition.compile(Condition.of(column, op, operand), type);
    }

    @Nested
    @DisplayName("Operand coercion")
    class OperandCoercion {

        @Test
        @DisplayName("numeric text compares numerically against an integer column")
        void numericText() {
            CompiledCondition gt = compile("n", ConditionOperator.GT, "10", ColumnType.INTEGER);

            assertThat(gt.test(9L)).isFalse();
            assertThat(gt.test(11L)).isTrue();
        }

        @Test
        @DisplayName("integer operand matches a float column by value")
        void integerAgainstFloat() {
            CompiledCondition eq = compile("x", ConditionOperator.EQ, 2, ColumnType.FLOAT);

            assertThat(eq.test(2.0)).isTrue();
            assertThat(eq.test(2.5)).isFalse();
        }

        @Test
        @DisplayName("non-numeric operand on a numeric column fails with the column named")
        void badOperand() {
            assertThatThrownBy(() -> compile("n", ConditionOperator.EQ, "ten", ColumnType.INTEGER))
                    .isInstanceOf(ConversionException.class)
                    .hasMessageContaining("'n'")
                    .satisfies(e -> assertThat(((ConversionException) e).row()).isNull());
        }

        @Test
        @DisplayName("in_set coerces every member")
        void inSet() {
            CompiledCondition in = compile("n", ConditionOperator.IN_SET, List.of(1, "2"), ColumnType.INTEGER);

            assertThat(in.test(1L)).isTrue();
            assertThat(in.test(2L)).isTrue();
            assertThat(in.test(3L)).isFalse();
        }
    }

    @Nested
    @DisplayName("Operators")
    class Operators {

        @Test
        @DisplayName("NaN never satisfies an ordering comparison")
        void nanOrdering() {
            assertThat(compile("x", ConditionOperator.GE, 0, ColumnType.FLOAT).test(Double.NaN)).isFalse();
            assertThat(compile("x", ConditionOperator.LT, 0, ColumnType.FLOAT).test(Double.NaN)).isFalse();
        }

        @Test
        @DisplayName("ne and not_equals are the negation of equality on present values")
        void negatedEquality() {
            assertThat(compile("s", ConditionOperator.NE, "a", ColumnType.TEXT).test("b")).isTrue();
            assertThat(compile("s", ConditionOperator.NOT_EQUALS, "a", ColumnType.TEXT).test("a")).isFalse();
        }

        @Test
        @DisplayName("text operators")
        void textOperators() {
            assertThat(compile("s", ConditionOperator.CONTAINS, "ell", ColumnType.TEXT).test("hello")).isTrue();
            assertThat(compile("s", ConditionOperator.STARTS_WITH, "he", ColumnType.TEXT).test("hello")).isTrue();
            assertThat(compile("s", ConditionOperator.ENDS_WITH, "he", ColumnType.TEXT).test("hello")).isFalse();
            assertThat(compile("s", ConditionOperator.MATCHES_REGEX, "l+o$", ColumnType.TEXT).test("hello")).isTrue();
        }

        @Test
        @DisplayName("missing-value operators report how missing cells map")
        void missingOperators() {
            CompiledCondition isNull = CompiledCondition.compile(Condition.of("x", ConditionOperator.IS_NULL), ColumnType.FLOAT);
            CompiledCondition notNull =
                    CompiledCondition.compile(Condition.of("x", ConditionOperator.IS_NOT_NULL), ColumnType.FLOAT);

            assertThat(isNull.testsMissing()).isTrue();
            assertThat(isNull.matchesMissing()).isTrue();
            assertThat(isNull.test(1.0)).isFalse();
            assertThat(notNull.matchesMissing()).isFalse();
            assertThat(notNull.test(1.0)).isTrue();
        }

        @Test
        @DisplayName("comparison operators never match missing cells")
        void comparisonsSkipMissing() {
            CompiledCondition ne = compile("s", ConditionOperator.NE, "a", ColumnType.TEXT);

            assertThat(ne.testsMissing()).isFalse();
            assertThat(ne.matchesMissing()).isFalse();
        }
    }

    @Nested
    @DisplayName("Compatibility")
    class Compatibility {

        @Test
        @DisplayName("text operators reject non-text columns")
        void textOnNumbers() {
            assertThatThrownBy(() -> compile("n", ConditionOperator.CONTAINS, "1", ColumnType.INTEGER))
                    .isInstanceOf(UnsupportedOperatorException.class)
                    .satisfies(e -> assertThat(((UnsupportedOperatorException) e).operator()).isEqualTo("contains"));
        }

        @Test
        @DisplayName("truth operators reject non-boolean columns")
        void truthOnText() {
            assertThatThrownBy(() -> CompiledCondition.compile(Condition.of("s", ConditionOperator.IS_TRUE), ColumnType.TEXT))
                    .isInstanceOf(UnsupportedOperatorException.class);
        }

        @Test
        @DisplayName("ordering operators reject mixed columns")
        void orderingOnMixed() {
            assertThatThrownBy(() -> compile("m", ConditionOperator.GT, 1, ColumnType.MIXED))
                    .isInstanceOf(UnsupportedOperatorException.class);
        }

        @Test
        @DisplayName("invalid regular expression is a conversion failure")
        void invalidRegex() {
            assertThatThrownBy(() -> compile("s", ConditionOperator.MATCHES_REGEX, "(", ColumnType.TEXT))
                    .isInstanceOf(ConversionException.class)
                    .hasMessageContaining("regular expression");
        }
    }
}
