package io.tablexform.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.tablexform.core.model.ColumnType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Tests for {@link ValueCoercion}. */
@DisplayName("ValueCoercionTest")
class ValueCoercionTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    @Nested
    @DisplayName("Conversion")
    class Conversion {

        @Test
        @DisplayName("text to integer parses integral text only")
        void textToInteger() {
            assertThat(ValueCoercion.convert(" 42 ", ColumnType.INTEGER)).contains(42L);
            assertThat(ValueCoercion.convert("4.2", ColumnType.INTEGER)).isEmpty();
            assertThat(ValueCoercion.convert("abc", ColumnType.INTEGER)).isEmpty();
        }

        @Test
        @DisplayName("float to integer truncates toward zero and rejects non-finite values")
        void floatToInteger() {
            assertThat(ValueCoercion.convert(-2.7, ColumnType.INTEGER)).contains(-2L);
            assertThat(ValueCoercion.convert(Double.NaN, ColumnType.INTEGER)).isEmpty();
            assertThat(ValueCoercion.convert(Double.POSITIVE_INFINITY, ColumnType.INTEGER)).isEmpty();
        }

        @Test
        @DisplayName("text to float accepts nan and inf spellings")
        void textToFloat() {
            assertThat(ValueCoercion.convert("1.5", ColumnType.FLOAT)).contains(1.5);
            assertThat(ValueCoercion.convert("NaN", ColumnType.FLOAT)).hasValueSatisfying(v -> assertThat((Double) v)
                    .isNaN());
            assertThat(ValueCoercion.convert("-inf", ColumnType.FLOAT)).contains(Double.NEGATIVE_INFINITY);
            assertThat(ValueCoercion.convert("one", ColumnType.FLOAT)).isEmpty();
        }

        @Test
        @DisplayName("booleans convert from true/false text and numbers")
        void toBoolean() {
            assertThat(ValueCoercion.convert("TRUE", ColumnType.BOOLEAN)).contains(true);
            assertThat(ValueCoercion.convert("false", ColumnType.BOOLEAN)).contains(false);
            assertThat(ValueCoercion.convert("yes", ColumnType.BOOLEAN)).isEmpty();
            assertThat(ValueCoercion.convert(0L, ColumnType.BOOLEAN)).contains(false);
            assertThat(ValueCoercion.convert(3.0, ColumnType.BOOLEAN)).contains(true);
        }

        @Test
        @DisplayName("everything converts to text")
        void toText() {
            assertThat(ValueCoercion.convert(7L, ColumnType.TEXT)).contains("7");
            assertThat(ValueCoercion.convert(true, ColumnType.TEXT)).contains("true");
            assertThat(ValueCoercion.convert(1.5, ColumnType.TEXT)).contains("1.5");
        }

        @Test
        @DisplayName("missing values are rejected")
        void missingRejected() {
            assertThatThrownBy(() -> ValueCoercion.convert(null, ColumnType.TEXT))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Wire operands")
    class WireOperands {

        @Test
        @DisplayName("scalars map to their natural Java value")
        void scalars() throws Exception {
            assertThat(ValueCoercion.fromJson(JSON.readTree("\"x\""))).contains("x");
            assertThat(ValueCoercion.fromJson(JSON.readTree("12"))).contains(12L);
            assertThat(ValueCoercion.fromJson(JSON.readTree("1.25"))).contains(1.25);
            assertThat(ValueCoercion.fromJson(JSON.readTree("false"))).contains(false);
        }

        @Test
        @DisplayName("containers and null have no scalar form")
        void nonScalars() throws Exception {
            assertThat(ValueCoercion.fromJson(JSON.readTree("[1]"))).isEmpty();
            assertThat(ValueCoercion.fromJson(JSON.readTree("{}"))).isEmpty();
            assertThat(ValueCoercion.fromJson(JSON.readTree("null"))).isEmpty();
            assertThat(ValueCoercion.fromJson(null)).isEmpty();
        }
    }
}
