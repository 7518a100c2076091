package io.tablexform.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Objects;

/**
 * One row predicate inside {@link FilterRows}.
 *
 * <p>
 * The operand is kept exactly as it arrived on the wire; engines coerce it to the
 * column's element type at apply time. Operators that ignore the operand store
 * {@code null} so that two conditions differing only in an ignored operand compare equal.
 *
 * @param column   column the predicate reads
 * @param operator predicate operator
 * @param operand  wire operand, {@code null} for the {@code is_*} operators
 */
public record Condition(String column, ConditionOperator operator, JsonNode operand) {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public Condition {
        Objects.requireNonNull(column, "column must not be null");
        Objects.requireNonNull(operator, "operator must not be null");
        if (!operator.requiresOperand()) {
            operand = null;
        } else {
            if (operand == null || operand.isNull() || operand.isMissingNode()) {
                throw new IllegalArgumentException(
                        "Operator '" + operator.wireName() + "' on column '" + column + "' requires a value");
            }
            if (operator == ConditionOperator.IN_SET && !operand.isArray()) {
                throw new IllegalArgumentException("Operator 'in_set' on column '" + column + "' requires an array value");
            }
            operand = operand.deepCopy();
        }
    }

    /** Returns a copy of the wire operand, or {@code null} for the {@code is_*} operators. */
    @Override
    public JsonNode operand() {
        return operand == null ? null : operand.deepCopy();
    }

    /** Condition with an operand given as a plain Java value (string, number, boolean or collection). */
    public static Condition of(String column, ConditionOperator operator, Object value) {
        JsonNode operand = value == null ? null : MAPPER.valueToTree(value);
        return new Condition(column, operator, operand);
    }

    /** Condition for an operator that takes no operand. */
    public static Condition of(String column, ConditionOperator operator) {
        return new Condition(column, operator, null);
    }
}
