package io.tablexform.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.tablexform.core.error.ConversionException;
import io.tablexform.core.error.UnsupportedOperatorException;
import io.tablexform.core.model.ColumnType;
import io.tablexform.core.model.Condition;
import io.tablexform.core.model.ConditionOperator;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * A {@link Condition} bound to the element type of the column it reads.
 *
 * <p>
 * Compilation is where operator/type compatibility is checked and where the wire operand is
 * coerced to the column's element type, so that a numeric string compared against an integer
 * column is compared as a number. The resulting predicate only ever sees present values; each
 * engine decides how its own missing sentinels map onto the mask.
 *
 * <p>
 * Immutable and thread-safe.
 */
public final class CompiledCondition {

    private final Condition condition;
    private final ColumnType columnType;
    private final Predicate<Object> predicate;

    private CompiledCondition(Condition condition, ColumnType columnType, Predicate<Object> predicate) {
        this.condition = condition;
        this.columnType = columnType;
        this.predicate = predicate;
    }

    /**
     * Compiles a condition for a column of the given type.
     *
     * @throws UnsupportedOperatorException if the operator cannot read a column of this type
     * @throws ConversionException          if the operand cannot be coerced to the column type
     */
    public static CompiledCondition compile(Condition condition, ColumnType columnType) {
        boolean presentMatches = condition.operator() == ConditionOperator.IS_NOT_NULL;
        Predicate<Object> predicate = switch (condition.operator().family()) {
            case MISSING -> value -> presentMatches;
            case TRUTH -> truth(condition, columnType);
            case TEXT -> text(condition, columnType);
            case EQUALITY -> equality(condition, columnType);
            case ORDERING -> ordering(condition, columnType);
            case MEMBERSHIP -> membership(condition, columnType);
        };
        return new CompiledCondition(condition, columnType, predicate);
    }

    public Condition condition() {
        return condition;
    }

    public ColumnType columnType() {
        return columnType;
    }

    /** {@code true} for {@code is_null} and {@code is_not_null}, whose result depends only on missingness. */
    public boolean testsMissing() {
        return condition.operator().family() == ConditionOperator.Family.MISSING;
    }

    /** Value a missing cell maps to: true only for {@code is_null}. */
    public boolean matchesMissing() {
        return condition.operator() == ConditionOperator.IS_NULL;
    }

    /** Evaluates the condition against a present (non-missing) value. */
    public boolean test(Object value) {
        return predicate.test(value);
    }

    private static Predicate<Object> truth(Condition condition, ColumnType type) {
        if (type != ColumnType.BOOLEAN && type != ColumnType.MIXED) {
            throw unsupported(condition, type);
        }
        Boolean expected = condition.operator() == ConditionOperator.IS_TRUE;
        return expected::equals;
    }

    private static Predicate<Object> text(Condition condition, ColumnType type) {
        if (type != ColumnType.TEXT) {
            throw unsupported(condition, type);
        }
        String needle = ValueCoercion.toText(scalarOperand(condition, condition.operand(), ColumnType.TEXT));
        return switch (condition.operator()) {
            case CONTAINS -> value -> ((String) value).contains(needle);
            case STARTS_WITH -> value -> ((String) value).startsWith(needle);
            case ENDS_WITH -> value -> ((String) value).endsWith(needle);
            case MATCHES_REGEX -> {
                Pattern pattern = compilePattern(condition, needle);
                yield value -> pattern.matcher((String) value).find();
            }
            default -> throw unsupported(condition, type);
        };
    }

    private static Predicate<Object> equality(Condition condition, ColumnType type) {
        Object operand = scalarOperand(condition, condition.operand(), type);
        if (condition.operator().isNegatedEquality()) {
            return value -> !ValueOrdering.valueEquals(value, operand);
        }
        return value -> ValueOrdering.valueEquals(value, operand);
    }

    private static Predicate<Object> ordering(Condition condition, ColumnType type) {
        if (!type.isOrderable()) {
            throw unsupported(condition, type);
        }
        Object operand = scalarOperand(condition, condition.operand(), type);
        ConditionOperator op = condition.operator();
        return value -> {
            Integer c = ValueOrdering.compareForFilter(value, operand);
            if (c == null) {
                return false;
            }
            return switch (op) {
                case GT -> c > 0;
                case LT -> c < 0;
                case GE -> c >= 0;
                case LE -> c <= 0;
                default -> false;
            };
        };
    }

    private static Predicate<Object> membership(Condition condition, ColumnType type) {
        List<Object> members = new ArrayList<>();
        for (JsonNode element : condition.operand()) {
            members.add(scalarOperand(condition, element, type));
        }
        return value -> {
            for (Object member : members) {
                if (ValueOrdering.valueEquals(value, member)) {
                    return true;
                }
            }
            return false;
        };
    }

    private static Object scalarOperand(Condition condition, JsonNode node, ColumnType type) {
        Object natural = ValueCoercion.fromJson(node)
                .orElseThrow(() -> operandFailure(condition, node, type));
        // integer columns only compare against integral operands
        if (type == ColumnType.INTEGER && natural instanceof Double d && d != Math.rint(d)) {
            throw operandFailure(condition, node, type);
        }
        Optional<Object> coerced = ValueCoercion.convert(natural, type);
        return coerced.orElseThrow(() -> operandFailure(condition, node, type));
    }

    private static Pattern compilePattern(Condition condition, String regex) {
        try {
            return Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            throw new ConversionException(
                    "Invalid regular expression for column '" + condition.column() + "': " + e.getDescription(),
                    e,
                    condition.column(),
                    condition.operator().wireName(),
                    null);
        }
    }

    private static ConversionException operandFailure(Condition condition, JsonNode node, ColumnType type) {
        return new ConversionException(
                "Value " + node + " cannot be compared with column '" + condition.column() + "' of type "
                        + type.wireName(),
                condition.column(),
                condition.operator().wireName(),
                null);
    }

    private static UnsupportedOperatorException unsupported(Condition condition, ColumnType type) {
        return new UnsupportedOperatorException(
                "Operator '" + condition.operator().wireName() + "' does not apply to column '" + condition.column()
                        + "' of type " + type.wireName(),
                condition.column(),
                condition.operator().wireName());
    }
}
