package io.tablexform.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.tablexform.core.model.ColumnType;
import java.util.Locale;
import java.util.Optional;

/**
 * Value conversion rules shared by every engine: cell conversion for
 * {@link io.tablexform.core.model.ColumnConversion} and operand coercion for filter conditions.
 *
 * <p>
 * All methods take canonical non-missing values ({@link Long}, {@link Double}, {@link Boolean},
 * {@link String}). Engines handle their own missing sentinels before calling in.
 *
 * <p>
 * Thread-safe, stateless utility class.
 */
public final class ValueCoercion {

    private ValueCoercion() {}

    /**
     * Converts a non-missing value to the target type.
     *
     * <ul>
     * <li>to {@code INTEGER}: integral text, booleans as 1/0, finite floats truncated toward
     * zero</li>
     * <li>to {@code FLOAT}: numeric text, integers, booleans as 1.0/0.0</li>
     * <li>to {@code BOOLEAN}: {@code true}/{@code false} text in any case, numbers by non-zero</li>
     * <li>to {@code TEXT}: the canonical string form of the value</li>
     * <li>to {@code MIXED}: the value unchanged</li>
     * </ul>
     *
     * @return the converted value, or empty if the value has no representation in the target type
     */
    public static Optional<Object> convert(Object value, ColumnType target) {
        if (value == null) {
            throw new IllegalArgumentException("missing values are not converted");
        }
        return switch (target) {
            case INTEGER -> toInteger(value);
            case FLOAT -> toFloat(value);
            case BOOLEAN -> toBoolean(value);
            case TEXT -> Optional.of(toText(value));
            case MIXED -> Optional.of(value);
        };
    }

    /**
     * Reads a wire operand as its natural Java value: text, integral and floating numbers, and
     * booleans. Arrays, objects and nulls have no scalar form.
     */
    public static Optional<Object> fromJson(JsonNode node) {
        if (node == null) {
            return Optional.empty();
        }
        if (node.isTextual()) {
            return Optional.of(node.textValue());
        }
        if (node.isBoolean()) {
            return Optional.of(node.booleanValue());
        }
        if (node.isIntegralNumber() && node.canConvertToLong()) {
            return Optional.of(node.longValue());
        }
        if (node.isNumber()) {
            return Optional.of(node.doubleValue());
        }
        return Optional.empty();
    }

    /** Canonical string form: integers in decimal, floats per {@link Double#toString}, booleans lowercase. */
    public static String toText(Object value) {
        return value instanceof String s ? s : String.valueOf(value);
    }

    private static Optional<Object> toInteger(Object value) {
        if (value instanceof Long) {
            return Optional.of(value);
        }
        if (value instanceof Double d) {
            if (d.isNaN() || d.isInfinite()) {
                return Optional.empty();
            }
            return Optional.of((long) d.doubleValue());
        }
        if (value instanceof Boolean b) {
            return Optional.of(b ? 1L : 0L);
        }
        try {
            return Optional.of(Long.parseLong(((String) value).trim()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static Optional<Object> toFloat(Object value) {
        if (value instanceof Double) {
            return Optional.of(value);
        }
        if (value instanceof Long l) {
            return Optional.of(l.doubleValue());
        }
        if (value instanceof Boolean b) {
            return Optional.of(b ? 1.0 : 0.0);
        }
        String text = ((String) value).trim();
        switch (text.toLowerCase(Locale.ROOT)) {
            case "nan":
                return Optional.of(Double.NaN);
            case "inf":
            case "+inf":
                return Optional.of(Double.POSITIVE_INFINITY);
            case "-inf":
                return Optional.of(Double.NEGATIVE_INFINITY);
            default:
                break;
        }
        try {
            return Optional.of(Double.parseDouble(text));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static Optional<Object> toBoolean(Object value) {
        if (value instanceof Boolean) {
            return Optional.of(value);
        }
        if (value instanceof Long l) {
            return Optional.of(l != 0L);
        }
        if (value instanceof Double d) {
            return d.isNaN() ? Optional.empty() : Optional.of(d != 0.0);
        }
        String text = ((String) value).trim();
        if (text.equalsIgnoreCase("true")) {
            return Optional.of(Boolean.TRUE);
        }
        if (text.equalsIgnoreCase("false")) {
            return Optional.of(Boolean.FALSE);
        }
        return Optional.empty();
    }
}
