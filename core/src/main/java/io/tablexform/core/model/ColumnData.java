package io.tablexform.core.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Engine-neutral column used to load a table into an engine.
 *
 * <p>
 * Values are normalized on construction: {@link Integer}, {@link Short} and {@link Byte} become
 * {@link Long}; {@link Float} becomes {@link Double}. {@code null} marks a missing value.
 *
 * @param name   column name
 * @param type   declared element type
 * @param values column values, top to bottom
 * @throws IllegalArgumentException if a value does not match the declared type
 */
public record ColumnData(String name, ColumnType type, List<Object> values) {

    public ColumnData {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(values, "values must not be null");
        List<Object> normalized = new ArrayList<>(values.size());
        for (Object value : values) {
            Object canonical = normalize(value);
            if (canonical != null && !accepts(type, canonical)) {
                throw new IllegalArgumentException("Column '" + name + "' of type " + type + " cannot hold value '"
                        + canonical + "' (" + canonical.getClass().getSimpleName() + ")");
            }
            normalized.add(canonical);
        }
        values = Collections.unmodifiableList(normalized);
    }

    public static ColumnData of(String name, ColumnType type, Object... values) {
        return new ColumnData(name, type, Arrays.asList(values));
    }

    public int size() {
        return values.size();
    }

    /** Maps a Java value onto the canonical representation used by every engine. */
    public static Object normalize(Object value) {
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Float) {
            return ((Float) value).doubleValue();
        }
        if (value == null
                || value instanceof Long
                || value instanceof Double
                || value instanceof Boolean
                || value instanceof String) {
            return value;
        }
        throw new IllegalArgumentException("Unsupported value type: " + value.getClass().getName());
    }

    private static boolean accepts(ColumnType type, Object value) {
        return switch (type) {
            case INTEGER -> value instanceof Long;
            case FLOAT -> value instanceof Double;
            case BOOLEAN -> value instanceof Boolean;
            case TEXT -> value instanceof String;
            case MIXED -> true;
        };
    }
}
