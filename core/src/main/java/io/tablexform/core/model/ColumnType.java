package io.tablexform.core.model;

import java.util.Locale;
import java.util.Map;

/**
 * Element type of a table column. Every engine stores values of these types; the
 * canonical Java representation of each is listed on the constant.
 */
public enum ColumnType {

    /** 64-bit integers, read as {@link Long}. */
    INTEGER("int"),
    /** Double-precision floats, read as {@link Double}. */
    FLOAT("float"),
    /** Booleans, read as {@link Boolean}. */
    BOOLEAN("bool"),
    /** Text, read as {@link String}. */
    TEXT("str"),
    /** Untyped column holding any of the above. */
    MIXED("object");

    private static final Map<String, ColumnType> ALIASES = Map.ofEntries(
            Map.entry("int", INTEGER),
            Map.entry("int64", INTEGER),
            Map.entry("integer", INTEGER),
            Map.entry("float", FLOAT),
            Map.entry("float64", FLOAT),
            Map.entry("double", FLOAT),
            Map.entry("bool", BOOLEAN),
            Map.entry("boolean", BOOLEAN),
            Map.entry("str", TEXT),
            Map.entry("string", TEXT),
            Map.entry("text", TEXT),
            Map.entry("object", MIXED),
            Map.entry("mixed", MIXED));

    private final String wireName;

    ColumnType(String wireName) {
        this.wireName = wireName;
    }

    /** Canonical name used on the wire. */
    public String wireName() {
        return wireName;
    }

    /** {@code true} for types that support arithmetic aggregation. */
    public boolean isNumeric() {
        return this == INTEGER || this == FLOAT || this == BOOLEAN;
    }

    /** {@code true} for types with a total order usable by sort, min and max. */
    public boolean isOrderable() {
        return this != MIXED;
    }

    /**
     * Resolves a wire name or one of its aliases (case-insensitive).
     *
     * @throws IllegalArgumentException if the name is not recognized
     */
    public static ColumnType fromWireName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("column type must not be null");
        }
        ColumnType type = ALIASES.get(name.trim().toLowerCase(Locale.ROOT));
        if (type == null) {
            throw new IllegalArgumentException("Unknown column type: '" + name + "'");
        }
        return type;
    }
}
