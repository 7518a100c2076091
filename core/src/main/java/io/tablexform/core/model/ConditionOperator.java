package io.tablexform.core.model;

import java.util.Map;

/** Row predicate operators usable in a {@link Condition}. */
public enum ConditionOperator {
    EQ("eq", Family.EQUALITY),
    NE("ne", Family.EQUALITY),
    GT("gt", Family.ORDERING),
    LT("lt", Family.ORDERING),
    GE("ge", Family.ORDERING),
    LE("le", Family.ORDERING),
    IS_TRUE("is_true", Family.TRUTH),
    IS_FALSE("is_false", Family.TRUTH),
    IS_NULL("is_null", Family.MISSING),
    IS_NOT_NULL("is_not_null", Family.MISSING),
    EQUALS("equals", Family.EQUALITY),
    NOT_EQUALS("not_equals", Family.EQUALITY),
    CONTAINS("contains", Family.TEXT),
    MATCHES_REGEX("matches_regex", Family.TEXT),
    STARTS_WITH("starts_with", Family.TEXT),
    ENDS_WITH("ends_with", Family.TEXT),
    IN_SET("in_set", Family.MEMBERSHIP);

    /** Operators grouped by the column types they accept. */
    public enum Family {
        EQUALITY,
        ORDERING,
        TRUTH,
        MISSING,
        TEXT,
        MEMBERSHIP
    }

    // Names the browser widget sends for the same operators.
    private static final Map<String, ConditionOperator> WIDGET_ALIASES = Map.ofEntries(
            Map.entry("==", EQ),
            Map.entry("!=", NE),
            Map.entry(">", GT),
            Map.entry("<", LT),
            Map.entry(">=", GE),
            Map.entry("<=", LE),
            Map.entry("is_nan", IS_NULL),
            Map.entry("is_not_nan", IS_NOT_NULL),
            Map.entry("does_not_equal", NOT_EQUALS),
            Map.entry("regex", MATCHES_REGEX),
            Map.entry("in", IN_SET));

    private final String wireName;
    private final Family family;

    ConditionOperator(String wireName, Family family) {
        this.wireName = wireName;
        this.family = family;
    }

    public String wireName() {
        return wireName;
    }

    public Family family() {
        return family;
    }

    /** {@code false} for the {@code is_*} operators, which ignore any operand. */
    public boolean requiresOperand() {
        return family != Family.TRUTH && family != Family.MISSING;
    }

    /** {@code true} for operators whose result is inverted equality ({@code ne}, {@code not_equals}). */
    public boolean isNegatedEquality() {
        return this == NE || this == NOT_EQUALS;
    }

    public static ConditionOperator fromWireName(String name) {
        for (ConditionOperator op : values()) {
            if (op.wireName.equals(name)) {
                return op;
            }
        }
        ConditionOperator alias = name != null ? WIDGET_ALIASES.get(name) : null;
        if (alias == null) {
            throw new IllegalArgumentException("Unknown condition operator: '" + name + "'");
        }
        return alias;
    }
}
