package io.tablexform.core.engine;

import io.tablexform.core.model.SortColumn.NullPosition;
import java.util.Comparator;
import java.util.List;

/**
 * Ordering and equality of canonical values, shared by sort, group ordering, min/max and filter
 * comparisons.
 *
 * <p>
 * Sorting uses a total order in which a float {@code NaN} ranks above every other float. Filter
 * comparisons use IEEE semantics instead, where {@code NaN} compares false to everything.
 */
public final class ValueOrdering {

    /** Total order over non-null values of one column type. */
    public static final Comparator<Object> NATURAL = ValueOrdering::compare;

    private ValueOrdering() {}

    /**
     * Compares two non-null values of the same column type.
     *
     * @throws IllegalArgumentException if the values have no common order
     */
    public static int compare(Object left, Object right) {
        if (left instanceof Long l && right instanceof Long r) {
            return Long.compare(l, r);
        }
        if (left instanceof Number l && right instanceof Number r) {
            return Double.compare(l.doubleValue(), r.doubleValue());
        }
        if (left instanceof Boolean l && right instanceof Boolean r) {
            return Boolean.compare(l, r);
        }
        if (left instanceof String l && right instanceof String r) {
            return l.compareTo(r);
        }
        throw new IllegalArgumentException("Values are not comparable: " + describe(left) + " and " + describe(right));
    }

    /** Comparator placing {@code null} at the requested position and ordering the rest naturally. */
    public static Comparator<Object> nullsAt(NullPosition position, boolean ascending) {
        Comparator<Object> values = ascending ? NATURAL : NATURAL.reversed();
        return position == NullPosition.FIRST ? Comparator.nullsFirst(values) : Comparator.nullsLast(values);
    }

    /** Lexicographic order over group keys, missing components last. */
    public static Comparator<List<Object>> keyOrder() {
        Comparator<Object> component = Comparator.nullsLast(NATURAL);
        return (left, right) -> {
            for (int i = 0; i < left.size(); i++) {
                int c = component.compare(left.get(i), right.get(i));
                if (c != 0) {
                    return c;
                }
            }
            return 0;
        };
    }

    /** Group-key form of a cell: {@code -0.0} folds into {@code 0.0}, everything else is unchanged. */
    public static Object groupKeyComponent(Object value) {
        if (value instanceof Double d && d == 0.0) {
            return 0.0;
        }
        return value;
    }

    /** IEEE equality for floats, value equality otherwise. Integers and floats compare numerically. */
    public static boolean valueEquals(Object left, Object right) {
        if (left instanceof Double || right instanceof Double) {
            if (left instanceof Number l && right instanceof Number r) {
                return l.doubleValue() == r.doubleValue();
            }
            return false;
        }
        return left.equals(right);
    }

    /** IEEE three-way comparison: returns {@code null} when either side is {@code NaN}. */
    public static Integer compareForFilter(Object left, Object right) {
        if (left instanceof Number l && right instanceof Number r) {
            double a = l.doubleValue();
            double b = r.doubleValue();
            if (Double.isNaN(a) || Double.isNaN(b)) {
                return null;
            }
            if (left instanceof Long && right instanceof Long) {
                return Long.compare((Long) left, (Long) right);
            }
            return a < b ? -1 : (a > b ? 1 : 0);
        }
        return compare(left, right);
    }

    private static String describe(Object value) {
        return value + " (" + value.getClass().getSimpleName() + ")";
    }
}
