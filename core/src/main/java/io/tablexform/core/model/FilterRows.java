package io.tablexform.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Keeps or removes rows by a list of conditions.
 *
 * <p>
 * Conditions are applied one after another. With {@link Operation#KEEP} a row survives only if
 * it satisfies every condition; with {@link Operation#REMOVE} a row is dropped as soon as it
 * satisfies any condition, so the retained rows satisfy none of them.
 *
 * @param conditions ordered, non-empty list of predicates
 * @param operation  keep or remove matching rows
 */
public record FilterRows(List<Condition> conditions, Operation operation) implements Transform {

    /** Whether matching rows are retained or dropped. */
    public enum Operation {
        KEEP("keep"),
        REMOVE("remove");

        private final String wireName;

        Operation(String wireName) {
            this.wireName = wireName;
        }

        public String wireName() {
            return wireName;
        }

        public static Operation fromWireName(String name) {
            if ("keep".equals(name) || "keep_rows".equals(name)) {
                return KEEP;
            }
            if ("remove".equals(name) || "remove_rows".equals(name)) {
                return REMOVE;
            }
            throw new IllegalArgumentException("Unknown filter operation: '" + name + "'");
        }
    }

    public FilterRows {
        Objects.requireNonNull(conditions, "conditions must not be null");
        Objects.requireNonNull(operation, "operation must not be null");
        conditions = List.copyOf(conditions);
        if (conditions.isEmpty()) {
            throw new IllegalArgumentException("filter_rows requires at least one condition");
        }
    }

    /** Keeps rows satisfying every condition. */
    public static FilterRows keep(Condition... conditions) {
        return new FilterRows(List.of(conditions), Operation.KEEP);
    }

    /** Removes rows satisfying any condition. */
    public static FilterRows remove(Condition... conditions) {
        return new FilterRows(List.of(conditions), Operation.REMOVE);
    }

    @Override
    public TransformType type() {
        return TransformType.FILTER_ROWS;
    }
}
