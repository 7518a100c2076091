package io.tablexform.core.model;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/** Validation shared by the transform records. */
final class ModelChecks {

    private ModelChecks() {}

    /**
     * Copies {@code values} into an unmodifiable list, rejecting null elements and duplicates.
     *
     * @param field name used in error messages
     * @param allowEmpty whether an empty list is acceptable
     */
    static <E> List<E> distinct(List<E> values, String field, boolean allowEmpty) {
        Objects.requireNonNull(values, field + " must not be null");
        List<E> copy = List.copyOf(values);
        if (!allowEmpty && copy.isEmpty()) {
            throw new IllegalArgumentException(field + " must not be empty");
        }
        Set<E> seen = new HashSet<>();
        for (E value : copy) {
            if (!seen.add(value)) {
                throw new IllegalArgumentException(field + " contains duplicate entry: '" + value + "'");
            }
        }
        return copy;
    }
}
