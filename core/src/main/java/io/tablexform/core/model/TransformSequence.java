package io.tablexform.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Ordered list of transforms defining a complete table derivation. This is the unit submitted to
 * a pipeline and the unit the pipeline compares against its cached state.
 *
 * <p>
 * Immutable, thread-safe.
 *
 * @param transforms the transforms in application order
 */
public record TransformSequence(List<Transform> transforms) {

    private static final TransformSequence EMPTY = new TransformSequence(List.of());

    public TransformSequence {
        Objects.requireNonNull(transforms, "transforms must not be null");
        transforms = List.copyOf(transforms);
    }

    public static TransformSequence empty() {
        return EMPTY;
    }

    public static TransformSequence of(Transform... transforms) {
        return new TransformSequence(List.of(transforms));
    }

    public int size() {
        return transforms.size();
    }

    public boolean isEmpty() {
        return transforms.isEmpty();
    }

    public Transform get(int index) {
        return transforms.get(index);
    }

    /**
     * Returns {@code true} if {@code other} starts with every transform of this sequence, in the
     * same positions and structurally equal. A sequence is a prefix of itself, and the empty
     * sequence is a prefix of every sequence.
     */
    public boolean isPrefixOf(TransformSequence other) {
        Objects.requireNonNull(other, "other must not be null");
        if (transforms.size() > other.transforms.size()) {
            return false;
        }
        for (int i = 0; i < transforms.size(); i++) {
            if (!transforms.get(i).equals(other.transforms.get(i))) {
                return false;
            }
        }
        return true;
    }

    /** The transforms from position {@code from} (inclusive) to the end. */
    public List<Transform> suffixAfter(int from) {
        return transforms.subList(from, transforms.size());
    }

    /** A new sequence with {@code transform} appended. */
    public TransformSequence append(Transform transform) {
        Objects.requireNonNull(transform, "transform must not be null");
        List<Transform> extended = new ArrayList<>(transforms);
        extended.add(transform);
        return new TransformSequence(extended);
    }
}
