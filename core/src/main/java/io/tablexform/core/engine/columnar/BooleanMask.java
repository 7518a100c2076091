package io.tablexform.core.engine.columnar;

import java.util.BitSet;
import java.util.function.IntPredicate;

/**
 * Nullable boolean column used to select rows. Logic is three-valued (Kleene): a comparison
 * against a null slot yields null, {@code false AND null} is false, {@code true OR null} is
 * true, and {@code NOT null} stays null.
 *
 * <p>
 * Immutable.
 */
public final class BooleanMask {

    private final int length;
    private final BitSet values;
    private final BitSet validity;

    private BooleanMask(int length, BitSet values, BitSet validity) {
        this.length = length;
        this.values = values;
        this.validity = validity;
    }

    /**
     * Evaluates a predicate over the valid slots of a series. Null slots of the series are null in
     * the mask.
     */
    public static BooleanMask evaluate(Series series, IntPredicate validSlot) {
        BitSet validity = series.validity();
        BitSet values = new BitSet(series.length());
        for (int i = validity.nextSetBit(0); i >= 0; i = validity.nextSetBit(i + 1)) {
            if (validSlot.test(i)) {
                values.set(i);
            }
        }
        return new BooleanMask(series.length(), values, validity);
    }

    /** Non-null mask that is true where the series is null. */
    public static BooleanMask isNull(Series series) {
        BitSet values = series.validity();
        values.flip(0, series.length());
        return full(series.length(), values);
    }

    /** Non-null mask with the given values. */
    public static BooleanMask full(int length, BitSet values) {
        BitSet validity = new BitSet(length);
        validity.set(0, length);
        return new BooleanMask(length, (BitSet) values.clone(), validity);
    }

    public int length() {
        return length;
    }

    /** {@code TRUE}, {@code FALSE}, or {@code null} for a null slot. */
    public Boolean get(int index) {
        if (index < 0 || index >= length) {
            throw new IndexOutOfBoundsException("Index " + index + " out of bounds for mask of length " + length);
        }
        return validity.get(index) ? values.get(index) : null;
    }

    public int nullCount() {
        return length - validity.cardinality();
    }

    public BooleanMask not() {
        BitSet flipped = (BitSet) values.clone();
        flipped.flip(0, length);
        flipped.and(validity);
        return new BooleanMask(length, flipped, (BitSet) validity.clone());
    }

    public BooleanMask and(BooleanMask other) {
        checkLength(other);
        BitSet resultValues = (BitSet) values.clone();
        resultValues.and(other.values);
        // Valid where both are valid, or where either side is a valid false.
        BitSet resultValidity = (BitSet) validity.clone();
        resultValidity.and(other.validity);
        resultValidity.or(knownFalse());
        resultValidity.or(other.knownFalse());
        resultValues.and(resultValidity);
        return new BooleanMask(length, resultValues, resultValidity);
    }

    public BooleanMask or(BooleanMask other) {
        checkLength(other);
        BitSet thisTrue = (BitSet) values.clone();
        thisTrue.and(validity);
        BitSet otherTrue = (BitSet) other.values.clone();
        otherTrue.and(other.validity);
        BitSet resultValues = (BitSet) thisTrue.clone();
        resultValues.or(otherTrue);
        // Valid where both are valid, or where either side is a valid true.
        BitSet resultValidity = (BitSet) validity.clone();
        resultValidity.and(other.validity);
        resultValidity.or(resultValues);
        return new BooleanMask(length, resultValues, resultValidity);
    }

    /** Replaces null slots with {@code value}. */
    public BooleanMask fillNull(boolean value) {
        BitSet filled = (BitSet) values.clone();
        if (value) {
            BitSet nulls = (BitSet) validity.clone();
            nulls.flip(0, length);
            filled.or(nulls);
        }
        return full(length, filled);
    }

    /** Positions holding a non-null true, ascending. */
    int[] selected() {
        BitSet selected = (BitSet) values.clone();
        selected.and(validity);
        return selected.stream().toArray();
    }

    private BitSet knownFalse() {
        BitSet falses = (BitSet) values.clone();
        falses.flip(0, length);
        falses.and(validity);
        return falses;
    }

    private void checkLength(BooleanMask other) {
        if (other.length != length) {
            throw new IllegalArgumentException("Mask lengths differ: " + length + " and " + other.length);
        }
    }
}
