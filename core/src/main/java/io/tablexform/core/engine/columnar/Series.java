package io.tablexform.core.engine.columnar;

import io.tablexform.core.model.ColumnType;
import java.util.BitSet;
import java.util.List;

/**
 * One typed column of a {@link ColumnarFrame}.
 *
 * <p>
 * Values live in a primitive array matching the element type ({@code long[]},
 * {@code double[]}, {@code boolean[]}), or an object array for text and mixed columns. A
 * separate validity bitmap marks which slots hold a value; a cleared bit is a {@code null}.
 * A float {@code NaN} is an ordinary valid value.
 *
 * <p>
 * Immutable once built.
 */
public final class Series {

    private final String name;
    private final ColumnType type;
    private final int length;
    private final long[] longs;
    private final double[] doubles;
    private final boolean[] booleans;
    private final Object[] objects;
    private final BitSet validity;

    private Series(Builder builder) {
        this.name = builder.name;
        this.type = builder.type;
        this.length = builder.size;
        this.longs = builder.longs;
        this.doubles = builder.doubles;
        this.booleans = builder.booleans;
        this.objects = builder.objects;
        this.validity = builder.validity;
    }

    static Builder builder(String name, ColumnType type, int capacity) {
        return new Builder(name, type, capacity);
    }

    /** Builds a series from canonical values; {@code null} entries become nulls. */
    static Series of(String name, ColumnType type, List<Object> values) {
        Builder builder = builder(name, type, values.size());
        for (Object value : values) {
            builder.append(value);
        }
        return builder.build();
    }

    public String name() {
        return name;
    }

    public ColumnType type() {
        return type;
    }

    public int length() {
        return length;
    }

    public boolean isValid(int index) {
        checkIndex(index);
        return validity.get(index);
    }

    public int nullCount() {
        return length - validity.cardinality();
    }

    /** Value at {@code index}, boxed, or {@code null} if the slot is null. */
    public Object get(int index) {
        checkIndex(index);
        if (!validity.get(index)) {
            return null;
        }
        return switch (type) {
            case INTEGER -> longs[index];
            case FLOAT -> doubles[index];
            case BOOLEAN -> booleans[index];
            case TEXT, MIXED -> objects[index];
        };
    }

    /** Copy of the validity bitmap. */
    BitSet validity() {
        return (BitSet) validity.clone();
    }

    Series rename(String newName) {
        Builder builder = builder(newName, type, length);
        for (int i = 0; i < length; i++) {
            builder.append(get(i));
        }
        return builder.build();
    }

    /** Gathers the given positions, in order; positions may repeat. */
    Series take(int[] positions) {
        Builder builder = builder(name, type, positions.length);
        for (int position : positions) {
            builder.append(get(position));
        }
        return builder.build();
    }

    private void checkIndex(int index) {
        if (index < 0 || index >= length) {
            throw new IndexOutOfBoundsException("Index " + index + " out of bounds for series '" + name
                    + "' of length " + length);
        }
    }

    /** Appends values into preallocated typed storage. */
    static final class Builder {

        private final String name;
        private final ColumnType type;
        private final long[] longs;
        private final double[] doubles;
        private final boolean[] booleans;
        private final Object[] objects;
        private final BitSet validity;
        private int size;

        private Builder(String name, ColumnType type, int capacity) {
            this.name = name;
            this.type = type;
            this.longs = type == ColumnType.INTEGER ? new long[capacity] : null;
            this.doubles = type == ColumnType.FLOAT ? new double[capacity] : null;
            this.booleans = type == ColumnType.BOOLEAN ? new boolean[capacity] : null;
            this.objects = type == ColumnType.TEXT || type == ColumnType.MIXED ? new Object[capacity] : null;
            this.validity = new BitSet(capacity);
        }

        Builder append(Object value) {
            int index = size++;
            if (value == null) {
                return this;
            }
            validity.set(index);
            switch (type) {
                case INTEGER -> longs[index] = (Long) value;
                case FLOAT -> doubles[index] = (Double) value;
                case BOOLEAN -> booleans[index] = (Boolean) value;
                case TEXT -> objects[index] = (String) value;
                case MIXED -> objects[index] = value;
            }
            return this;
        }

        Series build() {
            int capacity = longs != null
                    ? longs.length
                    : doubles != null ? doubles.length : booleans != null ? booleans.length : objects.length;
            if (size != capacity) {
                throw new IllegalStateException(
                        "Series '" + name + "' built with " + size + " values, expected " + capacity);
            }
            return new Series(this);
        }
    }
}
