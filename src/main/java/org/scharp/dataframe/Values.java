///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.dataframe;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A growable column of nullable values of one {@link Kind}.
 * <p>
 * This is the storage behind both the values of a {@link Series} and the labels of an index {@link Level}.  Each
 * subclass stores its elements in a primitive or object array and decides how a null element is represented.  This
 * class implements the structural operations (select, insert, drop, swap, append, convert) in terms of four
 * element-level hooks.
 * </p>
 * <p>
 * The element-level hooks are not bounds checked.  The structural operations that are visible to the rest of the
 * package check their positions and throw {@link BoundsException}.
 * </p>
 */
abstract class Values {

    private static final int DEFAULT_CAPACITY = 8;

    /** The number of elements in this column.  The backing arrays may be larger. */
    int size;

    /**
     * Creates a new, empty column of a given kind.
     *
     * @param kind
     *     The kind of the new column.
     * @param capacity
     *     The number of elements the column can hold before it must grow.
     *
     * @return A new, empty column.
     */
    static Values create(Kind kind, int capacity) {
        capacity = Math.max(capacity, DEFAULT_CAPACITY);
        switch (kind) {
        case FLOAT:
            return new FloatValues(capacity);
        case INT:
            return new IntValues(capacity);
        case STRING:
            return new StringValues(capacity);
        case BOOL:
            return new BoolValues(capacity);
        case DATE_TIME:
            return new DateTimeValues(capacity);
        case GENERIC:
            return new GenericValues(capacity);
        default:
            throw new IllegalArgumentException("unknown kind: " + kind);
        }
    }

    /**
     * Creates a column of a given kind from some values, converting each value to the kind.
     * <p>
     * Like all conversions, this never fails. Values that can't be converted become null elements.
     * </p>
     *
     * @param kind
     *     The kind of the new column.
     * @param values
     *     The values, with {@code null} for a null element.
     *
     * @return A new column.
     */
    static Values of(Kind kind, List<?> values) {
        Values column = create(kind, values.size());
        for (Object value : values) {
            column.add(value);
        }
        return column;
    }

    /**
     * Creates a column with the integers {@code 0, 1, ..., n - 1}.
     *
     * @param n
     *     The number of elements.
     *
     * @return A new {@link Kind#INT} column.
     */
    static Values range(int n) {
        Values column = create(Kind.INT, n);
        for (long i = 0; i < n; i++) {
            column.add(i);
        }
        return column;
    }

    /**
     * @return The kind of every element in this column.
     */
    abstract Kind kind();

    /**
     * Gets an element as a boxed value.
     *
     * @param position
     *     The position of the element. This is not checked.
     *
     * @return The element's value, or {@code null} if the element is null.
     */
    abstract Object get(int position);

    /**
     * Stores an element, converting it to this column's kind.  A value that can't be converted is stored as a null
     * element.
     *
     * @param position
     *     The position of the element. This is not checked.
     * @param value
     *     The value to store, or {@code null} to store a null element.
     */
    abstract void set(int position, Object value);

    /**
     * Makes sure that the backing arrays can hold at least {@code capacity} elements.
     */
    abstract void ensureCapacity(int capacity);

    /**
     * Moves {@code count} elements in the backing arrays from {@code from} to {@code to}, like
     * {@link System#arraycopy}.
     */
    abstract void move(int from, int to, int count);

    /**
     * Determines whether a value can be inserted into this column without losing information.
     *
     * @param value
     *     A non-null value.
     *
     * @return {@code true} if the value is representable in this column's kind.
     */
    abstract boolean accepts(Object value);

    /**
     * Compares two non-null elements of this column.
     */
    abstract int compareValues(Object first, Object second);

    /**
     * Gets the value that this column reports for a null element. For example, {@code NaN} for a {@link Kind#FLOAT}
     * column.
     */
    abstract Object nullValue();

    /**
     * @return The number of elements in this column.
     */
    int len() {
        return size;
    }

    /**
     * Gets the value of an element.  This is the value half of the (value, null) pair that identifies an element.
     *
     * @param position
     *     The position of the element. This is not checked.
     *
     * @return The element's value. For a null element, this is the kind's null representation.
     */
    Object value(int position) {
        Object value = get(position);
        return value == null ? nullValue() : value;
    }

    /**
     * Determines whether an element is null. This is the null half of the (value, null) pair that identifies an
     * element.
     *
     * @param position
     *     The position of the element. This is not checked.
     *
     * @return {@code true}, if the element is null.
     */
    boolean isNull(int position) {
        return get(position) == null;
    }

    /**
     * Renders an element the way it appears in label maps.
     */
    String render(int position) {
        return Conversions.render(get(position));
    }

    /**
     * Appends an element without checking whether it is representable.
     */
    void add(Object value) {
        ensureCapacity(size + 1);
        set(size, value);
        size++;
    }

    /**
     * Selects elements by position into a new column.  The positions may be given in any order and may repeat.
     *
     * @param positions
     *     The positions to select.
     *
     * @return A new column with {@code positions.size()} elements.
     *
     * @throws BoundsException
     *     if any position is out of range.
     */
    Values in(List<Integer> positions) {
        ArgumentUtil.checkPositions(positions, size, "row");

        Values selected = create(kind(), positions.size());
        for (int position : positions) {
            selected.add(get(position));
        }
        return selected;
    }

    /**
     * Inserts an element, shifting the element at {@code position} and all subsequent elements up by one.
     *
     * @param position
     *     The position of the new element.  If this is {@code len()}, the element is appended.
     * @param value
     *     The value to insert, or {@code null} for a null element.
     *
     * @throws BoundsException
     *     if {@code position} is negative or greater than {@code len()}.
     * @throws TypeMismatchException
     *     if {@code value} can't be represented in this column's kind.
     */
    void insert(int position, Object value) {
        checkInsert(position, value);

        ensureCapacity(size + 1);
        move(position, position + 1, size - position);
        set(position, value);
        size++;
    }

    /**
     * Checks the arguments of {@link #insert} without modifying this column.
     */
    void checkInsert(int position, Object value) {
        ArgumentUtil.checkInsertPosition(position, size);
        if (value != null && !accepts(value)) {
            throw new TypeMismatchException(
                "cannot insert " + value + " (" + value.getClass().getSimpleName() + ") into a column of kind " +
                    kind().displayName());
        }
    }

    /**
     * Removes an element, shifting all subsequent elements down by one.
     *
     * @param position
     *     The position of the element to remove.
     *
     * @throws BoundsException
     *     if {@code position} is negative or not less than {@code len()}.
     */
    void drop(int position) {
        ArgumentUtil.checkPosition(position, size, "row");

        move(position + 1, position, size - position - 1);
        size--;
        set(size, null); // release any reference held by the vacated slot
    }

    /**
     * Appends all elements of another column, converting each to this column's kind.
     *
     * @param other
     *     The column to append.  It's not modified.
     */
    void append(Values other) {
        // other may be this column, so its length is read once.
        int count = other.size;
        ensureCapacity(size + count);
        for (int i = 0; i < count; i++) {
            add(other.convertible(i, kind()));
        }
    }

    /**
     * Swaps two elements.
     */
    void swap(int i, int j) {
        Object temp = get(i);
        set(i, get(j));
        set(j, temp);
    }

    /**
     * Compares two elements.  Non-null elements are ordered by their kind's natural order.  Null elements are ordered
     * after all non-null elements and are equal to each other.
     *
     * @return a negative number, zero, or a positive number as element {@code i} is less than, equal to, or greater
     *     than element {@code j}.
     */
    int compare(int i, int j) {
        Object first = get(i);
        Object second = get(j);
        if (first == null || second == null) {
            return Boolean.compare(first == null, second == null);
        }
        return compareValues(first, second);
    }

    /**
     * Determines whether element {@code i} is ordered before element {@code j}.
     */
    boolean less(int i, int j) {
        return compare(i, j) < 0;
    }

    /**
     * Converts every element of this column to another kind.  This never fails; elements that can't be converted
     * become null elements.
     *
     * @param kind
     *     The target kind.
     *
     * @return A new column of kind {@code kind}.
     */
    Values convert(Kind kind) {
        Values converted = create(kind, size);
        for (int i = 0; i < size; i++) {
            converted.add(convertible(i, kind));
        }
        return converted;
    }

    /**
     * Gets an element in the form that a column of another kind should convert.  Most elements are passed through;
     * the conversion rules of the target column apply to them.  An element of a generic column that isn't a number
     * or a string has no numeric reading, so it's null when the target is {@link Kind#FLOAT} or {@link Kind#INT}.
     */
    Object convertible(int position, Kind target) {
        Object value = get(position);
        if (kind() == Kind.GENERIC && (target == Kind.FLOAT || target == Kind.INT)) {
            return Conversions.genericToNumeric(value);
        }
        return value;
    }

    /**
     * @return A deep copy of this column.
     */
    Values copy() {
        return convert(kind());
    }

    /**
     * @return The positions of all non-null elements, in order.
     */
    List<Integer> valid() {
        List<Integer> positions = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            if (!isNull(i)) {
                positions.add(i);
            }
        }
        return positions;
    }

    /**
     * @return The positions of all null elements, in order.
     */
    List<Integer> nulls() {
        List<Integer> positions = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            if (isNull(i)) {
                positions.add(i);
            }
        }
        return positions;
    }

    /**
     * @return The values of all elements, including the null representation of null elements.
     */
    List<Object> values() {
        List<Object> values = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            values.add(value(i));
        }
        return Collections.unmodifiableList(values);
    }

    /**
     * @return The boxed elements, with {@code null} for null elements.
     */
    List<Object> nullableValues() {
        List<Object> values = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            values.add(get(i));
        }
        return values;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind(), nullableValues());
    }

    /**
     * Two columns are equal if they have the same kind, the same length, and equal elements at every position.  Null
     * elements are equal to each other.
     */
    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Values otherValues)) {
            return false;
        }
        if (kind() != otherValues.kind() || size != otherValues.size) {
            return false;
        }
        for (int i = 0; i < size; i++) {
            if (!Objects.equals(get(i), otherValues.get(i))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        List<String> rendered = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            rendered.add(render(i));
        }
        return kind().displayName() + rendered;
    }
}
