///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.dataframe;

import java.util.Arrays;

/**
 * A column of {@link Kind#GENERIC} values: a mix of any supported types.
 * <p>
 * A null element is stored as a {@code null} reference.  A floating point {@code NaN} is stored as a null element.
 * Values of an unsupported type are stored as null elements, too, so conversions into this kind remain total.
 * </p>
 */
final class GenericValues extends Values {

    private Object[] data;

    GenericValues(int capacity) {
        data = new Object[capacity];
    }

    @Override
    Kind kind() {
        return Kind.GENERIC;
    }

    @Override
    Object get(int position) {
        return data[position];
    }

    @Override
    void set(int position, Object value) {
        if (!Conversions.isSupported(value)) {
            data[position] = null;
        } else if (Conversions.isFloatingPoint(value) && Double.isNaN(((Number) value).doubleValue())) {
            data[position] = null;
        } else {
            data[position] = value;
        }
    }

    @Override
    void ensureCapacity(int capacity) {
        if (data.length < capacity) {
            data = Arrays.copyOf(data, Math.max(capacity, data.length * 2));
        }
    }

    @Override
    void move(int from, int to, int count) {
        System.arraycopy(data, from, data, to, count);
    }

    @Override
    boolean accepts(Object value) {
        return Conversions.isSupported(value);
    }

    /**
     * Values of mixed types have no natural order, so they're ordered by their rendered text.
     */
    @Override
    int compareValues(Object first, Object second) {
        return Conversions.render(first).compareTo(Conversions.render(second));
    }

    @Override
    Object nullValue() {
        return null;
    }
}
