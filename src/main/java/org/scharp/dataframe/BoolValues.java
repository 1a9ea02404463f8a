///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.dataframe;

import java.util.Arrays;

/**
 * A column of {@link Kind#BOOL} values.  Nulls are tracked with a separate flag, so {@code false} is never null.
 */
final class BoolValues extends Values {

    private boolean[] data;
    private boolean[] nulls;

    BoolValues(int capacity) {
        data = new boolean[capacity];
        nulls = new boolean[capacity];
    }

    @Override
    Kind kind() {
        return Kind.BOOL;
    }

    @Override
    Object get(int position) {
        return nulls[position] ? null : data[position];
    }

    @Override
    void set(int position, Object value) {
        Boolean converted = Conversions.toBoolean(value);
        nulls[position] = converted == null;
        data[position] = converted != null && converted;
    }

    @Override
    void ensureCapacity(int capacity) {
        if (data.length < capacity) {
            int newCapacity = Math.max(capacity, data.length * 2);
            data = Arrays.copyOf(data, newCapacity);
            nulls = Arrays.copyOf(nulls, newCapacity);
        }
    }

    @Override
    void move(int from, int to, int count) {
        System.arraycopy(data, from, data, to, count);
        System.arraycopy(nulls, from, nulls, to, count);
    }

    @Override
    boolean accepts(Object value) {
        return value instanceof Boolean;
    }

    @Override
    int compareValues(Object first, Object second) {
        return Boolean.compare((Boolean) first, (Boolean) second);
    }

    @Override
    Object nullValue() {
        return false;
    }
}
