///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.dataframe;

import java.util.Arrays;

/**
 * A column of {@link Kind#INT} values.  Nulls are tracked with a separate flag, so a zero is never null.
 */
final class IntValues extends Values {

    private long[] data;
    private boolean[] nulls;

    IntValues(int capacity) {
        data = new long[capacity];
        nulls = new boolean[capacity];
    }

    @Override
    Kind kind() {
        return Kind.INT;
    }

    @Override
    Object get(int position) {
        return nulls[position] ? null : data[position];
    }

    @Override
    void set(int position, Object value) {
        Long converted = Conversions.toLong(value);
        nulls[position] = converted == null;
        data[position] = converted == null ? 0 : converted;
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
        return Conversions.isIntegral(value);
    }

    @Override
    int compareValues(Object first, Object second) {
        return Long.compare((Long) first, (Long) second);
    }

    @Override
    Object nullValue() {
        return 0L;
    }
}
