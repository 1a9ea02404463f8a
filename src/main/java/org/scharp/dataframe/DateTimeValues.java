///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.dataframe;

import java.time.Instant;
import java.util.Arrays;

/**
 * A column of {@link Kind#DATE_TIME} values.  Nulls are tracked with a separate flag and hold the epoch, so the epoch
 * itself is never null.
 */
final class DateTimeValues extends Values {

    private Instant[] data;
    private boolean[] nulls;

    DateTimeValues(int capacity) {
        data = new Instant[capacity];
        nulls = new boolean[capacity];
    }

    @Override
    Kind kind() {
        return Kind.DATE_TIME;
    }

    @Override
    Object get(int position) {
        return nulls[position] ? null : data[position];
    }

    @Override
    void set(int position, Object value) {
        Instant converted = Conversions.toInstant(value);
        nulls[position] = converted == null;
        data[position] = converted == null ? Instant.EPOCH : converted;
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
        return value instanceof Instant;
    }

    @Override
    int compareValues(Object first, Object second) {
        return ((Instant) first).compareTo((Instant) second);
    }

    @Override
    Object nullValue() {
        return Instant.EPOCH;
    }
}
