///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.dataframe;

import java.util.Arrays;

/**
 * A column of {@link Kind#STRING} values.
 * <p>
 * A null element is stored as a {@code null} reference, which keeps it distinct from the empty string.  It is rendered
 * as "NaN".
 * </p>
 */
final class StringValues extends Values {

    private String[] data;

    StringValues(int capacity) {
        data = new String[capacity];
    }

    @Override
    Kind kind() {
        return Kind.STRING;
    }

    @Override
    Object get(int position) {
        return data[position];
    }

    @Override
    void set(int position, Object value) {
        data[position] = Conversions.toText(value);
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
        return value instanceof String;
    }

    @Override
    int compareValues(Object first, Object second) {
        return ((String) first).compareTo((String) second);
    }

    @Override
    Object nullValue() {
        return null;
    }
}
