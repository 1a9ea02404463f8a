///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.dataframe;

import java.util.Arrays;

/**
 * A column of {@link Kind#FLOAT} values.  A null element is stored as {@code NaN}.
 */
final class FloatValues extends Values {

    private double[] data;

    FloatValues(int capacity) {
        data = new double[capacity];
    }

    @Override
    Kind kind() {
        return Kind.FLOAT;
    }

    @Override
    Object get(int position) {
        double value = data[position];
        return Double.isNaN(value) ? null : value;
    }

    @Override
    void set(int position, Object value) {
        data[position] = Conversions.toDouble(value);
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
        return Conversions.isIntegral(value) || Conversions.isFloatingPoint(value);
    }

    @Override
    int compareValues(Object first, Object second) {
        return Double.compare((Double) first, (Double) second);
    }

    @Override
    Object nullValue() {
        return Double.NaN;
    }
}
