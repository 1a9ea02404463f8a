///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.dataframe;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Builds columns of values from the raw data that callers give to the constructors.
 */
final class ValuesFactory {

    // private constructor to prevent anyone from instantiating the class.
    private ValuesFactory() {
    }

    /**
     * Creates a column from raw data.
     * <p>
     * The data may be:
     * </p>
     * <ul>
     *     <li>{@code null}, which creates an empty {@link Kind#GENERIC} column.</li>
     *     <li>a single supported value ({@code Double}, {@code Float}, {@code Long}, {@code Integer}, {@code Short},
     *     {@code Byte}, {@code String}, {@code Boolean}, or {@code Instant}), which creates a column of one
     *     element.</li>
     *     <li>an array of a primitive type or of {@code String} or {@code Instant}, which creates a column of the
     *     corresponding kind.</li>
     *     <li>a {@code List} or an {@code Object[]}, whose kind is inferred from the elements.</li>
     * </ul>
     *
     * @param data
     *     The raw data.
     *
     * @return A new column.
     *
     * @throws ConstructionException
     *     if {@code data} or any of its elements has an unsupported type.
     */
    static Values fromData(Object data) {
        if (data == null) {
            return Values.create(Kind.GENERIC, 0);
        }

        if (data instanceof double[] doubles) {
            Values values = Values.create(Kind.FLOAT, doubles.length);
            for (double value : doubles) {
                values.add(value);
            }
            return values;
        }
        if (data instanceof float[] floats) {
            Values values = Values.create(Kind.FLOAT, floats.length);
            for (float value : floats) {
                values.add(value);
            }
            return values;
        }
        if (data instanceof long[] longs) {
            Values values = Values.create(Kind.INT, longs.length);
            for (long value : longs) {
                values.add(value);
            }
            return values;
        }
        if (data instanceof int[] ints) {
            Values values = Values.create(Kind.INT, ints.length);
            for (int value : ints) {
                values.add(value);
            }
            return values;
        }
        if (data instanceof short[] shorts) {
            Values values = Values.create(Kind.INT, shorts.length);
            for (short value : shorts) {
                values.add(value);
            }
            return values;
        }
        if (data instanceof byte[] bytes) {
            Values values = Values.create(Kind.INT, bytes.length);
            for (byte value : bytes) {
                values.add(value);
            }
            return values;
        }
        if (data instanceof boolean[] booleans) {
            Values values = Values.create(Kind.BOOL, booleans.length);
            for (boolean value : booleans) {
                values.add(value);
            }
            return values;
        }
        if (data instanceof String[] strings) {
            return Values.of(Kind.STRING, Arrays.asList(strings));
        }
        if (data instanceof Instant[] instants) {
            return Values.of(Kind.DATE_TIME, Arrays.asList(instants));
        }
        if (data instanceof Object[] objects) {
            return fromList(Arrays.asList(objects));
        }
        if (data instanceof List<?> list) {
            return fromList(list);
        }
        if (Conversions.isSupported(data)) {
            return fromList(List.of(data));
        }

        throw new ConstructionException("unsupported data type: " + data.getClass().getName());
    }

    /**
     * Creates a column from a list of boxed values, inferring the narrowest kind that can hold all of them.
     *
     * @param list
     *     The values.  A {@code null} entry (or a floating point {@code NaN}) is a null element.
     *
     * @return A new column.
     *
     * @throws ConstructionException
     *     if any of the elements has an unsupported type.
     */
    static Values fromList(List<?> list) {
        List<Object> elements = new ArrayList<>(list);
        return Values.of(inferKind(elements), elements);
    }

    /**
     * Infers the narrowest kind that can hold all the given values.
     * <ul>
     *     <li>If all non-null values are integral, the kind is {@link Kind#INT}.</li>
     *     <li>If all non-null values are numeric and at least one is floating point, the kind is
     *     {@link Kind#FLOAT}.</li>
     *     <li>If all non-null values are of the same non-numeric type, the kind is the kind of that type.</li>
     *     <li>Otherwise (a mix of types, or no non-null values at all), the kind is {@link Kind#GENERIC}.</li>
     * </ul>
     *
     * @throws ConstructionException
     *     if any of the values has an unsupported type.
     */
    static Kind inferKind(List<?> list) {
        Kind inferred = null;
        for (Object value : list) {
            if (value == null) {
                continue;
            }
            if (!Conversions.isSupported(value)) {
                throw new ConstructionException(
                    "unsupported element type: " + value.getClass().getName() + " (value " + value + ")");
            }

            Kind kind = kindOf(value);
            if (inferred == null || inferred == kind) {
                inferred = kind;
            } else if (inferred.isNumeric() && kind.isNumeric() && inferred != Kind.BOOL && kind != Kind.BOOL) {
                // mixing integers with floating point numbers widens to floating point.
                inferred = Kind.FLOAT;
            } else {
                inferred = Kind.GENERIC;
            }
        }
        return inferred == null ? Kind.GENERIC : inferred;
    }

    private static Kind kindOf(Object value) {
        if (Conversions.isIntegral(value)) {
            return Kind.INT;
        }
        if (Conversions.isFloatingPoint(value)) {
            return Kind.FLOAT;
        }
        if (value instanceof Boolean) {
            return Kind.BOOL;
        }
        if (value instanceof Instant) {
            return Kind.DATE_TIME;
        }
        return Kind.STRING;
    }
}
