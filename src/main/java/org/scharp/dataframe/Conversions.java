///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.dataframe;

import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * The element-wise conversions between kinds.
 * <p>
 * Every method here is total: it never throws.  An input that cannot be converted becomes the null of the target
 * kind, which these methods return as {@code null} (or {@code NaN} for {@link #toDouble}).  A {@code null} input is
 * always a null element.
 * </p>
 */
final class Conversions {

    /** The text of a null element when it is rendered. */
    static final String NULL_TEXT = "NaN";

    private static final long NANOS_PER_SECOND = 1_000_000_000L;

    // private constructor to prevent anyone from instantiating the class.
    private Conversions() {
    }

    /**
     * Determines whether a boxed value is one of Java's integral types that fit into a {@code long}.
     */
    static boolean isIntegral(Object value) {
        return value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte;
    }

    /**
     * Determines whether a boxed value is a {@code Double} or a {@code Float}.
     */
    static boolean isFloatingPoint(Object value) {
        return value instanceof Double || value instanceof Float;
    }

    /**
     * Determines whether a boxed value has a type that can be stored in a column.
     */
    static boolean isSupported(Object value) {
        return isIntegral(value) || isFloatingPoint(value) || value instanceof String || value instanceof Boolean ||
            value instanceof Instant;
    }

    /**
     * Narrows an element of a {@link Kind#GENERIC} column before it's converted to {@link Kind#FLOAT} or
     * {@link Kind#INT}.  In a generic column only numbers and text have a numeric reading, so any other element
     * becomes null.
     *
     * @param value
     *     An element of a generic column.
     *
     * @return {@code value} if it's a number or a string, otherwise {@code null}.
     */
    static Object genericToNumeric(Object value) {
        return isIntegral(value) || isFloatingPoint(value) || value instanceof String ? value : null;
    }

    /**
     * Converts a value to a double.
     *
     * @param value
     *     The value to convert.
     *
     * @return The converted value, or {@code NaN} if it's null or can't be converted.
     */
    static double toDouble(Object value) {
        if (value instanceof Number number && (isIntegral(value) || isFloatingPoint(value))) {
            return number.doubleValue();
        }
        if (value instanceof Boolean bool) {
            return bool ? 1 : 0;
        }
        if (value instanceof String string) {
            try {
                return Double.parseDouble(string.trim());
            } catch (NumberFormatException exception) {
                return Double.NaN;
            }
        }
        if (value instanceof Instant instant) {
            Long nanos = epochNanos(instant);
            return nanos == null ? Double.NaN : nanos;
        }
        return Double.NaN;
    }

    /**
     * Converts a value to a long.  Floating point values are truncated toward zero.
     *
     * @param value
     *     The value to convert.
     *
     * @return The converted value, or {@code null} if it's null or can't be converted.
     */
    static Long toLong(Object value) {
        if (isIntegral(value)) {
            return ((Number) value).longValue();
        }
        if (isFloatingPoint(value)) {
            double doubleValue = ((Number) value).doubleValue();
            return Double.isNaN(doubleValue) ? null : (long) doubleValue;
        }
        if (value instanceof Boolean bool) {
            return bool ? 1L : 0L;
        }
        if (value instanceof String string) {
            try {
                return Long.parseLong(string.trim());
            } catch (NumberFormatException exception) {
                return null;
            }
        }
        if (value instanceof Instant instant) {
            return epochNanos(instant);
        }
        return null;
    }

    /**
     * Converts a value to text.
     *
     * @param value
     *     The value to convert.
     *
     * @return The converted value, or {@code null} if it's null.
     */
    static String toText(Object value) {
        if (value == null) {
            return null;
        }
        if (isFloatingPoint(value) && Double.isNaN(((Number) value).doubleValue())) {
            return null;
        }
        return String.valueOf(value);
    }

    /**
     * Converts a value to a boolean.  Numbers are {@code true} when they are not zero.  Any other non-null value is
     * {@code true}.
     *
     * @param value
     *     The value to convert.
     *
     * @return The converted value, or {@code null} if it's null.
     */
    static Boolean toBoolean(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (isFloatingPoint(value)) {
            double doubleValue = ((Number) value).doubleValue();
            return Double.isNaN(doubleValue) ? null : doubleValue != 0;
        }
        if (isIntegral(value)) {
            return ((Number) value).longValue() != 0;
        }
        return true;
    }

    /**
     * Converts a value to an instant.  Numbers are interpreted as nanoseconds since the Unix epoch, truncated to whole
     * seconds.  Text is parsed as an ISO-8601 instant, like "2019-05-01T00:00:00Z".
     *
     * @param value
     *     The value to convert.
     *
     * @return The converted value, or {@code null} if it's null or can't be converted.
     */
    static Instant toInstant(Object value) {
        if (value instanceof Instant instant) {
            return instant;
        }
        if (value instanceof String string) {
            try {
                return Instant.parse(string.trim());
            } catch (DateTimeParseException exception) {
                return null;
            }
        }
        Long nanos = toLong(value);
        if (nanos == null) {
            return null;
        }
        return Instant.ofEpochSecond(nanos / NANOS_PER_SECOND);
    }

    /**
     * Renders a value as text, the way it's used as a key in label maps and in grouping.  Distinct values with the
     * same rendering (like the integer 1 and the string "1") get the same text.
     *
     * @param value
     *     The value to render.
     *
     * @return The rendered value. A null element is rendered as {@value #NULL_TEXT}.
     */
    static String render(Object value) {
        String text = toText(value);
        return text == null ? NULL_TEXT : text;
    }

    private static Long epochNanos(Instant instant) {
        try {
            return Math.addExact(Math.multiplyExact(instant.getEpochSecond(), NANOS_PER_SECOND), instant.getNano());
        } catch (ArithmeticException exception) {
            // the instant is too far from the epoch to be counted in nanoseconds.
            return null;
        }
    }
}
