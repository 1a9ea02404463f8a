///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.dataframe;

import java.util.Arrays;

/**
 * A class for holding utility methods for the numeric aggregations.
 * <p>
 * None of these methods know about null values.  The callers pass only the valid (non-null) values.
 * </p>
 */
abstract class MathUtil {

    // private constructor to prevent anyone from instantiating the class.
    private MathUtil() {
    }

    /**
     * Computes the sum of some values.
     *
     * @param values
     *     the values to sum
     *
     * @return The sum, which is 0 if there are no values.
     */
    static double sum(double[] values) {
        double sum = 0;
        for (double value : values) {
            sum += value;
        }
        return sum;
    }

    /**
     * Computes the arithmetic mean of some values.
     *
     * @param values
     *     the values to average
     *
     * @return The mean, or {@code NaN} if there are no values.
     */
    static double mean(double[] values) {
        if (values.length == 0) {
            return Double.NaN;
        }
        return sum(values) / values.length;
    }

    /**
     * Computes the smallest of some values.
     *
     * @param values
     *     the values to search
     *
     * @return The minimum, or {@code NaN} if there are no values.
     */
    static double min(double[] values) {
        if (values.length == 0) {
            return Double.NaN;
        }
        double min = values[0];
        for (int i = 1; i < values.length; i++) {
            min = Math.min(min, values[i]);
        }
        return min;
    }

    /**
     * Computes the largest of some values.
     *
     * @param values
     *     the values to search
     *
     * @return The maximum, or {@code NaN} if there are no values.
     */
    static double max(double[] values) {
        if (values.length == 0) {
            return Double.NaN;
        }
        double max = values[0];
        for (int i = 1; i < values.length; i++) {
            max = Math.max(max, values[i]);
        }
        return max;
    }

    /**
     * Computes a quantile of some values by linear interpolation between the two closest ranks.
     * <p>
     * The rank of the quantile is {@code fraction * (n - 1)} in the sorted values.  When that rank falls between two
     * values, the result is interpolated linearly between them.
     * </p>
     *
     * @param values
     *     the values, in any order.  This array is not modified.
     * @param fraction
     *     the quantile to compute, from 0 (the minimum) to 1 (the maximum).
     *
     * @return The quantile, or {@code NaN} if there are no values.
     */
    static double quantile(double[] values, double fraction) {
        assert 0 <= fraction && fraction <= 1 : "fraction must be between 0 and 1";

        if (values.length == 0) {
            return Double.NaN;
        }

        double[] sorted = values.clone();
        Arrays.sort(sorted);

        double rank = fraction * (sorted.length - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        if (lower == upper) {
            return sorted[lower];
        }
        return sorted[lower] + (rank - lower) * (sorted[upper] - sorted[lower]);
    }
}
