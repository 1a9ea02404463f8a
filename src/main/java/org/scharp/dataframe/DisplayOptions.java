///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.dataframe;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Options that control how {@link SeriesPrinter} and {@link DataFramePrinter} render tables.
 * <p>
 * Instances of this class are immutable.  They are created with a {@link DisplayOptions.Builder}:
 * </p>
 *
 * <pre>
 * DisplayOptions options = DisplayOptions.builder().
 *     floatPrecision(4).
 *     maxWidth(20).
 *     build();
 * </pre>
 */
public final class DisplayOptions {

    /** The options used by {@link Series#toString()} and {@link DataFrame#toString()}. */
    public static final DisplayOptions DEFAULT = builder().build();

    private final int indexBuffer;
    private final int valuesBuffer;
    private final int floatPrecision;
    private final int maxWidth;
    private final String timeFormat;
    private final DateTimeFormatter timeFormatter;

    /**
     * A builder class for {@link DisplayOptions}.
     */
    public final static class Builder {
        private int indexBuffer;
        private int valuesBuffer;
        private int floatPrecision;
        private int maxWidth;
        private String timeFormat;

        private Builder() {
            this.indexBuffer = 1;
            this.valuesBuffer = 4;
            this.floatPrecision = 2;
            this.maxWidth = 35;
            this.timeFormat = "yyyy-MM-dd'T'HH:mm:ss'Z'";
        }

        /**
         * Sets the number of spaces between index levels.
         *
         * @param indexBuffer
         *     The number of spaces.
         *
         * @return This builder
         *
         * @throws IllegalArgumentException
         *     if {@code indexBuffer} is negative.
         */
        public Builder indexBuffer(int indexBuffer) {
            ArgumentUtil.checkNotNegative(indexBuffer, "indexBuffer");
            this.indexBuffer = indexBuffer;
            return this;
        }

        /**
         * Sets the number of spaces before each value.
         *
         * @param valuesBuffer
         *     The number of spaces.
         *
         * @return This builder
         *
         * @throws IllegalArgumentException
         *     if {@code valuesBuffer} is negative.
         */
        public Builder valuesBuffer(int valuesBuffer) {
            ArgumentUtil.checkNotNegative(valuesBuffer, "valuesBuffer");
            this.valuesBuffer = valuesBuffer;
            return this;
        }

        /**
         * Sets the number of digits printed after the decimal point of a {@link Kind#FLOAT} value.
         *
         * @param floatPrecision
         *     The number of digits.
         *
         * @return This builder
         *
         * @throws IllegalArgumentException
         *     if {@code floatPrecision} is negative.
         */
        public Builder floatPrecision(int floatPrecision) {
            ArgumentUtil.checkNotNegative(floatPrecision, "floatPrecision");
            this.floatPrecision = floatPrecision;
            return this;
        }

        /**
         * Sets the widest a label may be printed.  Longer labels are cut and end with {@code "..."}.
         *
         * @param maxWidth
         *     The maximum width.
         *
         * @return This builder
         *
         * @throws IllegalArgumentException
         *     if {@code maxWidth} is less than 4.
         */
        public Builder maxWidth(int maxWidth) {
            if (maxWidth < 4) {
                throw new IllegalArgumentException("maxWidth must be at least 4");
            }
            this.maxWidth = maxWidth;
            return this;
        }

        /**
         * Sets the pattern used to print {@link Kind#DATE_TIME} values.  Times are printed in UTC.
         *
         * @param timeFormat
         *     A {@link DateTimeFormatter} pattern.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code timeFormat} is {@code null}.
         * @throws IllegalArgumentException
         *     if {@code timeFormat} is not a valid pattern.
         */
        public Builder timeFormat(String timeFormat) {
            ArgumentUtil.checkNotNull(timeFormat, "timeFormat");
            DateTimeFormatter.ofPattern(timeFormat); // fail now on a bad pattern
            this.timeFormat = timeFormat;
            return this;
        }

        /**
         * Builds an immutable {@link DisplayOptions} from this builder's options.
         *
         * @return New display options.
         */
        public DisplayOptions build() {
            return new DisplayOptions(indexBuffer, valuesBuffer, floatPrecision, maxWidth, timeFormat);
        }
    }

    /**
     * Creates a new builder with the default options.
     *
     * @return A new builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    private DisplayOptions(int indexBuffer, int valuesBuffer, int floatPrecision, int maxWidth, String timeFormat) {
        this.indexBuffer = indexBuffer;
        this.valuesBuffer = valuesBuffer;
        this.floatPrecision = floatPrecision;
        this.maxWidth = maxWidth;
        this.timeFormat = timeFormat;
        this.timeFormatter = DateTimeFormatter.ofPattern(timeFormat).withZone(ZoneOffset.UTC);
    }

    /**
     * @return The number of spaces between index levels.
     */
    public int indexBuffer() {
        return indexBuffer;
    }

    /**
     * @return The number of spaces before each value.
     */
    public int valuesBuffer() {
        return valuesBuffer;
    }

    /**
     * @return The number of digits printed after the decimal point of a floating point value.
     */
    public int floatPrecision() {
        return floatPrecision;
    }

    /**
     * @return The widest a label may be printed.
     */
    public int maxWidth() {
        return maxWidth;
    }

    /**
     * @return The pattern used to print times.
     */
    public String timeFormat() {
        return timeFormat;
    }

    DateTimeFormatter timeFormatter() {
        return timeFormatter;
    }
}
