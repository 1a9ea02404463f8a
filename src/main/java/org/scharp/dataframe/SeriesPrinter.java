///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.dataframe;

/**
 * Renders a {@link Series} as a fixed-width text table.
 * <p>
 * The output has an optional header line with the index level names, one line per element, and a footer with the
 * Series' kind and (if it has one) its name.  For example, a {@link Kind#FLOAT} Series with a two-level index prints
 * as
 * </p>
 *
 * <pre>
 * a x    1.00
 *   y    2.00
 * b x    3.00
 * kind: float
 * </pre>
 *
 * <p>
 * For every index level except the last, a label is left blank when it equals the last label shown at that level.
 * Levels are elided independently, so an inner label can stay blank on a row where an outer label changes.
 * An empty Series prints as {@code Series{}}.
 * </p>
 */
public final class SeriesPrinter {

    private final DisplayOptions options;

    /**
     * Creates a printer.
     *
     * @param options
     *     Controls the spacing, precision, and formats of the output.
     *
     * @throws NullPointerException
     *     if {@code options} is {@code null}.
     */
    public SeriesPrinter(DisplayOptions options) {
        ArgumentUtil.checkNotNull(options, "options");
        this.options = options;
    }

    /**
     * Renders a Series.
     *
     * @param series
     *     The Series to render.
     *
     * @return The rendered table.  Every line, including the last, ends with a newline, except for an empty Series.
     *
     * @throws NullPointerException
     *     if {@code series} is {@code null}.
     */
    public String print(Series series) {
        ArgumentUtil.checkNotNull(series, "series");
        if (series.len() == 0) {
            return "Series{}";
        }

        StringBuilder output = new StringBuilder();
        IndexPrinter indexPrinter = new IndexPrinter(series.index, options);
        String header = indexPrinter.header();
        if (!header.isEmpty()) {
            output.append(header.stripTrailing()).append('\n');
        }

        for (int row = 0; row < series.len(); row++) {
            String value = IndexPrinter.formatValue(series.values, row, options);
            String line = indexPrinter.row(row) + IndexPrinter.spaces(options.valuesBuffer()) + value;
            // an empty string value must not leave trailing whitespace.
            output.append(value.isEmpty() ? line.stripTrailing() : line).append('\n');
        }

        output.append("kind: ").append(series.kind().displayName()).append('\n');
        if (!series.name().isEmpty()) {
            output.append("name: ").append(series.name()).append('\n');
        }
        return output.toString();
    }
}
