///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.dataframe;

/**
 * Renders a {@link DataFrame} as a fixed-width text table.
 * <p>
 * The output starts with one header line per column level, followed by a line of index level names if any level is
 * named, then one line per row.  Repeated labels are elided the same way {@link SeriesPrinter} elides them: for every
 * index level except the last, a label is printed only on the row where it differs from the row above, and for every
 * column level except the last, a label is printed only on the column where it differs from the column to its left.
 * An empty DataFrame prints as {@code DataFrame{}}.
 * </p>
 */
public final class DataFramePrinter {

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
    public DataFramePrinter(DisplayOptions options) {
        ArgumentUtil.checkNotNull(options, "options");
        this.options = options;
    }

    /**
     * Renders a DataFrame.
     *
     * @param frame
     *     The DataFrame to render.
     *
     * @return The rendered table.
     *
     * @throws NullPointerException
     *     if {@code frame} is {@code null}.
     */
    public String print(DataFrame frame) {
        ArgumentUtil.checkNotNull(frame, "frame");
        if (frame.numCols() == 0) {
            return "DataFrame{}";
        }

        Columns columns = frame.columns;
        int numCols = frame.numCols();
        int numRows = frame.len();

        // each column is as wide as its widest value or label.
        int[] widths = new int[numCols];
        for (int column = 0; column < numCols; column++) {
            Values values = frame.series.get(column).values;
            int width = 0;
            for (int row = 0; row < numRows; row++) {
                width = Math.max(width, IndexPrinter.formatValue(values, row, options).length());
            }
            for (int level = 0; level < columns.numLevels(); level++) {
                String label = Conversions.render(columns.level(level).label(column));
                width = Math.max(width, Math.min(label.length(), options.maxWidth()));
            }
            widths[column] = width;
        }

        StringBuilder output = new StringBuilder();
        IndexPrinter indexPrinter = new IndexPrinter(frame.index, options);
        String indexPadding = IndexPrinter.spaces(indexPrinter.width());
        String valuesPadding = IndexPrinter.spaces(options.valuesBuffer());

        for (int level = 0; level < columns.numLevels(); level++) {
            boolean lastLevel = level == columns.numLevels() - 1;
            StringBuilder line = new StringBuilder(indexPadding);
            String prior = null;
            for (int column = 0; column < numCols; column++) {
                String label = Conversions.render(columns.level(level).label(column));
                String shown = !lastLevel && label.equals(prior) ? "" : label;
                prior = label;
                line.append(valuesPadding).append(IndexPrinter.cell(shown, widths[column], options.maxWidth()));
            }
            output.append(line.toString().stripTrailing()).append('\n');
        }

        String header = indexPrinter.header();
        if (!header.isEmpty()) {
            output.append(header.stripTrailing()).append('\n');
        }

        for (int row = 0; row < numRows; row++) {
            StringBuilder line = new StringBuilder(indexPrinter.row(row));
            for (int column = 0; column < numCols; column++) {
                String value = IndexPrinter.formatValue(frame.series.get(column).values, row, options);
                line.append(valuesPadding).append(IndexPrinter.cell(value, widths[column], Integer.MAX_VALUE));
            }
            output.append(line.toString().stripTrailing()).append('\n');
        }

        if (!frame.name().isEmpty()) {
            output.append("name: ").append(frame.name()).append('\n');
        }
        return output.toString();
    }
}
