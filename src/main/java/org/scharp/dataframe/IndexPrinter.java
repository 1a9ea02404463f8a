///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.dataframe;

import java.time.Instant;
import java.util.Locale;

/**
 * Renders the row labels of a table, one row at a time.
 * <p>
 * Every level is printed right-aligned in a fixed-width column.  For every level except the last, a label that is the
 * same as the most recently printed label of that level is printed blank, so a label is only shown on the row where
 * it first differs.  Because of this, rows must be rendered in order.
 * </p>
 */
final class IndexPrinter {

    private final Index index;
    private final DisplayOptions options;
    private final int[] widths;
    private final String[] prior;

    IndexPrinter(Index index, DisplayOptions options) {
        this.index = index;
        this.options = options;
        this.widths = new int[index.numLevels()];
        this.prior = new String[index.numLevels()];

        for (int level = 0; level < widths.length; level++) {
            Level currentLevel = index.levels.get(level);
            int width = currentLevel.name().length();
            for (int row = 0; row < currentLevel.len(); row++) {
                width = Math.max(width, currentLevel.labels.render(row).length());
            }
            widths[level] = Math.min(width, options.maxWidth());
        }
    }

    /**
     * @return The width of the rendered labels, including the spaces between levels.
     */
    int width() {
        int width = options.indexBuffer() * (widths.length - 1);
        for (int levelWidth : widths) {
            width += levelWidth;
        }
        return width;
    }

    /**
     * @return The level names, aligned with the labels, or a blank string if no level is named.
     */
    String header() {
        StringBuilder header = new StringBuilder();
        for (int level = 0; level < widths.length; level++) {
            header.append(cell(index.levels.get(level).name(), widths[level], options.maxWidth()));
            if (level != widths.length - 1) {
                header.append(spaces(options.indexBuffer()));
            }
        }
        return header.toString().isBlank() ? "" : header.toString();
    }

    /**
     * Renders the labels of the next row.
     */
    String row(int row) {
        StringBuilder line = new StringBuilder();
        for (int level = 0; level < widths.length; level++) {
            String label = index.levels.get(level).labels.render(row);
            boolean last = level == widths.length - 1;
            if (!last) {
                // each level is elided on its own, independent of the levels outside it.
                if (label.equals(prior[level])) {
                    label = "";
                } else {
                    prior[level] = label;
                }
            }

            line.append(cell(label, widths[level], options.maxWidth()));
            if (!last) {
                line.append(spaces(options.indexBuffer()));
            }
        }
        return line.toString();
    }

    /**
     * Right-aligns text in a column.  Text wider than {@code maxWidth} is cut and ends with {@code "..."}.
     */
    static String cell(String text, int width, int maxWidth) {
        if (maxWidth < text.length()) {
            text = text.substring(0, maxWidth - 3) + "...";
        }
        return spaces(width - text.length()) + text;
    }

    static String spaces(int count) {
        return count <= 0 ? "" : " ".repeat(count);
    }

    /**
     * Renders one value for display.  Floating point values are printed with the configured precision and times in
     * the configured format.
     */
    static String formatValue(Values values, int position, DisplayOptions options) {
        Object value = values.get(position);
        if (value == null) {
            return Conversions.NULL_TEXT;
        }
        switch (values.kind()) {
        case FLOAT:
            return String.format(Locale.ROOT, "%." + options.floatPrecision() + "f", (Double) value);
        case DATE_TIME:
            return options.timeFormatter().format((Instant) value);
        default:
            return Conversions.render(value);
        }
    }
}
