///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.dataframe;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.ToDoubleFunction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A two-dimensional table: a list of {@link Series} that share one row {@link Index}, labeled by {@link Columns}.
 * <p>
 * Each column is a Series whose index is equal to the DataFrame's index.  Columns may have different kinds.  Every
 * operation that returns a DataFrame or a Series returns a new, independent object.
 * </p>
 * <p>
 * DataFrames are not thread-safe.
 * </p>
 *
 * <h2>Sample Code</h2>
 * <pre>{@code
 * Config config = Config.builder().
 *     cols(List.of("fooCol", "barCol")).
 *     index(List.of("foo", "bar", "baz")).
 *     build();
 * DataFrame frame = DataFrame.of(List.of(List.of(1, 2, 3), List.of(4, 5, 6)), config);
 *
 * Series sums = frame.sum(); // fooCol 6.0, barCol 15.0
 * Series bar = frame.col("barCol"); // 4, 5, 6
 * DataFrame firstRows = frame.selectByRows(List.of(0, 1));
 *
 * // prints the table
 * System.out.print(frame);
 * }</pre>
 */
public final class DataFrame {

    private static final Logger log = LoggerFactory.getLogger(DataFrame.class);

    final List<Series> series;
    final Index index;
    final Columns columns;
    private String name;

    /**
     * Creates a DataFrame that takes ownership of its columns, index, and column labels.
     */
    private DataFrame(List<Series> series, Index index, Columns columns, String name) {
        this.series = series;
        this.index = index;
        this.columns = columns;
        this.name = name;
    }

    /**
     * Creates a DataFrame with default row and column labels.
     *
     * @param columnData
     *     The data of each column.
     *
     * @return A new DataFrame.
     *
     * @see #of(List, Config)
     */
    public static DataFrame of(List<?> columnData) {
        return of(columnData, Config.DEFAULT);
    }

    /**
     * Creates a DataFrame.
     * <p>
     * Each entry of {@code columnData} is the data of one column, in any form that {@link Series#of(Object, Config)}
     * accepts.  All columns must have the same length.  The row labels come from the index options of {@code config}
     * and the column labels from its column options; both default to {@code 0..n-1}.  If {@code config} has a kind,
     * every column is converted to it.  Each column is named by its outermost column label.
     * </p>
     *
     * @param columnData
     *     The data of each column.
     * @param config
     *     The construction options.
     *
     * @return A new DataFrame.
     *
     * @throws NullPointerException
     *     if {@code columnData} or {@code config} is {@code null}.
     * @throws ConstructionException
     *     if the data has an unsupported type, if the columns have different lengths, or if the number of row or
     *     column labels doesn't match the data.
     * @throws AmbiguousConfigException
     *     if {@code config} has both a single-level and a multi-level form of the row or column labels.
     */
    public static DataFrame of(List<?> columnData, Config config) {
        ArgumentUtil.checkNotNull(columnData, "columnData");
        ArgumentUtil.checkNotNull(config, "config");

        List<Values> columnValues = new ArrayList<>(columnData.size());
        for (Object data : columnData) {
            Values values = ValuesFactory.fromData(data);
            if (!columnValues.isEmpty() && values.len() != columnValues.get(0).len()) {
                throw new ConstructionException(
                    "column " + columnValues.size() + " has " + values.len() + " values but column 0 has " +
                        columnValues.get(0).len());
            }
            if (config.kind() != null && config.kind() != values.kind()) {
                values = values.convert(config.kind());
            }
            columnValues.add(values);
        }

        int numRows = columnValues.isEmpty() ? 0 : columnValues.get(0).len();
        Index index = IndexFactory.indexFromConfig(config, numRows);
        Columns columns = IndexFactory.columnsFromConfig(config, columnValues.size());

        List<Series> series = new ArrayList<>(columnValues.size());
        for (int column = 0; column < columnValues.size(); column++) {
            String columnName = Conversions.render(columns.level(0).label(column));
            series.add(new Series(columnValues.get(column), index.copy(), columnName));
        }
        return new DataFrame(series, index, columns, config.name());
    }

    /**
     * @return The number of rows.
     */
    public int len() {
        return index.len();
    }

    /**
     * @return The number of columns.
     */
    public int numCols() {
        return series.size();
    }

    /**
     * @return The number of row index levels.
     */
    public int numIndexLevels() {
        return index.numLevels();
    }

    /**
     * @return The number of column levels.
     */
    public int numColLevels() {
        return columns.numLevels();
    }

    /**
     * @return This DataFrame's name.  This may be blank.
     */
    public String name() {
        return name;
    }

    /**
     * Renames this DataFrame.
     *
     * @param name
     *     The new name.
     *
     * @throws NullPointerException
     *     if {@code name} is {@code null}.
     */
    public void rename(String name) {
        ArgumentUtil.checkNotNull(name, "name");
        this.name = name;
    }

    /**
     * @return A copy of the row index.
     */
    public Index index() {
        return index.copy();
    }

    /**
     * @return A copy of the column labels.
     */
    public Columns columns() {
        return columns.copy();
    }

    /**
     * Gets the first column whose outermost label renders as {@code label}.
     * <p>
     * If no column has that label, a warning is logged and an empty Series is returned.  This never throws.
     * </p>
     *
     * @param label
     *     The column label.
     *
     * @return A copy of the column, or an empty Series.
     */
    public Series col(String label) {
        List<Integer> positions = label == null ? List.of() : columns.level(0).positions(label);
        if (positions.isEmpty()) {
            log.warn("no column has the label \"{}\"", label);
            return Series.empty();
        }
        return series.get(positions.get(0)).copy();
    }

    /**
     * Checks that the index, the column labels, and every column agree on their lengths.
     */
    private void checkAligned() {
        if (!index.aligned()) {
            throw new AlignmentException("index levels have different lengths");
        }
        if (!columns.aligned()) {
            throw new AlignmentException("column levels have different lengths");
        }
        if (columns.len() != series.size()) {
            throw new AlignmentException(
                "there are " + columns.len() + " column labels but " + series.size() + " columns");
        }
        for (Series column : series) {
            column.checkAligned();
            if (column.len() != index.len()) {
                throw new AlignmentException(
                    "column " + column.name() + " has " + column.len() + " values but the index has " + index.len() +
                        " labels");
            }
        }
    }

    /**
     * Selects rows by position into a new DataFrame.  Positions may be given in any order and may repeat.
     *
     * @param rowPositions
     *     The positions of the rows to select.
     *
     * @return A new DataFrame.
     *
     * @throws NullPointerException
     *     if {@code rowPositions} is {@code null} or contains a {@code null} entry.
     * @throws AlignmentException
     *     if the columns aren't aligned with the index.
     * @throws BoundsException
     *     if any position is out of range.
     */
    public DataFrame selectByRows(List<Integer> rowPositions) {
        checkAligned();
        ArgumentUtil.checkPositions(rowPositions, index.len(), "row");

        List<Series> selected = new ArrayList<>(series.size());
        for (Series column : series) {
            selected.add(column.subset(rowPositions));
        }
        return new DataFrame(selected, index.rows(rowPositions), columns.copy(), name);
    }

    /**
     * Selects columns by position into a new DataFrame.  Positions may be given in any order and may repeat.
     *
     * @param columnPositions
     *     The positions of the columns to select.
     *
     * @return A new DataFrame.
     *
     * @throws NullPointerException
     *     if {@code columnPositions} is {@code null} or contains a {@code null} entry.
     * @throws AlignmentException
     *     if the columns aren't aligned with the index.
     * @throws BoundsException
     *     if any position is not less than the number of columns.
     */
    public DataFrame selectByCols(List<Integer> columnPositions) {
        checkAligned();
        ArgumentUtil.checkPositions(columnPositions, series.size(), "column");

        List<Series> selected = new ArrayList<>(columnPositions.size());
        for (int position : columnPositions) {
            selected.add(series.get(position).copy());
        }
        return new DataFrame(selected, index.copy(), columns.subset(columnPositions), name);
    }

    /**
     * Creates a deep copy of this DataFrame.
     *
     * @return A new DataFrame that is equal to this one.
     */
    public DataFrame copy() {
        List<Series> copies = new ArrayList<>(series.size());
        for (Series column : series) {
            copies.add(column.copy());
        }
        return new DataFrame(copies, index.copy(), columns.copy(), name);
    }

    /**
     * @return A {@link Kind#STRING} Series with the kind of each column, indexed by the column labels.
     */
    public Series kinds() {
        Values kinds = Values.create(Kind.STRING, series.size());
        for (Series column : series) {
            kinds.add(column.kind().displayName());
        }
        return new Series(kinds, columnIndex(), "kinds");
    }

    /**
     * @return The sum of the non-null values of each column.
     *
     * @throws TypeUnsupportedException
     *     if any column isn't numeric.
     */
    public Series sum() {
        return aggregate(Series::sum);
    }

    /**
     * @return The mean of the non-null values of each column.
     *
     * @throws TypeUnsupportedException
     *     if any column isn't numeric.
     */
    public Series mean() {
        return aggregate(Series::mean);
    }

    /**
     * @return The median of the non-null values of each column.
     *
     * @throws TypeUnsupportedException
     *     if any column isn't numeric.
     */
    public Series median() {
        return aggregate(Series::median);
    }

    /**
     * @return The smallest non-null value of each column.
     *
     * @throws TypeUnsupportedException
     *     if any column isn't numeric.
     */
    public Series min() {
        return aggregate(Series::min);
    }

    /**
     * @return The largest non-null value of each column.
     *
     * @throws TypeUnsupportedException
     *     if any column isn't numeric.
     */
    public Series max() {
        return aggregate(Series::max);
    }

    /**
     * @return The number of non-null values in each column.
     *
     * @throws TypeUnsupportedException
     *     if any column isn't numeric.
     */
    public Series count() {
        return aggregate(Series::count);
    }

    /**
     * Aggregates each column into a {@link Kind#FLOAT} Series that is indexed by the column labels.
     */
    private Series aggregate(ToDoubleFunction<Series> aggregation) {
        Values results = Values.create(Kind.FLOAT, series.size());
        for (Series column : series) {
            results.add(aggregation.applyAsDouble(column));
        }
        return new Series(results, columnIndex(), "");
    }

    /**
     * Builds a row index from the column labels.  Every column level becomes an index level.
     */
    private Index columnIndex() {
        List<Level> levels = new ArrayList<>(columns.numLevels());
        for (int level = 0; level < columns.numLevels(); level++) {
            ColLevel columnLevel = columns.level(level);
            levels.add(Level.of(columnLevel.labels(), columnLevel.name()));
        }
        return Index.ofOwned(levels);
    }

    @Override
    public int hashCode() {
        return Objects.hash(series, index, columns, name);
    }

    /**
     * Two DataFrames are equal if they have the same number of columns, their columns are pairwise equal, and their
     * indices, column labels, and names are equal.
     */
    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof DataFrame otherFrame)) {
            return false;
        }
        return series.size() == otherFrame.series.size() &&
            series.equals(otherFrame.series) &&
            index.equals(otherFrame.index) &&
            columns.equals(otherFrame.columns) &&
            name.equals(otherFrame.name);
    }

    /**
     * Renders this DataFrame as a table with {@link DisplayOptions#DEFAULT default} display options.
     */
    @Override
    public String toString() {
        return new DataFramePrinter(DisplayOptions.DEFAULT).print(this);
    }
}
