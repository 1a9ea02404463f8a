///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.dataframe;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Objects;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * A one-dimensional, labeled sequence of nullable values of a single {@link Kind}.
 * <p>
 * A Series pairs a column of values with an {@link Index} that has one label per value at each of its levels.  Every
 * operation that returns a Series returns a new, independent Series; the receiver is not changed.  To modify a Series
 * without copying it, use the view returned by {@link #inPlace()}.  The copying form of each modification is defined
 * as "copy, then apply the in-place form", so the two forms always produce the same result.
 * </p>
 * <p>
 * Modifications check all of their arguments before changing anything.  If a modification throws an exception, the
 * Series is unchanged.
 * </p>
 * <p>
 * Series are not thread-safe.
 * </p>
 *
 * <h2>Sample Code</h2>
 * <pre>{@code
 * Config config = Config.builder().
 *     index(List.of("Seattle", "Portland", "Seattle")).
 *     indexName("city").
 *     name("rainfall").
 *     build();
 * Series rainfall = Series.of(List.of(3.0, 4.0, 5.0), config);
 *
 * double mean = rainfall.mean(); // 4.0
 * Series totals = rainfall.groupByIndex().sum(); // Portland 4.0, Seattle 8.0
 * Series wettest = rainfall.sort(false); // 5.0, 4.0, 3.0
 *
 * // modify rainfall itself instead of a copy
 * rainfall.inPlace().append(6.0, List.of("Tacoma"));
 * }</pre>
 */
public final class Series {

    private static final List<String> NUMERIC_STATISTICS = List.of("len", "valid", "null", "mean", "min", "25%",
        "50%", "75%", "max");
    private static final List<String> BOOL_STATISTICS = List.of("len", "valid", "null", "sum", "mean");
    private static final List<String> STRING_STATISTICS = List.of("len", "valid", "null", "unique");
    private static final List<String> DATE_TIME_STATISTICS = List.of("len", "valid", "null", "unique", "earliest",
        "latest");
    private static final List<String> GENERIC_STATISTICS = List.of("len", "valid", "null");

    Values values;
    final Index index;
    private String name;
    private final InPlace inPlace;

    /**
     * Creates a Series that takes ownership of its values and index.
     */
    Series(Values values, Index index, String name) {
        assert values != null : "values must not be null";
        assert index != null : "index must not be null";
        assert name != null : "name must not be null";

        this.values = values;
        this.index = index;
        this.name = name;
        this.inPlace = new InPlace();
    }

    /**
     * Creates a Series with a default index of {@code 0..n-1} and no name.
     *
     * @param data
     *     The data.  See {@link #of(Object, Config)} for the types that are supported.
     *
     * @return A new Series.
     *
     * @throws ConstructionException
     *     if {@code data} or any of its elements has an unsupported type.
     */
    public static Series of(Object data) {
        return of(data, Config.DEFAULT);
    }

    /**
     * Creates a Series.
     * <p>
     * The data may be a single value, an array, an {@code Object[]}, or a {@code List}.  The supported element types
     * are {@code Double}, {@code Float}, {@code Long}, {@code Integer}, {@code Short}, {@code Byte}, {@code String},
     * {@code Boolean}, and {@code Instant}.  A primitive array determines the kind directly.  For a list, the kind is
     * the narrowest kind that can hold all of the elements; a mix of integers and floating point numbers is
     * {@link Kind#FLOAT} and any other mix is {@link Kind#GENERIC}.  {@code null} elements are null.
     * </p>
     * <p>
     * The index, index names, name, and a kind to convert the values to are taken from {@code config}.  Column options
     * are ignored.
     * </p>
     *
     * @param data
     *     The data.  {@code null} creates an empty Series.
     * @param config
     *     The construction options.
     *
     * @return A new Series.
     *
     * @throws NullPointerException
     *     if {@code config} is {@code null}.
     * @throws ConstructionException
     *     if {@code data} or any of its elements has an unsupported type, or if the number of index labels doesn't
     *     match the number of elements.
     * @throws AmbiguousConfigException
     *     if {@code config} has both a single-level and a multi-level index.
     */
    public static Series of(Object data, Config config) {
        ArgumentUtil.checkNotNull(config, "config");

        Values values = ValuesFactory.fromData(data);
        Index index = IndexFactory.indexFromConfig(config, values.len());
        if (config.kind() != null && config.kind() != values.kind()) {
            values = values.convert(config.kind());
        }
        return new Series(values, index, config.name());
    }

    /**
     * Creates an empty Series.  Its kind is {@link Kind#GENERIC}.
     *
     * @return A new Series with no elements.
     */
    public static Series empty() {
        return of(null);
    }

    /**
     * @return The number of elements.
     */
    public int len() {
        return values.len();
    }

    /**
     * @return The kind of the values.
     */
    public Kind kind() {
        return values.kind();
    }

    /**
     * @return This Series' name.  This may be blank.
     */
    public String name() {
        return name;
    }

    /**
     * Renames this Series.
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
     * @return A copy of this Series' index.
     */
    public Index index() {
        return index.copy();
    }

    /**
     * @return The number of index levels.
     */
    public int numIndexLevels() {
        return index.numLevels();
    }

    /**
     * Gets the element at a position.
     *
     * @param position
     *     The element's position.
     *
     * @return A snapshot of the element.
     *
     * @throws BoundsException
     *     if {@code position} is out of range.
     */
    public Element element(int position) {
        ArgumentUtil.checkPosition(position, values.len(), "row");
        return new Element(values.value(position), values.isNull(position), index.labelsAt(position), index.kinds());
    }

    /**
     * Gets the index label at a row and level.
     *
     * @param position
     *     The row's position.
     * @param level
     *     The level's position.
     *
     * @return The label.
     *
     * @throws BoundsException
     *     if {@code position} or {@code level} is out of range.
     */
    public Object indexAt(int position, int level) {
        return index.level(level).label(position);
    }

    /**
     * @return All values, in order.  Null elements are given as the null representation of this Series' kind.  The
     *     list is not modifiable.
     */
    public List<Object> values() {
        return values.values();
    }

    /**
     * @return The positions of the non-null elements, in order.
     */
    public List<Integer> validPositions() {
        return values.valid();
    }

    /**
     * @return The positions of the null elements, in order.
     */
    public List<Integer> nullPositions() {
        return values.nulls();
    }

    /**
     * Checks that the index and the values have the same length.
     */
    void checkAligned() {
        if (!index.aligned()) {
            throw new AlignmentException("index levels have different lengths");
        }
        if (index.len() != values.len()) {
            throw new AlignmentException(
                "index has " + index.len() + " labels but the Series has " + values.len() + " values");
        }
    }

    /**
     * Selects the elements at the given positions into a new Series.  Positions may be given in any order and may
     * repeat.
     *
     * @param positions
     *     The positions to select.
     *
     * @return A new Series.
     *
     * @throws NullPointerException
     *     if {@code positions} is {@code null} or contains a {@code null} entry.
     * @throws AlignmentException
     *     if the index isn't aligned with the values.
     * @throws BoundsException
     *     if any position is out of range.
     */
    public Series subset(List<Integer> positions) {
        checkAligned();
        Values selected = values.in(positions);
        return new Series(selected, index.rows(positions), name);
    }

    /**
     * Creates a deep copy of this Series.  The copy shares no storage or label maps with this Series.
     *
     * @return A new Series that is equal to this one.
     */
    public Series copy() {
        return new Series(values.copy(), index.copy(), name);
    }

    /**
     * Gets a view of this Series whose methods modify it in place.
     *
     * @return The in-place view.
     */
    public InPlace inPlace() {
        return inPlace;
    }

    /**
     * Inserts an element before a position and returns the result as a new Series.
     *
     * @see InPlace#insert(int, Object, List)
     */
    public Series insert(int position, Object value, List<?> labels) {
        Series copy = copy();
        copy.inPlace.insert(position, value, labels);
        return copy;
    }

    /**
     * Appends an element and returns the result as a new Series.
     *
     * @see InPlace#append(Object, List)
     */
    public Series append(Object value, List<?> labels) {
        Series copy = copy();
        copy.inPlace.append(value, labels);
        return copy;
    }

    /**
     * Removes the element at a position and returns the result as a new Series.
     *
     * @see InPlace#drop(int)
     */
    public Series drop(int position) {
        Series copy = copy();
        copy.inPlace.drop(position);
        return copy;
    }

    /**
     * Removes the elements at some positions and returns the result as a new Series.
     *
     * @see InPlace#dropRows(List)
     */
    public Series dropRows(List<Integer> positions) {
        Series copy = copy();
        copy.inPlace.dropRows(positions);
        return copy;
    }

    /**
     * Removes all null elements and returns the result as a new Series.
     *
     * @see InPlace#dropNull()
     */
    public Series dropNull() {
        Series copy = copy();
        copy.inPlace.dropNull();
        return copy;
    }

    /**
     * Appends another Series, converted to this Series' kinds, and returns the result as a new Series.
     *
     * @see InPlace#join(Series)
     */
    public Series join(Series other) {
        Series copy = copy();
        copy.inPlace.join(other);
        return copy;
    }

    /**
     * Sorts by value and returns the result as a new Series.
     *
     * @see InPlace#sort(boolean)
     */
    public Series sort(boolean ascending) {
        Series copy = copy();
        copy.inPlace.sort(ascending);
        return copy;
    }

    /**
     * Sorts by the outermost index level and returns the result as a new Series.
     *
     * @see InPlace#sortIndex(boolean)
     */
    public Series sortIndex(boolean ascending) {
        Series copy = copy();
        copy.inPlace.sortIndex(ascending);
        return copy;
    }

    /**
     * Swaps two rows and returns the result as a new Series.
     *
     * @see InPlace#swap(int, int)
     */
    public Series swap(int i, int j) {
        Series copy = copy();
        copy.inPlace.swap(i, j);
        return copy;
    }

    /**
     * Converts the values to another kind.  This never fails; values that can't be converted become null.
     *
     * @param kind
     *     The target kind.
     *
     * @return A new Series of kind {@code kind}.
     *
     * @throws NullPointerException
     *     if {@code kind} is {@code null}.
     */
    public Series convert(Kind kind) {
        ArgumentUtil.checkNotNull(kind, "kind");
        return new Series(values.convert(kind), index.copy(), name);
    }

    /**
     * Converts the labels of one index level to another kind.
     *
     * @param level
     *     The position of the level.
     * @param kind
     *     The target kind.
     *
     * @return A new Series.
     *
     * @throws BoundsException
     *     if {@code level} is out of range.
     */
    public Series convertIndexLevel(int level, Kind kind) {
        ArgumentUtil.checkNotNull(kind, "kind");
        ArgumentUtil.checkPosition(level, index.numLevels(), "level");

        Series copy = copy();
        copy.index.levels.set(level, copy.index.levels.get(level).convert(kind));
        copy.index.refresh();
        return copy;
    }

    /**
     * Removes one index level.  If the index has only one level, the result has the same index.
     *
     * @param level
     *     The position of the level.
     *
     * @return A new Series.
     *
     * @throws BoundsException
     *     if {@code level} is out of range.
     */
    public Series dropIndexLevel(int level) {
        Series copy = copy();
        copy.index.drop(level);
        return copy;
    }

    /**
     * Keeps only some index levels, in the given order.
     *
     * @param levels
     *     The positions of the levels to keep.
     *
     * @return A new Series.
     *
     * @throws BoundsException
     *     if any level position is out of range.
     */
    public Series selectIndexLevels(List<Integer> levels) {
        return new Series(values.copy(), index.subset(levels), name);
    }

    private double[] validDoubles(String operation) {
        if (!kind().isNumeric()) {
            throw new TypeUnsupportedException(
                operation + " is not supported for " + kind().displayName() + " values");
        }

        List<Integer> valid = values.valid();
        double[] doubles = new double[valid.size()];
        for (int i = 0; i < doubles.length; i++) {
            doubles[i] = Conversions.toDouble(values.get(valid.get(i)));
        }
        return doubles;
    }

    /**
     * Sums the non-null values.
     *
     * @return The sum, or 0 if there are no non-null values.
     *
     * @throws TypeUnsupportedException
     *     if this Series' kind isn't numeric.
     */
    public double sum() {
        return MathUtil.sum(validDoubles("sum"));
    }

    /**
     * Computes the arithmetic mean of the non-null values.
     *
     * @return The mean, or {@code NaN} if there are no non-null values.
     *
     * @throws TypeUnsupportedException
     *     if this Series' kind isn't numeric.
     */
    public double mean() {
        return MathUtil.mean(validDoubles("mean"));
    }

    /**
     * Computes the median of the non-null values.
     *
     * @return The median, or {@code NaN} if there are no non-null values.
     *
     * @throws TypeUnsupportedException
     *     if this Series' kind isn't numeric.
     */
    public double median() {
        return MathUtil.quantile(validDoubles("median"), 0.5);
    }

    /**
     * Computes a quartile of the non-null values, interpolating linearly between adjacent values.
     *
     * @param quartile
     *     The quartile, from 0 (the minimum) to 4 (the maximum).
     *
     * @return The quartile, or {@code NaN} if there are no non-null values.
     *
     * @throws IllegalArgumentException
     *     if {@code quartile} is not between 0 and 4.
     * @throws TypeUnsupportedException
     *     if this Series' kind isn't numeric.
     */
    public double quartile(int quartile) {
        if (quartile < 0 || 4 < quartile) {
            throw new IllegalArgumentException("quartile must be between 0 and 4");
        }
        return MathUtil.quantile(validDoubles("quartile"), quartile / 4.0);
    }

    /**
     * @return The smallest non-null value, or {@code NaN} if there are no non-null values.
     *
     * @throws TypeUnsupportedException
     *     if this Series' kind isn't numeric.
     */
    public double min() {
        return MathUtil.min(validDoubles("min"));
    }

    /**
     * @return The largest non-null value, or {@code NaN} if there are no non-null values.
     *
     * @throws TypeUnsupportedException
     *     if this Series' kind isn't numeric.
     */
    public double max() {
        return MathUtil.max(validDoubles("max"));
    }

    /**
     * @return The number of non-null values.
     *
     * @throws TypeUnsupportedException
     *     if this Series' kind isn't numeric.
     */
    public int count() {
        return validDoubles("count").length;
    }

    /**
     * Counts how often each non-null value occurs.
     *
     * @return A map from rendered value to the number of times it occurs, sorted by rendered value.
     */
    public Map<String, Integer> valueCounts() {
        Map<String, Integer> counts = new TreeMap<>();
        for (int position : values.valid()) {
            counts.merge(values.render(position), 1, Integer::sum);
        }
        return counts;
    }

    /**
     * @return The distinct non-null values, rendered as strings, in sorted order.
     */
    public List<String> unique() {
        return new ArrayList<>(valueCounts().keySet());
    }

    /**
     * @return The earliest non-null time, or {@code null} if there are no non-null values.
     *
     * @throws TypeUnsupportedException
     *     if this Series' kind isn't {@link Kind#DATE_TIME}.
     */
    public Instant earliest() {
        return extremeTime("earliest", true);
    }

    /**
     * @return The latest non-null time, or {@code null} if there are no non-null values.
     *
     * @throws TypeUnsupportedException
     *     if this Series' kind isn't {@link Kind#DATE_TIME}.
     */
    public Instant latest() {
        return extremeTime("latest", false);
    }

    private Instant extremeTime(String operation, boolean earliest) {
        if (kind() != Kind.DATE_TIME) {
            throw new TypeUnsupportedException(
                operation + " is not supported for " + kind().displayName() + " values");
        }

        Instant extreme = null;
        for (int position : values.valid()) {
            Instant time = (Instant) values.get(position);
            if (extreme == null || (earliest ? time.isBefore(extreme) : time.isAfter(extreme))) {
                extreme = time;
            }
        }
        return extreme;
    }

    /**
     * Summarizes this Series with {@link DisplayOptions#DEFAULT default} display options.
     *
     * @return A {@link Kind#STRING} Series of summary statistics.
     *
     * @see #describe(DisplayOptions)
     */
    public Series describe() {
        return describe(DisplayOptions.DEFAULT);
    }

    /**
     * Summarizes this Series.
     * <p>
     * Every kind reports its length ({@code len}) and the number of non-null ({@code valid}) and null ({@code null})
     * elements.  {@link Kind#FLOAT} and {@link Kind#INT} add the mean, minimum, quartiles, and maximum.
     * {@link Kind#BOOL} adds the number of {@code true} values ({@code sum}) and their share ({@code mean}).
     * {@link Kind#STRING} adds the number of distinct values ({@code unique}).  {@link Kind#DATE_TIME} adds the
     * number of distinct values and the earliest and latest times.
     * </p>
     *
     * @param options
     *     Controls how the statistics are formatted.
     *
     * @return A {@link Kind#STRING} Series of summary statistics, indexed by the statistic names and named like this
     *     Series.
     *
     * @throws NullPointerException
     *     if {@code options} is {@code null}.
     */
    public Series describe(DisplayOptions options) {
        ArgumentUtil.checkNotNull(options, "options");

        List<String> statistics = new ArrayList<>();
        statistics.add(String.valueOf(len()));
        statistics.add(String.valueOf(values.valid().size()));
        statistics.add(String.valueOf(values.nulls().size()));

        List<String> labels;
        switch (kind()) {
        case FLOAT:
        case INT:
            labels = NUMERIC_STATISTICS;
            for (double statistic : new double[] { mean(), min(), quartile(1), quartile(2), quartile(3), max() }) {
                statistics.add(formatStatistic(statistic, options));
            }
            break;

        case BOOL:
            labels = BOOL_STATISTICS;
            statistics.add(formatStatistic(sum(), options));
            statistics.add(formatStatistic(mean(), options));
            break;

        case STRING:
            labels = STRING_STATISTICS;
            statistics.add(String.valueOf(valueCounts().size()));
            break;

        case DATE_TIME:
            labels = DATE_TIME_STATISTICS;
            statistics.add(String.valueOf(valueCounts().size()));
            statistics.add(Conversions.render(earliest()));
            statistics.add(Conversions.render(latest()));
            break;

        default:
            labels = GENERIC_STATISTICS;
        }

        Config config = Config.builder().index(labels).name(name).build();
        return of(statistics, config);
    }

    private static String formatStatistic(double statistic, DisplayOptions options) {
        return String.format(Locale.ROOT, "%." + options.floatPrecision() + "f", statistic);
    }

    /**
     * Groups the rows of this Series by their labels at every index level.
     *
     * @return A grouping over a copy of this Series.
     */
    public Grouping groupByIndex() {
        return new Grouping(copy());
    }

    @Override
    public int hashCode() {
        return Objects.hash(values, index, name);
    }

    /**
     * Two Series are equal if they have the same kind, the same name, equal values, and equal indices.
     */
    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Series otherSeries)) {
            return false;
        }
        return name.equals(otherSeries.name) && values.equals(otherSeries.values) && index.equals(otherSeries.index);
    }

    /**
     * Renders this Series as a table with {@link DisplayOptions#DEFAULT default} display options.
     */
    @Override
    public String toString() {
        return new SeriesPrinter(DisplayOptions.DEFAULT).print(this);
    }

    /**
     * Orders row positions by the elements of a column.  Null elements are always ordered last, regardless of the
     * direction.
     */
    private static Comparator<Integer> ordering(Values column, boolean ascending) {
        return (i, j) -> {
            boolean firstNull = column.isNull(i);
            boolean secondNull = column.isNull(j);
            if (firstNull || secondNull) {
                return Boolean.compare(firstNull, secondNull);
            }
            int comparison = Integer.signum(column.compare(i, j));
            return ascending ? comparison : -comparison;
        };
    }

    /**
     * The methods of a {@link Series} that modify it in place.
     */
    public final class InPlace {

        private InPlace() {
        }

        /**
         * Inserts an element before a position, shifting the element at that position and all subsequent elements
         * down by one row.
         *
         * @param position
         *     The position of the new element.  If this is the length of the Series, the element is appended.
         * @param value
         *     The new value, or {@code null} for a null element.
         * @param labels
         *     The new element's label at every index level, outermost first.
         *
         * @throws NullPointerException
         *     if {@code labels} is {@code null}.
         * @throws IllegalArgumentException
         *     if the number of labels isn't the number of index levels.
         * @throws BoundsException
         *     if {@code position} is negative or greater than the length of the Series.
         * @throws TypeMismatchException
         *     if {@code value} or a label can't be represented in the kind of its column or level.
         */
        public void insert(int position, Object value, List<?> labels) {
            ArgumentUtil.checkNotNull(labels, "labels");
            if (labels.size() != index.numLevels()) {
                throw new IllegalArgumentException(
                    "insert needs one label per index level: got " + labels.size() + " labels for " +
                        index.numLevels() + " levels");
            }

            // check everything before changing anything.
            values.checkInsert(position, value);
            for (int i = 0; i < labels.size(); i++) {
                index.levels.get(i).labels.checkInsert(position, labels.get(i));
            }

            values.insert(position, value);
            for (int i = 0; i < labels.size(); i++) {
                index.levels.get(i).labels.insert(position, labels.get(i));
            }
            index.refresh();
        }

        /**
         * Appends an element.
         *
         * @param value
         *     The new value, or {@code null} for a null element.
         * @param labels
         *     The new element's label at every index level, outermost first.
         *
         * @see #insert(int, Object, List)
         */
        public void append(Object value, List<?> labels) {
            insert(len(), value, labels);
        }

        /**
         * Removes the element at a position, shifting all subsequent elements up by one row.
         *
         * @param position
         *     The position of the element to remove.
         *
         * @throws BoundsException
         *     if {@code position} is out of range.
         */
        public void drop(int position) {
            ArgumentUtil.checkPosition(position, len(), "row");
            dropRow(position);
            index.refresh();
        }

        /**
         * Removes the elements at some positions.
         *
         * @param positions
         *     The positions of the elements to remove.  They may be given in any order.  A repeated position is
         *     removed once.
         *
         * @throws NullPointerException
         *     if {@code positions} is {@code null} or contains a {@code null} entry.
         * @throws BoundsException
         *     if any position is out of range.
         */
        public void dropRows(List<Integer> positions) {
            ArgumentUtil.checkPositions(positions, len(), "row");

            // drop from the end so that the remaining positions stay valid.
            NavigableSet<Integer> descending = new TreeSet<>(positions).descendingSet();
            for (int position : descending) {
                dropRow(position);
            }
            index.refresh();
        }

        /**
         * Removes all null elements.
         */
        public void dropNull() {
            dropRows(values.nulls());
        }

        private void dropRow(int position) {
            values.drop(position);
            for (Level level : index.levels) {
                level.labels.drop(position);
            }
        }

        /**
         * Appends every element of another Series.  The other Series' values are converted to this Series' kind and
         * its labels are converted to the kinds of this Series' index levels.  Conversions never fail, so this never
         * fails because of a kind mismatch.
         *
         * @param other
         *     The Series to append.  It's not modified.
         *
         * @throws NullPointerException
         *     if {@code other} is {@code null}.
         * @throws IllegalArgumentException
         *     if {@code other} has a different number of index levels.
         */
        public void join(Series other) {
            ArgumentUtil.checkNotNull(other, "other");
            if (other.index.numLevels() != index.numLevels()) {
                throw new IllegalArgumentException(
                    "cannot join a Series with " + other.index.numLevels() + " index levels to a Series with " +
                        index.numLevels() + " index levels");
            }

            values.append(other.values);
            for (int i = 0; i < index.numLevels(); i++) {
                index.levels.get(i).labels.append(other.index.levels.get(i).labels);
            }
            index.refresh();
        }

        /**
         * Sorts by value.  The sort is stable, so equal values keep their relative order.  Null values are placed
         * last.
         *
         * @param ascending
         *     {@code true} to sort from smallest to largest, {@code false} to sort from largest to smallest.
         */
        public void sort(boolean ascending) {
            reorder(ordering(values, ascending));
        }

        /**
         * Sorts by the labels of the outermost index level.  The sort is stable, so rows with equal labels keep their
         * relative order.  Null labels are placed last.
         *
         * @param ascending
         *     {@code true} to sort from smallest to largest, {@code false} to sort from largest to smallest.
         */
        public void sortIndex(boolean ascending) {
            reorder(ordering(index.levels.get(0).labels, ascending));
        }

        private void reorder(Comparator<Integer> ordering) {
            List<Integer> permutation = new ArrayList<>(len());
            for (int i = 0; i < len(); i++) {
                permutation.add(i);
            }
            permutation.sort(ordering); // List.sort is stable

            values = values.in(permutation);
            for (Level level : index.levels) {
                level.labels = level.labels.in(permutation);
            }
            index.refresh();
        }

        /**
         * Swaps two rows, including their labels.
         *
         * @param i
         *     The position of the first row.
         * @param j
         *     The position of the second row.
         *
         * @throws BoundsException
         *     if either position is out of range.
         */
        public void swap(int i, int j) {
            ArgumentUtil.checkPosition(i, len(), "row");
            ArgumentUtil.checkPosition(j, len(), "row");

            values.swap(i, j);
            for (Level level : index.levels) {
                level.labels.swap(i, j);
            }
            index.refresh();
        }

        /**
         * Renames the Series.
         *
         * @param name
         *     The new name.
         *
         * @throws NullPointerException
         *     if {@code name} is {@code null}.
         */
        public void rename(String name) {
            Series.this.rename(name);
        }

        /**
         * @return The Series that this view modifies.
         */
        public Series series() {
            return Series.this;
        }
    }
}
