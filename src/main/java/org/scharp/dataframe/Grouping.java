///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.dataframe;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.ToDoubleFunction;

/**
 * A partition of the rows of a {@link Series} by their index labels.
 * <p>
 * The key of a row is the rendered label at every index level, joined with {@value #KEY_SEPARATOR}.  Rows with the
 * same key form a group.  Because keys are built from rendered labels, labels of different types that render the
 * same, or labels that contain the separator, may share a group.
 * </p>
 * <p>
 * Aggregations visit the groups in sorted key order, so their output doesn't depend on the order of the rows.
 * </p>
 */
public final class Grouping {

    /** The text placed between the labels of different index levels in a group key. */
    public static final String KEY_SEPARATOR = " | ";

    private static final class Group {
        final List<Integer> positions = new ArrayList<>();
        final List<Object> labels;

        Group(List<Object> labels) {
            this.labels = labels;
        }
    }

    private final Series source;
    private final Map<String, Group> groups;

    /**
     * Groups a Series in a single pass over its rows.
     *
     * @param source
     *     The Series to group.  The grouping takes ownership of it.
     */
    Grouping(Series source) {
        this.source = source;
        this.groups = new HashMap<>();

        Index index = source.index;
        for (int row = 0; row < source.len(); row++) {
            StringBuilder key = new StringBuilder();
            for (int level = 0; level < index.numLevels(); level++) {
                if (level != 0) {
                    key.append(KEY_SEPARATOR);
                }
                key.append(index.levels.get(level).labels.render(row));
            }

            final int firstRow = row;
            Group group = groups.computeIfAbsent(key.toString(), k -> new Group(nullableLabelsAt(index, firstRow)));
            group.positions.add(row);
        }
    }

    private static List<Object> nullableLabelsAt(Index index, int row) {
        List<Object> labels = new ArrayList<>(index.numLevels());
        for (Level level : index.levels) {
            labels.add(level.labels.get(row));
        }
        return labels;
    }

    /**
     * @return The keys of all groups, in sorted order.
     */
    public List<String> groups() {
        List<String> keys = new ArrayList<>(groups.keySet());
        keys.sort(null);
        return keys;
    }

    /**
     * @return The number of groups.
     */
    public int numGroups() {
        return groups.size();
    }

    /**
     * Gets the rows of one group.
     *
     * @param key
     *     The group's key.
     *
     * @return A new Series with the group's rows, in their original order.
     *
     * @throws NullPointerException
     *     if {@code key} is {@code null}.
     * @throws IllegalArgumentException
     *     if there is no group with the key {@code key}.
     */
    public Series group(String key) {
        ArgumentUtil.checkNotNull(key, "key");
        Group group = groups.get(key);
        if (group == null) {
            throw new IllegalArgumentException("no group has the key \"" + key + "\"");
        }
        return source.subset(group.positions);
    }

    /**
     * @return The sum of the non-null values in each group.
     *
     * @throws TypeUnsupportedException
     *     if the grouped Series isn't numeric.
     */
    public Series sum() {
        return aggregate("sum", Series::sum);
    }

    /**
     * @return The mean of the non-null values in each group.
     *
     * @throws TypeUnsupportedException
     *     if the grouped Series isn't numeric.
     */
    public Series mean() {
        return aggregate("mean", Series::mean);
    }

    /**
     * @return The median of the non-null values in each group.
     *
     * @throws TypeUnsupportedException
     *     if the grouped Series isn't numeric.
     */
    public Series median() {
        return aggregate("median", Series::median);
    }

    /**
     * @return The smallest non-null value in each group.
     *
     * @throws TypeUnsupportedException
     *     if the grouped Series isn't numeric.
     */
    public Series min() {
        return aggregate("min", Series::min);
    }

    /**
     * @return The largest non-null value in each group.
     *
     * @throws TypeUnsupportedException
     *     if the grouped Series isn't numeric.
     */
    public Series max() {
        return aggregate("max", Series::max);
    }

    /**
     * @return The number of non-null values in each group.
     *
     * @throws TypeUnsupportedException
     *     if the grouped Series isn't numeric.
     */
    public Series count() {
        return aggregate("count", Series::count);
    }

    /**
     * Aggregates each group into one {@link Kind#FLOAT} row, labeled with the labels of the group's first row.  The
     * result's index levels have the kinds and names of the source's index levels, and the result is named like the
     * source.
     */
    private Series aggregate(String operation, ToDoubleFunction<Series> aggregation) {
        if (!source.kind().isNumeric()) {
            // report the problem even when there are no groups.
            throw new TypeUnsupportedException(
                operation + " is not supported for " + source.kind().displayName() + " values");
        }

        List<String> keys = groups();
        Values results = Values.create(Kind.FLOAT, keys.size());
        List<Values> labels = new ArrayList<>(source.index.numLevels());
        for (Level level : source.index.levels) {
            labels.add(Values.create(level.kind(), keys.size()));
        }

        for (String key : keys) {
            Group group = groups.get(key);
            results.add(aggregation.applyAsDouble(source.subset(group.positions)));
            for (int level = 0; level < labels.size(); level++) {
                labels.get(level).add(group.labels.get(level));
            }
        }

        List<Level> levels = new ArrayList<>(labels.size());
        for (int level = 0; level < labels.size(); level++) {
            levels.add(new Level(labels.get(level), source.index.levels.get(level).name()));
        }
        return new Series(results, Index.ofOwned(levels), source.name());
    }
}
