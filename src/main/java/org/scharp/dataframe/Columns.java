///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.dataframe;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The column labels of a {@link DataFrame}: one or more {@link ColLevel}s of equal length.
 * <p>
 * This is the column counterpart of {@link Index}.  The labels of column {@code j} are the labels at position
 * {@code j} of every level.
 * </p>
 */
public final class Columns {

    private final List<ColLevel> levels;
    private Map<String, List<Integer>> nameMap;

    private Columns(List<ColLevel> levels) {
        this.levels = levels;
        updateNameMap();
    }

    /**
     * Creates column labels from some levels.  If no levels are given, there is a single unnamed level with no
     * labels.
     *
     * @param levels
     *     The levels.  These are copied.
     *
     * @return New column labels.
     *
     * @throws NullPointerException
     *     if {@code levels} is {@code null} or contains a {@code null} entry.
     */
    public static Columns of(ColLevel... levels) {
        ArgumentUtil.checkNotNull(levels, "levels");
        return of(Arrays.asList(levels));
    }

    /**
     * Creates column labels from a list of levels.  If the list is empty, there is a single unnamed level with no
     * labels.
     *
     * @param levels
     *     The levels.  These are copied.
     *
     * @return New column labels.
     *
     * @throws NullPointerException
     *     if {@code levels} is {@code null} or contains a {@code null} entry.
     */
    public static Columns of(List<ColLevel> levels) {
        ArgumentUtil.checkNotNull(levels, "levels");

        List<ColLevel> copies = new ArrayList<>(Math.max(levels.size(), 1));
        for (ColLevel level : levels) {
            if (level == null) {
                throw new NullPointerException("levels cannot contain a null entry");
            }
            copies.add(level.copy());
        }
        if (copies.isEmpty()) {
            copies.add(ColLevel.of(List.of(), ""));
        }
        return new Columns(copies);
    }

    /**
     * Creates column labels whose only level has the labels {@code 0, 1, ..., n - 1}.
     */
    static Columns range(int n, String name) {
        List<ColLevel> levels = new ArrayList<>(1);
        levels.add(ColLevel.range(n, name));
        return new Columns(levels);
    }

    private void updateNameMap() {
        Map<String, List<Integer>> newNameMap = new HashMap<>();
        for (int i = 0; i < levels.size(); i++) {
            newNameMap.computeIfAbsent(levels.get(i).name(), key -> new ArrayList<>()).add(i);
        }
        nameMap = newNameMap;
    }

    /**
     * Rebuilds the name map and the label map of every level.
     */
    public void refresh() {
        updateNameMap();
        for (ColLevel level : levels) {
            level.refresh();
        }
    }

    /**
     * @return The number of columns (the number of labels in the first level).
     */
    public int len() {
        return levels.get(0).len();
    }

    /**
     * @return The number of levels.  This is always at least 1.
     */
    public int numLevels() {
        return levels.size();
    }

    /**
     * Gets one level of the column labels.
     *
     * @param level
     *     The level's position.
     *
     * @return The level.  This is not a copy.
     *
     * @throws BoundsException
     *     if {@code level} is out of range.
     */
    public ColLevel level(int level) {
        ArgumentUtil.checkPosition(level, levels.size(), "level");
        return levels.get(level);
    }

    /**
     * @return The names of all levels, in order.
     */
    public List<String> names() {
        List<String> names = new ArrayList<>(levels.size());
        for (ColLevel level : levels) {
            names.add(level.name());
        }
        return names;
    }

    /**
     * @return An unmodifiable view of the map from level name to the positions of the levels with that name.
     */
    public Map<String, List<Integer>> nameMap() {
        return Collections.unmodifiableMap(nameMap);
    }

    /**
     * Gets the labels of one column.
     *
     * @param column
     *     The column's position.
     *
     * @return The label of the column at every level.
     *
     * @throws BoundsException
     *     if {@code column} is out of range.
     */
    public List<Object> labelsAt(int column) {
        List<Object> labels = new ArrayList<>(levels.size());
        for (ColLevel level : levels) {
            labels.add(level.label(column));
        }
        return labels;
    }

    /**
     * Determines whether every level has the same number of labels.
     */
    public boolean aligned() {
        int length = levels.get(0).len();
        for (int i = 1; i < levels.size(); i++) {
            if (levels.get(i).len() != length) {
                return false;
            }
        }
        return true;
    }

    /**
     * Creates new column labels for only the columns at the given positions, in the given order.
     *
     * @param columnPositions
     *     The positions of the columns to select.
     *
     * @return New column labels with a rebuilt name map.
     *
     * @throws BoundsException
     *     if any column position is out of range.
     */
    public Columns subset(List<Integer> columnPositions) {
        List<ColLevel> selected = new ArrayList<>(levels.size());
        for (ColLevel level : levels) {
            selected.add(level.subset(columnPositions));
        }
        return new Columns(selected);
    }

    /**
     * Removes a column level.  If only one level remains, this does nothing, since column labels always have at least
     * one level.
     *
     * @param level
     *     The position of the level to remove.
     *
     * @throws BoundsException
     *     if {@code level} is not less than the number of levels.
     */
    public void drop(int level) {
        if (levels.size() <= 1) {
            return;
        }
        ArgumentUtil.checkPosition(level, levels.size(), "level");

        levels.remove(level);
        updateNameMap();
    }

    /**
     * Creates a deep copy of these column labels.
     *
     * @return New column labels.
     */
    public Columns copy() {
        List<ColLevel> copies = new ArrayList<>(levels.size());
        for (ColLevel level : levels) {
            copies.add(level.copy());
        }
        return new Columns(copies);
    }

    @Override
    public int hashCode() {
        return levels.hashCode();
    }

    /**
     * Column labels are equal if they have the same number of levels and the levels are pairwise equal.
     */
    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Columns otherColumns)) {
            return false;
        }
        return levels.equals(otherColumns.levels);
    }

    @Override
    public String toString() {
        return "Columns" + levels;
    }
}
