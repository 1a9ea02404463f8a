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
 * The row labels of a {@link Series} or {@link DataFrame}: one or more {@link Level}s of equal length.
 * <p>
 * The labels of row {@code i} are the labels at position {@code i} of every level.  An index always has at least one
 * level.  Level names need not be unique; the name map records every level position that has a given name.
 * </p>
 */
public final class Index {

    final List<Level> levels;
    private Map<String, List<Integer>> nameMap;

    private Index(List<Level> levels) {
        this.levels = levels;
        updateNameMap();
    }

    /**
     * Creates an index from some levels.  If no levels are given, the index has a single unnamed level with no
     * labels.
     *
     * @param levels
     *     The levels.  These are copied.
     *
     * @return A new index.
     *
     * @throws NullPointerException
     *     if {@code levels} is {@code null} or contains a {@code null} entry.
     */
    public static Index of(Level... levels) {
        ArgumentUtil.checkNotNull(levels, "levels");
        return of(Arrays.asList(levels));
    }

    /**
     * Creates an index from a list of levels.  If the list is empty, the index has a single unnamed level with no
     * labels.
     *
     * @param levels
     *     The levels.  These are copied.
     *
     * @return A new index.
     *
     * @throws NullPointerException
     *     if {@code levels} is {@code null} or contains a {@code null} entry.
     */
    public static Index of(List<Level> levels) {
        ArgumentUtil.checkNotNull(levels, "levels");

        List<Level> copies = new ArrayList<>(Math.max(levels.size(), 1));
        for (Level level : levels) {
            if (level == null) {
                throw new NullPointerException("levels cannot contain a null entry");
            }
            copies.add(level.copy());
        }
        if (copies.isEmpty()) {
            copies.add(new Level(Values.create(Kind.GENERIC, 0), ""));
        }
        return new Index(copies);
    }

    /**
     * Creates an index whose only level has the labels {@code 0, 1, ..., n - 1}.
     *
     * @param n
     *     The number of rows.
     * @param name
     *     The name of the level.
     *
     * @return A new index.
     */
    static Index range(int n, String name) {
        List<Level> levels = new ArrayList<>(1);
        levels.add(Level.range(n, name));
        return new Index(levels);
    }

    /**
     * Creates an index that takes ownership of already-built levels.
     */
    static Index ofOwned(List<Level> levels) {
        assert !levels.isEmpty() : "an index must have at least one level";
        return new Index(new ArrayList<>(levels));
    }

    private void updateNameMap() {
        Map<String, List<Integer>> newNameMap = new HashMap<>();
        for (int i = 0; i < levels.size(); i++) {
            newNameMap.computeIfAbsent(levels.get(i).name(), key -> new ArrayList<>()).add(i);
        }
        nameMap = newNameMap;
    }

    /**
     * Rebuilds the name map and the label map of every level.  This must be called after the labels of any level are
     * changed.
     */
    public void refresh() {
        updateNameMap();
        for (Level level : levels) {
            level.refresh();
        }
    }

    /**
     * @return The number of levels. This is always at least 1.
     */
    public int numLevels() {
        return levels.size();
    }

    /**
     * @return The number of rows (the number of labels in the first level).
     */
    public int len() {
        return levels.get(0).len();
    }

    /**
     * Gets one level of this index.
     *
     * @param level
     *     The level's position.
     *
     * @return The level. This is not a copy.
     *
     * @throws BoundsException
     *     if {@code level} is out of range.
     */
    public Level level(int level) {
        ArgumentUtil.checkPosition(level, levels.size(), "level");
        return levels.get(level);
    }

    /**
     * @return The kinds of all levels, in order.
     */
    public List<Kind> kinds() {
        List<Kind> kinds = new ArrayList<>(levels.size());
        for (Level level : levels) {
            kinds.add(level.kind());
        }
        return kinds;
    }

    /**
     * @return The names of all levels, in order.
     */
    public List<String> names() {
        List<String> names = new ArrayList<>(levels.size());
        for (Level level : levels) {
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
     * Gets the labels of one row.
     *
     * @param row
     *     The row's position.
     *
     * @return The label of the row at every level.
     *
     * @throws BoundsException
     *     if {@code row} is out of range.
     */
    public List<Object> labelsAt(int row) {
        List<Object> labels = new ArrayList<>(levels.size());
        for (Level level : levels) {
            labels.add(level.label(row));
        }
        return labels;
    }

    /**
     * Determines whether every level has the same number of labels.
     *
     * @return {@code true}, if the levels are aligned.
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
     * Creates a new index with only the levels at the given positions, in the given order.
     *
     * @param levelPositions
     *     The positions of the levels to keep.
     *
     * @return A new index with a rebuilt name map.
     *
     * @throws BoundsException
     *     if any level position is out of range.
     */
    public Index subset(List<Integer> levelPositions) {
        ArgumentUtil.checkPositions(levelPositions, levels.size(), "level");

        List<Level> selected = new ArrayList<>(levelPositions.size());
        for (int position : levelPositions) {
            selected.add(levels.get(position));
        }
        return of(selected);
    }

    /**
     * Creates a new index with only the rows at the given positions, in the given order.  Positions may repeat.
     *
     * @param rowPositions
     *     The positions of the rows to select.
     *
     * @return A new index.
     *
     * @throws BoundsException
     *     if any row position is out of range.
     */
    public Index rows(List<Integer> rowPositions) {
        List<Level> selected = new ArrayList<>(levels.size());
        for (Level level : levels) {
            selected.add(level.subset(rowPositions));
        }
        return new Index(selected);
    }

    /**
     * Removes a level from this index.  If only one level remains, this does nothing, since an index always has at
     * least one level.
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
        refresh();
    }

    /**
     * Creates a deep copy of this index.  Label maps and the name map are rebuilt, not shared.
     *
     * @return A new index.
     */
    public Index copy() {
        List<Level> copies = new ArrayList<>(levels.size());
        for (Level level : levels) {
            copies.add(level.copy());
        }
        return new Index(copies);
    }

    @Override
    public int hashCode() {
        return levels.hashCode();
    }

    /**
     * Two indices are equal if they have the same number of levels and their levels are pairwise equal.
     */
    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Index otherIndex)) {
            return false;
        }
        return levels.equals(otherIndex.levels);
    }

    @Override
    public String toString() {
        return "Index" + levels;
    }
}
