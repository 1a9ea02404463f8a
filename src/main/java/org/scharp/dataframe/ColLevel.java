///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.dataframe;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One level of the column labels of a {@link DataFrame}.
 * <p>
 * This is the column counterpart of {@link Level}.  Column labels are not stored as a typed column; they're kept as
 * the objects the caller supplied.  The label map is keyed by the rendered label, like a level's label map.
 * </p>
 */
public final class ColLevel {

    private final List<Object> labels;
    private Map<String, List<Integer>> labelMap;
    private final String name;

    private ColLevel(List<Object> labels, String name) {
        this.labels = labels;
        this.name = name;
        refresh();
    }

    /**
     * Creates a column level.
     *
     * @param labels
     *     The labels.  This list is copied.  It may contain {@code null} entries.
     * @param name
     *     The level's name.  This may be blank.
     *
     * @return A new column level.
     *
     * @throws NullPointerException
     *     if {@code labels} or {@code name} is {@code null}.
     * @throws ConstructionException
     *     if a label has an unsupported type.
     */
    public static ColLevel of(List<?> labels, String name) {
        ArgumentUtil.checkNotNull(labels, "labels");
        ArgumentUtil.checkNotNull(name, "name");
        for (Object label : labels) {
            if (label != null && !Conversions.isSupported(label)) {
                throw new ConstructionException(
                    "unsupported column label type: " + label.getClass().getName() + " (label " + label + ")");
            }
        }
        return new ColLevel(new ArrayList<>(labels), name);
    }

    /**
     * Creates a column level with the integer labels {@code 0, 1, ..., n - 1}.
     */
    static ColLevel range(int n, String name) {
        List<Object> labels = new ArrayList<>(n);
        for (long i = 0; i < n; i++) {
            labels.add(i);
        }
        return new ColLevel(labels, name);
    }

    /**
     * Rebuilds the label map from the current labels.
     */
    public void refresh() {
        Map<String, List<Integer>> newLabelMap = new HashMap<>();
        for (int i = 0; i < labels.size(); i++) {
            newLabelMap.computeIfAbsent(Conversions.render(labels.get(i)), key -> new ArrayList<>()).add(i);
        }
        labelMap = newLabelMap;
    }

    /**
     * @return The number of labels in this level.
     */
    public int len() {
        return labels.size();
    }

    /**
     * @return This level's name.
     */
    public String name() {
        return name;
    }

    /**
     * Gets the label at a column position.
     *
     * @throws BoundsException
     *     if {@code position} is out of range.
     */
    public Object label(int position) {
        ArgumentUtil.checkPosition(position, labels.size(), "column");
        return labels.get(position);
    }

    /**
     * @return All labels, in order.  The list is not modifiable.
     */
    public List<Object> labels() {
        return Collections.unmodifiableList(labels);
    }

    /**
     * Gets the column positions at which a label appears.
     *
     * @param label
     *     The rendered label.
     *
     * @return The positions in ascending order.  This is empty if the label doesn't appear.
     */
    public List<Integer> positions(String label) {
        List<Integer> positions = labelMap.get(label);
        return positions == null ? List.of() : Collections.unmodifiableList(positions);
    }

    /**
     * @return An unmodifiable view of the map from rendered label to column positions.
     */
    public Map<String, List<Integer>> labelMap() {
        return Collections.unmodifiableMap(labelMap);
    }

    /**
     * Creates a new column level with the labels at the given column positions, in the given order.
     *
     * @param positions
     *     The column positions to select.  These may repeat.
     *
     * @return A new column level with a fresh label map.
     *
     * @throws BoundsException
     *     if any position is out of range.
     */
    public ColLevel subset(List<Integer> positions) {
        ArgumentUtil.checkPositions(positions, labels.size(), "column");

        List<Object> selected = new ArrayList<>(positions.size());
        for (int position : positions) {
            selected.add(labels.get(position));
        }
        return new ColLevel(selected, name);
    }

    /**
     * Creates a copy of this column level.  The copy's label map is rebuilt, not shared.
     *
     * @return A new column level.
     */
    public ColLevel copy() {
        return new ColLevel(new ArrayList<>(labels), name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(labels, name);
    }

    /**
     * Two column levels are equal if their names are equal and their labels are pairwise equal.
     */
    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof ColLevel otherLevel)) {
            return false;
        }
        return name.equals(otherLevel.name) && labels.equals(otherLevel.labels);
    }

    @Override
    public String toString() {
        return "ColLevel{name=" + name + ", labels=" + labels + "}";
    }
}
