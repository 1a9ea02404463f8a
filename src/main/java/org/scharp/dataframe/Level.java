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
 * One level of a (possibly hierarchical) row {@link Index}: an ordered sequence of labels, all of one {@link Kind},
 * plus a map from each label to the positions at which it appears.
 * <p>
 * The label map is keyed by the <i>rendered</i> label, not the typed label.  As a result, two labels of different
 * types that render to the same text, such as the integer {@code 1} and the string {@code "1"}, share one key.
 * Grouping relies on this.
 * </p>
 * <p>
 * The label map is not updated implicitly.  Any code that changes the labels must call {@link #refresh()} before the
 * label map is read again.
 * </p>
 */
public final class Level {

    Values labels;
    private Map<String, List<Integer>> labelMap;
    private final String name;

    /**
     * Creates a level that takes ownership of {@code labels} and builds its label map.
     *
     * @param labels
     *     The labels.  The caller must not keep a reference to them.
     * @param name
     *     The level's name.
     */
    Level(Values labels, String name) {
        assert labels != null : "labels must not be null";
        assert name != null : "name must not be null";

        this.labels = labels;
        this.name = name;
        refresh();
    }

    /**
     * Creates a level from a list of labels.  The kind of the level is inferred from the labels the same way the kind
     * of a {@link Series} is inferred from its data.
     *
     * @param labels
     *     The labels.  This list is copied.
     * @param name
     *     The level's name. This may be blank.
     *
     * @return A new level.
     *
     * @throws NullPointerException
     *     if {@code labels} or {@code name} is {@code null}.
     * @throws ConstructionException
     *     if a label has an unsupported type.
     */
    public static Level of(List<?> labels, String name) {
        ArgumentUtil.checkNotNull(labels, "labels");
        ArgumentUtil.checkNotNull(name, "name");
        return new Level(ValuesFactory.fromList(labels), name);
    }

    /**
     * Creates a level with the integer labels {@code 0, 1, ..., n - 1}.
     *
     * @param n
     *     The number of labels.
     * @param name
     *     The level's name.
     *
     * @return A new {@link Kind#INT} level.
     */
    static Level range(int n, String name) {
        return new Level(Values.range(n), name);
    }

    /**
     * Rebuilds the label map from the current labels.
     */
    public void refresh() {
        Map<String, List<Integer>> newLabelMap = new HashMap<>();
        for (int i = 0; i < labels.len(); i++) {
            newLabelMap.computeIfAbsent(labels.render(i), key -> new ArrayList<>()).add(i);
        }
        labelMap = newLabelMap;
    }

    /**
     * @return The number of labels in this level.
     */
    public int len() {
        return labels.len();
    }

    /**
     * @return The kind of this level's labels.
     */
    public Kind kind() {
        return labels.kind();
    }

    /**
     * @return This level's name. This may be blank but never {@code null}.
     */
    public String name() {
        return name;
    }

    /**
     * Gets the label at a position.
     *
     * @param position
     *     The label's position.
     *
     * @return The label.  A null label is reported as the null representation of this level's kind.
     *
     * @throws BoundsException
     *     if {@code position} is out of range.
     */
    public Object label(int position) {
        ArgumentUtil.checkPosition(position, labels.len(), "row");
        return labels.value(position);
    }

    /**
     * @return All labels, in order.  The list is not modifiable.
     */
    public List<Object> labels() {
        return labels.values();
    }

    /**
     * Gets the positions at which a label appears.
     *
     * @param label
     *     The rendered label.
     *
     * @return The positions in ascending order. This is empty if the label doesn't appear.
     */
    public List<Integer> positions(String label) {
        List<Integer> positions = labelMap.get(label);
        return positions == null ? List.of() : Collections.unmodifiableList(positions);
    }

    /**
     * Gets the map from rendered label to the positions at which it appears.
     *
     * @return An unmodifiable view of the label map.
     */
    public Map<String, List<Integer>> labelMap() {
        return Collections.unmodifiableMap(labelMap);
    }

    /**
     * Creates a new level with the labels at the given positions, in the given order.  Positions may repeat.
     *
     * @param positions
     *     The positions to select.
     *
     * @return A new level with a fresh label map.
     *
     * @throws BoundsException
     *     if any position is out of range.
     */
    public Level subset(List<Integer> positions) {
        return new Level(labels.in(positions), name);
    }

    /**
     * Creates a new level whose labels are converted to another kind.  This never fails; labels that can't be
     * converted become null labels.
     *
     * @param kind
     *     The target kind.
     *
     * @return A new level with a fresh label map.
     *
     * @throws NullPointerException
     *     if {@code kind} is {@code null}.
     */
    public Level convert(Kind kind) {
        ArgumentUtil.checkNotNull(kind, "kind");
        return new Level(labels.convert(kind), name);
    }

    /**
     * Creates a deep copy of this level. The copy's label map is rebuilt, not shared.
     *
     * @return A new level.
     */
    public Level copy() {
        return new Level(labels.copy(), name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(labels, name);
    }

    /**
     * Two levels are equal if their names are equal and their labels have the same kind and are equal at every
     * position.
     */
    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Level otherLevel)) {
            return false;
        }
        return name.equals(otherLevel.name) && labels.equals(otherLevel.labels);
    }

    @Override
    public String toString() {
        return "Level{name=" + name + ", labels=" + labels + "}";
    }
}
