///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.dataframe;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A read-only snapshot of one row of a {@link Series}: its value, whether it is null, and its label at every index
 * level.
 */
public final class Element {

    private final Object value;
    private final boolean isNull;
    private final List<Object> labels;
    private final List<Kind> labelKinds;

    Element(Object value, boolean isNull, List<Object> labels, List<Kind> labelKinds) {
        this.value = value;
        this.isNull = isNull;
        // labels may contain null entries, so List.copyOf can't be used.
        this.labels = Collections.unmodifiableList(new ArrayList<>(labels));
        this.labelKinds = List.copyOf(labelKinds);
    }

    /**
     * @return The element's value.  For a null element, this is the null representation of the Series' kind (for
     *     example, {@code NaN} for {@link Kind#FLOAT}).
     */
    public Object value() {
        return value;
    }

    /**
     * @return {@code true}, if the element is null.
     */
    public boolean isNull() {
        return isNull;
    }

    /**
     * @return The element's label at every index level, outermost first.
     */
    public List<Object> labels() {
        return labels;
    }

    /**
     * @return The kind of every index level, outermost first.
     */
    public List<Kind> labelKinds() {
        return labelKinds;
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, isNull, labels, labelKinds);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Element otherElement)) {
            return false;
        }
        return isNull == otherElement.isNull &&
            Objects.equals(value, otherElement.value) &&
            labels.equals(otherElement.labels) &&
            labelKinds.equals(otherElement.labelKinds);
    }

    @Override
    public String toString() {
        return "Element{value=" + value + ", null=" + isNull + ", labels=" + labels + ", labelKinds=" + labelKinds +
            "}";
    }
}
