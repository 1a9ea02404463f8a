///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.dataframe;

/**
 * The kind of values held by a {@link Series} or by a level of an {@link Index}.
 * <p>
 * Every column of values is homogeneous: all of its elements have the same kind.  Each kind has its own way of
 * representing a null element.
 * </p>
 */
public enum Kind {
    /** Double precision floating point values.  Null is represented as {@code NaN}. */
    FLOAT("float"),

    /** 64-bit integer values.  Null is an explicit flag, so 0 is not null. */
    INT("int"),

    /** Text values.  Null is distinct from the empty string. */
    STRING("string"),

    /** Boolean values.  Null is an explicit flag, so {@code false} is not null. */
    BOOL("bool"),

    /** Instants on the UTC time-line.  Null is an explicit flag, so the epoch is not null. */
    DATE_TIME("dateTime"),

    /** Values of any supported type, mixed together. */
    GENERIC("generic");

    private final String displayName;

    Kind(String displayName) {
        this.displayName = displayName;
    }

    /**
     * Determines whether numeric aggregations (sum, mean, quartiles, ...) can be computed over values of this kind.
     *
     * @return {@code true} for {@link #FLOAT}, {@link #INT}, and {@link #BOOL}. {@code false} otherwise.
     */
    public boolean isNumeric() {
        return this == FLOAT || this == INT || this == BOOL;
    }

    /**
     * Gets the name of this kind as it is displayed when a Series is printed.
     *
     * @return The display name, for example "float" or "dateTime".
     */
    public String displayName() {
        return displayName;
    }
}
