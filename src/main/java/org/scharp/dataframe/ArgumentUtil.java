///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.dataframe;

import java.util.List;

/**
 * A class with utility methods for validating arguments.
 */
abstract class ArgumentUtil {

    // private constructor to prevent anyone from instantiating the class.
    private ArgumentUtil() {
    }

    /**
     * Throws an exception if {@code argument} is {@code null}.
     *
     * @param argument
     *     The argument to check.
     * @param argumentName
     *     The name of the argument. This is used to create a more informative exception message.
     *
     * @throws NullPointerException
     *     if {@code argument} is {@code null}.
     */
    static void checkNotNull(Object argument, String argumentName) {
        if (argument == null) {
            throw new NullPointerException(argumentName + " must not be null");
        }
    }

    /**
     * Throws an exception if {@code argument} is negative (less than zero).
     *
     * @param argument
     *     The argument to check
     * @param argumentName
     *     The name of the argument. This is used to create a more informative exception message.
     *
     * @throws IllegalArgumentException
     *     if {@code argument} is negative
     */
    static void checkNotNegative(int argument, String argumentName) {
        assert argumentName != null : "argumentName must not be null";

        if (argument < 0) {
            throw new IllegalArgumentException(argumentName + " must not be negative");
        }
    }

    /**
     * Throws an exception if {@code position} does not address an existing element of a collection.
     *
     * @param position
     *     The position to check.
     * @param length
     *     The number of elements in the collection.
     * @param description
     *     What kind of position this is ("row", "column", "level").  This is used in the exception message.
     *
     * @throws BoundsException
     *     if {@code position} is negative or not less than {@code length}.
     */
    static void checkPosition(int position, int length, String description) {
        assert 0 <= length : "length must not be negative";

        if (position < 0 || length <= position) {
            throw new BoundsException(
                "invalid " + description + " position " + position + " (length " + length + ")");
        }
    }

    /**
     * Throws an exception if any of {@code positions} does not address an existing element of a collection.
     *
     * @param positions
     *     The positions to check.
     * @param length
     *     The number of elements in the collection.
     * @param description
     *     What kind of position this is ("row", "column", "level").  This is used in the exception message.
     *
     * @throws NullPointerException
     *     if {@code positions} is {@code null} or contains a {@code null} entry.
     * @throws BoundsException
     *     if any position is negative or not less than {@code length}.
     */
    static void checkPositions(List<Integer> positions, int length, String description) {
        checkNotNull(positions, description + " positions");
        for (Integer position : positions) {
            if (position == null) {
                throw new NullPointerException(description + " positions cannot contain a null entry");
            }
            checkPosition(position, length, description);
        }
    }

    /**
     * Throws an exception if {@code position} is not a valid place at which to insert an element into a collection.
     * Unlike {@link #checkPosition}, the position just past the last element is legal, since inserting there appends.
     *
     * @param position
     *     The insertion position to check.
     * @param length
     *     The number of elements in the collection.
     *
     * @throws BoundsException
     *     if {@code position} is negative or greater than {@code length}.
     */
    static void checkInsertPosition(int position, int length) {
        if (position < 0 || length < position) {
            throw new BoundsException("invalid insert position " + position + " (length " + length + ")");
        }
    }
}
