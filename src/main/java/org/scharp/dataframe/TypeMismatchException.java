///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.dataframe;

/**
 * Thrown when a value is inserted into a column whose {@link Kind} cannot represent it, for example inserting text into
 * a {@link Kind#INT} Series.
 */
public class TypeMismatchException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates a new {@code TypeMismatchException}.
     *
     * @param message
     *     A description of the problem.
     */
    public TypeMismatchException(String message) {
        super(message);
    }
}
