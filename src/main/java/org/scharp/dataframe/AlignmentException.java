///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.dataframe;

/**
 * Thrown when the labels of an index and the values they identify no longer have the same length.
 * <p>
 * Callers cannot cause this through the public API.  It indicates a bug in this library.
 * </p>
 */
public class AlignmentException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates a new {@code AlignmentException}.
     *
     * @param message
     *     A description of the problem.
     */
    public AlignmentException(String message) {
        super(message);
    }
}
