///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.dataframe;

/**
 * Thrown when a row position, column position, or index level is out of range.
 */
public class BoundsException extends IndexOutOfBoundsException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates a new {@code BoundsException}.
     *
     * @param message
     *     A description of the problem.
     */
    public BoundsException(String message) {
        super(message);
    }
}
