///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.dataframe;

/**
 * Thrown when an operation is requested on a {@link Kind} that does not support it, for example the sum of a
 * {@link Kind#STRING} Series.
 */
public class TypeUnsupportedException extends UnsupportedOperationException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates a new {@code TypeUnsupportedException}.
     *
     * @param message
     *     A description of the problem.
     */
    public TypeUnsupportedException(String message) {
        super(message);
    }
}
