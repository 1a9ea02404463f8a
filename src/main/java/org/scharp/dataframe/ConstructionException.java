///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.dataframe;

/**
 * Thrown when a {@link Series} or {@link DataFrame} cannot be built from the data and options it was given, for
 * example because an element has an unsupported type or because a custom index has a different length than the data.
 */
public class ConstructionException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates a new {@code ConstructionException}.
     *
     * @param message
     *     A description of the problem.
     */
    public ConstructionException(String message) {
        super(message);
    }
}
