///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.dataframe;

/**
 * Thrown when a {@link Config} supplies two options that contradict each other, such as both a single-level index and
 * a multi-level index.
 */
public class AmbiguousConfigException extends ConstructionException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates a new {@code AmbiguousConfigException}.
     *
     * @param message
     *     A description of the problem.
     */
    public AmbiguousConfigException(String message) {
        super(message);
    }
}
