///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
/**
 * <p>
 * This library holds labeled, typed, nullable tabular data in memory.
 * </p>
 *
 * <p>
 * See the documentation for {@link org.scharp.dataframe.Series} and {@link org.scharp.dataframe.DataFrame} for sample
 * code.
 * </p>
 *
 * <h2>Data Model</h2>
 *
 * <p>
 * A {@link org.scharp.dataframe.Series} is a sequence of values of one {@link org.scharp.dataframe.Kind}, together
 * with an {@link org.scharp.dataframe.Index} that labels each value.  An index has one or more
 * {@link org.scharp.dataframe.Level levels}, so a value may be labeled by a hierarchy such as (state, city).  A
 * {@link org.scharp.dataframe.DataFrame} is a list of Series that share one index, labeled by
 * {@link org.scharp.dataframe.Columns}.
 * </p>
 *
 * <p>
 * Every value may be null.  A null value is reported as the null representation of its kind: {@code NaN} for
 * {@code FLOAT}, {@code 0} for {@code INT}, {@code false} for {@code BOOL}, the epoch for {@code DATE_TIME}, and
 * {@code null} for {@code STRING} and {@code GENERIC}.  Use {@link org.scharp.dataframe.Element#isNull()} to tell a
 * null value apart from a real value that happens to equal the null representation.  Aggregations skip null values.
 * </p>
 *
 * <p>
 * Each level keeps a map from label to the positions at which the label appears.  The map is keyed by the rendered
 * text of the label, so labels of different types with the same text, such as {@code 1} and {@code "1"}, share a key.
 * Grouping relies on this.
 * </p>
 *
 * <h2>Error Handling Strategy</h2>
 * <p>
 * Arguments are checked before anything is changed, and bad arguments are reported with unchecked exceptions as soon
 * as possible (fail-fast).  An operation that throws leaves its receiver unchanged.  Conversions between kinds never
 * throw; a value that can't be converted becomes null.  The one exception to fail-fast is
 * {@link org.scharp.dataframe.DataFrame#col(String)}, which logs a warning through SLF4J and returns an empty Series
 * when no column has the requested label.
 * </p>
 */
package org.scharp.dataframe;
