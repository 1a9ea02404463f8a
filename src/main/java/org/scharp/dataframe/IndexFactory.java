///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.dataframe;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds row indices and column labels from the options in a {@link Config}.
 */
final class IndexFactory {

    // private constructor to prevent anyone from instantiating the class.
    private IndexFactory() {
    }

    /**
     * Builds the row index for data with {@code n} rows.  If the configuration has no row labels, the index is the
     * range {@code 0..n-1}.
     *
     * @param config
     *     The construction options.
     * @param n
     *     The number of rows.
     *
     * @return A new index.
     *
     * @throws AmbiguousConfigException
     *     if both single-level and multi-level row options are given.
     * @throws ConstructionException
     *     if the number of labels in a level isn't {@code n}, if the number of names isn't the number of levels, or if
     *     a label has an unsupported type.
     */
    static Index indexFromConfig(Config config, int n) {
        if (config.index() != null && config.multiIndex() != null) {
            throw new AmbiguousConfigException("cannot supply both index and multiIndex");
        }
        if (config.indexName() != null && config.multiIndexNames() != null) {
            throw new AmbiguousConfigException("cannot supply both indexName and multiIndexNames");
        }

        if (config.multiIndex() != null) {
            List<List<Object>> multiIndex = config.multiIndex();
            List<String> names = levelNames(config.multiIndexNames(), config.indexName(), multiIndex.size(),
                "multiIndexNames", "multiIndex");

            List<Level> levels = new ArrayList<>(multiIndex.size());
            for (int i = 0; i < multiIndex.size(); i++) {
                checkLength(multiIndex.get(i).size(), n, "index level " + i);
                levels.add(Level.of(multiIndex.get(i), names.get(i)));
            }
            return levels.isEmpty() ? Index.range(n, "") : Index.ofOwned(levels);
        }

        String name = singleName(config.indexName(), config.multiIndexNames(), "multiIndexNames");
        if (config.index() != null) {
            checkLength(config.index().size(), n, "index");
            List<Level> levels = new ArrayList<>(1);
            levels.add(Level.of(config.index(), name));
            return Index.ofOwned(levels);
        }
        return Index.range(n, name);
    }

    /**
     * Builds the column labels for {@code n} columns.  If the configuration has no column labels, the labels are the
     * range {@code 0..n-1}.
     *
     * @param config
     *     The construction options.
     * @param n
     *     The number of columns.
     *
     * @return New column labels.
     *
     * @throws AmbiguousConfigException
     *     if both single-level and multi-level column options are given.
     * @throws ConstructionException
     *     if the number of labels in a level isn't {@code n} or if the number of names isn't the number of levels.
     */
    static Columns columnsFromConfig(Config config, int n) {
        if (config.cols() != null && config.multiCol() != null) {
            throw new AmbiguousConfigException("cannot supply both cols and multiCol");
        }
        if (config.colsName() != null && config.multiColNames() != null) {
            throw new AmbiguousConfigException("cannot supply both colsName and multiColNames");
        }

        if (config.multiCol() != null) {
            List<List<Object>> multiCol = config.multiCol();
            List<String> names = levelNames(config.multiColNames(), config.colsName(), multiCol.size(),
                "multiColNames", "multiCol");

            List<ColLevel> levels = new ArrayList<>(multiCol.size());
            for (int i = 0; i < multiCol.size(); i++) {
                checkLength(multiCol.get(i).size(), n, "column level " + i);
                levels.add(ColLevel.of(multiCol.get(i), names.get(i)));
            }
            return levels.isEmpty() ? Columns.range(n, "") : Columns.of(levels);
        }

        String name = singleName(config.colsName(), config.multiColNames(), "multiColNames");
        if (config.cols() != null) {
            checkLength(config.cols().size(), n, "cols");
            return Columns.of(ColLevel.of(config.cols(), name));
        }
        return Columns.range(n, name);
    }

    private static List<String> levelNames(List<String> names, String singleName, int numLevels,
        String namesDescription, String levelsDescription) {
        if (names == null) {
            List<String> blankNames = new ArrayList<>(numLevels);
            for (int i = 0; i < numLevels; i++) {
                // a single name labels the outermost level.
                blankNames.add(i == 0 && singleName != null ? singleName : "");
            }
            return blankNames;
        }
        if (names.size() != numLevels) {
            throw new ConstructionException(
                namesDescription + " must have one name per level of " + levelsDescription + ": got " + names.size() +
                    " names for " + numLevels + " levels");
        }
        return names;
    }

    private static String singleName(String name, List<String> names, String namesDescription) {
        if (names == null) {
            return name == null ? "" : name;
        }
        if (names.size() != 1) {
            throw new ConstructionException(
                namesDescription + " must have one name per level: got " + names.size() + " names for 1 level");
        }
        return names.get(0);
    }

    private static void checkLength(int actual, int expected, String description) {
        if (actual != expected) {
            throw new ConstructionException(
                description + " has " + actual + " labels but the data has " + expected + " elements");
        }
    }
}
