///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.dataframe;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Options for constructing a {@link Series} or a {@link DataFrame}.
 * <p>
 * Instances of this class are immutable.  They are created with a {@link Config.Builder}:
 * </p>
 *
 * <pre>
 * Config config = Config.builder().
 *     index(List.of("foo", "bar", "baz")).
 *     indexName("city").
 *     name("population").
 *     build();
 * </pre>
 *
 * <p>
 * An option that isn't set is absent, not blank.  Setting both the single-level and the multi-level form of the row
 * labels (or of the column labels) is an error that is reported when the configuration is used, not when it is built.
 * </p>
 */
public final class Config {

    /** A configuration with no options set. */
    public static final Config DEFAULT = builder().build();

    private final List<Object> index;
    private final List<List<Object>> multiIndex;
    private final String indexName;
    private final List<String> multiIndexNames;
    private final List<Object> cols;
    private final List<List<Object>> multiCol;
    private final String colsName;
    private final List<String> multiColNames;
    private final String name;
    private final Kind kind;

    /**
     * A builder class for {@link Config}.
     */
    public final static class Builder {
        private List<Object> index;
        private List<List<Object>> multiIndex;
        private String indexName;
        private List<String> multiIndexNames;
        private List<Object> cols;
        private List<List<Object>> multiCol;
        private String colsName;
        private List<String> multiColNames;
        private String name;
        private Kind kind;

        private Builder() {
            // every option is absent until it is set.
            this.name = "";
        }

        /**
         * Sets the labels of a single-level row index.
         *
         * @param index
         *     The labels, one per row.  This list is copied.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code index} is {@code null}.
         */
        public Builder index(List<?> index) {
            ArgumentUtil.checkNotNull(index, "index");
            this.index = new ArrayList<>(index);
            return this;
        }

        /**
         * Sets the labels of a multi-level row index.
         *
         * @param multiIndex
         *     The labels of each level, outermost level first.  Each level has one label per row.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code multiIndex} is {@code null} or contains a {@code null} level.
         */
        public Builder multiIndex(List<? extends List<?>> multiIndex) {
            this.multiIndex = copyLevels(multiIndex, "multiIndex");
            return this;
        }

        /**
         * Sets the name of a single-level row index.
         *
         * @param indexName
         *     The name.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code indexName} is {@code null}.
         */
        public Builder indexName(String indexName) {
            ArgumentUtil.checkNotNull(indexName, "indexName");
            this.indexName = indexName;
            return this;
        }

        /**
         * Sets the names of the levels of a multi-level row index.
         *
         * @param multiIndexNames
         *     The names, one per level.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code multiIndexNames} is {@code null} or contains a {@code null} entry.
         */
        public Builder multiIndexNames(List<String> multiIndexNames) {
            this.multiIndexNames = copyNames(multiIndexNames, "multiIndexNames");
            return this;
        }

        /**
         * Sets the labels of single-level DataFrame columns.  This is ignored when constructing a {@link Series}.
         *
         * @param cols
         *     The labels, one per column.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code cols} is {@code null}.
         */
        public Builder cols(List<?> cols) {
            ArgumentUtil.checkNotNull(cols, "cols");
            this.cols = new ArrayList<>(cols);
            return this;
        }

        /**
         * Sets the labels of multi-level DataFrame columns.  This is ignored when constructing a {@link Series}.
         *
         * @param multiCol
         *     The labels of each column level, outermost level first.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code multiCol} is {@code null} or contains a {@code null} level.
         */
        public Builder multiCol(List<? extends List<?>> multiCol) {
            this.multiCol = copyLevels(multiCol, "multiCol");
            return this;
        }

        /**
         * Sets the name of the single column level.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code colsName} is {@code null}.
         */
        public Builder colsName(String colsName) {
            ArgumentUtil.checkNotNull(colsName, "colsName");
            this.colsName = colsName;
            return this;
        }

        /**
         * Sets the names of the column levels.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code multiColNames} is {@code null} or contains a {@code null} entry.
         */
        public Builder multiColNames(List<String> multiColNames) {
            this.multiColNames = copyNames(multiColNames, "multiColNames");
            return this;
        }

        /**
         * Sets the name of the Series or DataFrame.
         *
         * @param name
         *     The name.  This may be blank.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code name} is {@code null}.
         */
        public Builder name(String name) {
            ArgumentUtil.checkNotNull(name, "name");
            this.name = name;
            return this;
        }

        /**
         * Sets the kind that the values are converted to after construction.
         *
         * @param kind
         *     The target kind.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code kind} is {@code null}.
         */
        public Builder kind(Kind kind) {
            ArgumentUtil.checkNotNull(kind, "kind");
            this.kind = kind;
            return this;
        }

        /**
         * Builds an immutable {@link Config} from this builder's options.
         *
         * @return A new configuration.
         */
        public Config build() {
            return new Config(this);
        }

        private static List<List<Object>> copyLevels(List<? extends List<?>> levels, String description) {
            ArgumentUtil.checkNotNull(levels, description);
            List<List<Object>> copies = new ArrayList<>(levels.size());
            for (List<?> level : levels) {
                if (level == null) {
                    throw new NullPointerException(description + " cannot contain a null level");
                }
                copies.add(Collections.unmodifiableList(new ArrayList<>(level)));
            }
            return Collections.unmodifiableList(copies);
        }

        private static List<String> copyNames(List<String> names, String description) {
            ArgumentUtil.checkNotNull(names, description);
            for (String name : names) {
                if (name == null) {
                    throw new NullPointerException(description + " cannot contain a null name");
                }
            }
            return List.copyOf(names);
        }
    }

    /**
     * Creates a new configuration builder with no options set.
     *
     * @return A new builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    private Config(Builder builder) {
        this.index = builder.index == null ? null : Collections.unmodifiableList(builder.index);
        this.multiIndex = builder.multiIndex;
        this.indexName = builder.indexName;
        this.multiIndexNames = builder.multiIndexNames;
        this.cols = builder.cols == null ? null : Collections.unmodifiableList(builder.cols);
        this.multiCol = builder.multiCol;
        this.colsName = builder.colsName;
        this.multiColNames = builder.multiColNames;
        this.name = builder.name;
        this.kind = builder.kind;
    }

    /**
     * @return The single-level row labels, or {@code null} if not set.
     */
    public List<Object> index() {
        return index;
    }

    /**
     * @return The multi-level row labels, or {@code null} if not set.
     */
    public List<List<Object>> multiIndex() {
        return multiIndex;
    }

    /**
     * @return The name of a single-level row index, or {@code null} if not set.
     */
    public String indexName() {
        return indexName;
    }

    /**
     * @return The names of a multi-level row index, or {@code null} if not set.
     */
    public List<String> multiIndexNames() {
        return multiIndexNames;
    }

    /**
     * @return The single-level column labels, or {@code null} if not set.
     */
    public List<Object> cols() {
        return cols;
    }

    /**
     * @return The multi-level column labels, or {@code null} if not set.
     */
    public List<List<Object>> multiCol() {
        return multiCol;
    }

    /**
     * @return The name of the single column level, or {@code null} if not set.
     */
    public String colsName() {
        return colsName;
    }

    /**
     * @return The names of the column levels, or {@code null} if not set.
     */
    public List<String> multiColNames() {
        return multiColNames;
    }

    /**
     * @return The name of the Series or DataFrame.  This is blank if not set.
     */
    public String name() {
        return name;
    }

    /**
     * @return The kind to convert the values to, or {@code null} to keep the inferred kind.
     */
    public Kind kind() {
        return kind;
    }
}
