///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.dataframe;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

/** Unit tests for {@link Config} and {@link IndexFactory}. */
public class ConfigTest {

    @Test
    void testDefaults() {
        Config config = Config.builder().build();
        assertNull(config.index());
        assertNull(config.multiIndex());
        assertNull(config.indexName());
        assertNull(config.multiIndexNames());
        assertNull(config.cols());
        assertNull(config.multiCol());
        assertNull(config.colsName());
        assertNull(config.multiColNames());
        assertEquals("", config.name());
        assertNull(config.kind());

        assertNull(Config.DEFAULT.index());
    }

    @Test
    void testBuilderCopiesLists() {
        List<Object> labels = new ArrayList<>(List.of("a", "b"));
        Config config = Config.builder().index(labels).name("s").kind(Kind.STRING).build();
        labels.add("c");

        assertEquals(List.of("a", "b"), config.index());
        assertEquals("s", config.name());
        assertEquals(Kind.STRING, config.kind());
        assertThrows(UnsupportedOperationException.class, () -> config.index().add("d"));
    }

    @Test
    void testNullArguments() {
        Config.Builder builder = Config.builder().name("original");

        Exception exception = assertThrows(NullPointerException.class, () -> builder.name(null));
        assertEquals("name must not be null", exception.getMessage());

        exception = assertThrows(NullPointerException.class, () -> builder.index(null));
        assertEquals("index must not be null", exception.getMessage());

        exception = assertThrows(NullPointerException.class, () -> builder.kind(null));
        assertEquals("kind must not be null", exception.getMessage());

        exception = assertThrows(NullPointerException.class,
            () -> builder.multiIndex(Arrays.asList(List.of(1), null)));
        assertEquals("multiIndex cannot contain a null level", exception.getMessage());

        exception = assertThrows(NullPointerException.class,
            () -> builder.multiColNames(Arrays.asList("a", null)));
        assertEquals("multiColNames cannot contain a null name", exception.getMessage());

        // The exception shouldn't corrupt the state of the builder.
        assertEquals("original", builder.build().name());
    }

    @Test
    void testDefaultIndex() {
        Index index = IndexFactory.indexFromConfig(Config.DEFAULT, 3);
        assertEquals(Index.of(Level.of(List.of(0, 1, 2), "")), index);

        Index named = IndexFactory.indexFromConfig(Config.builder().indexName("row").build(), 2);
        assertEquals(Index.of(Level.of(List.of(0, 1), "row")), named);
    }

    @Test
    void testSingleIndex() {
        Config config = Config.builder().index(List.of("a", "b")).indexName("letters").build();
        assertEquals(Index.of(Level.of(List.of("a", "b"), "letters")), IndexFactory.indexFromConfig(config, 2));

        Exception exception = assertThrows(ConstructionException.class, () -> IndexFactory.indexFromConfig(config, 3));
        assertEquals("index has 2 labels but the data has 3 elements", exception.getMessage());
    }

    @Test
    void testMultiIndex() {
        Config config = Config.builder().
            multiIndex(List.of(List.of("a", "b"), List.of(1, 2))).
            multiIndexNames(List.of("letter", "number")).
            build();
        Index expected = Index.of(Level.of(List.of("a", "b"), "letter"), Level.of(List.of(1, 2), "number"));
        assertEquals(expected, IndexFactory.indexFromConfig(config, 2));

        // names are optional
        Config unnamed = Config.builder().multiIndex(List.of(List.of("a"), List.of(1))).build();
        assertEquals(List.of("", ""), IndexFactory.indexFromConfig(unnamed, 1).names());

        // every level must match the data
        Config ragged = Config.builder().multiIndex(List.of(List.of("a", "b"), List.of(1))).build();
        Exception exception = assertThrows(ConstructionException.class, () -> IndexFactory.indexFromConfig(ragged, 2));
        assertEquals("index level 1 has 1 labels but the data has 2 elements", exception.getMessage());
    }

    @Test
    void testMultiIndexNamesLength() {
        Config config = Config.builder().
            multiIndex(List.of(List.of("a"), List.of(1))).
            multiIndexNames(List.of("only one")).
            build();
        Exception exception = assertThrows(ConstructionException.class, () -> IndexFactory.indexFromConfig(config, 1));
        assertEquals("multiIndexNames must have one name per level of multiIndex: got 1 names for 2 levels",
            exception.getMessage());
    }

    @Test
    void testAmbiguousIndex() {
        Config config = Config.builder().index(List.of("a")).multiIndex(List.of(List.of("a"))).build();
        Exception exception = assertThrows(AmbiguousConfigException.class,
            () -> IndexFactory.indexFromConfig(config, 1));
        assertEquals("cannot supply both index and multiIndex", exception.getMessage());

        Config names = Config.builder().indexName("a").multiIndexNames(List.of("a")).build();
        exception = assertThrows(AmbiguousConfigException.class, () -> IndexFactory.indexFromConfig(names, 1));
        assertEquals("cannot supply both indexName and multiIndexNames", exception.getMessage());

        // AmbiguousConfigException is a ConstructionException
        assertThrows(ConstructionException.class, () -> IndexFactory.indexFromConfig(config, 1));
    }

    @Test
    void testColumns() {
        assertEquals(Columns.of(ColLevel.of(List.of(0L, 1L), "")), IndexFactory.columnsFromConfig(Config.DEFAULT, 2));

        Config config = Config.builder().cols(List.of("foo", "bar")).colsName("field").build();
        assertEquals(Columns.of(ColLevel.of(List.of("foo", "bar"), "field")),
            IndexFactory.columnsFromConfig(config, 2));

        Exception exception = assertThrows(ConstructionException.class,
            () -> IndexFactory.columnsFromConfig(config, 3));
        assertEquals("cols has 2 labels but the data has 3 elements", exception.getMessage());

        Config multi = Config.builder().
            multiCol(List.of(List.of("x", "x"), List.of("a", "b"))).
            multiColNames(List.of("group", "field")).
            build();
        Columns columns = IndexFactory.columnsFromConfig(multi, 2);
        assertEquals(2, columns.numLevels());
        assertEquals(List.of("group", "field"), columns.names());

        Config ambiguous = Config.builder().cols(List.of("a")).multiCol(List.of(List.of("a"))).build();
        exception = assertThrows(AmbiguousConfigException.class, () -> IndexFactory.columnsFromConfig(ambiguous, 1));
        assertEquals("cannot supply both cols and multiCol", exception.getMessage());
    }
}
