///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.dataframe;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/** Unit tests for {@link Series}. */
public class SeriesTest {

    private static Series lettered(List<?> data, String... labels) {
        return Series.of(data, Config.builder().index(Arrays.asList(labels)).build());
    }

    private static List<Object> labels(Series series, int level) {
        return series.index().level(level).labels();
    }

    @Test
    void testOfInfersKind() {
        assertEquals(Kind.FLOAT, Series.of(List.of(1.0, 2.0)).kind());
        assertEquals(Kind.FLOAT, Series.of(List.of(1, 2.5)).kind());
        assertEquals(Kind.INT, Series.of(new int[] { 1, 2, 3 }).kind());
        assertEquals(Kind.STRING, Series.of(Arrays.asList("a", null)).kind());
        assertEquals(Kind.BOOL, Series.of(new boolean[] { true }).kind());
        assertEquals(Kind.DATE_TIME, Series.of(new Instant[] { Instant.EPOCH }).kind());
        assertEquals(Kind.GENERIC, Series.of(List.of(1, "a")).kind());
        assertEquals(Kind.GENERIC, Series.of(Arrays.asList(null, null)).kind());

        // a single supported value is a Series of length one.
        Series scalar = Series.of(5);
        assertEquals(1, scalar.len());
        assertEquals(List.of(5L), scalar.values());
    }

    @Test
    void testOfDefaults() {
        Series series = Series.of(List.of(1.5, 2.5, 3.5));
        assertEquals(3, series.len());
        assertEquals("", series.name());
        assertEquals(1, series.numIndexLevels());
        assertEquals(List.of(0L, 1L, 2L), labels(series, 0));
        assertEquals(Kind.INT, series.index().level(0).kind());
    }

    @Test
    void testOfWithConfig() {
        Config config = Config.builder().
            multiIndex(List.of(List.of("a", "a"), List.of(1, 2))).
            multiIndexNames(List.of("letter", "number")).
            name("values").
            build();
        Series series = Series.of(List.of(10, 20), config);
        assertEquals("values", series.name());
        assertEquals(2, series.numIndexLevels());
        assertEquals(List.of("letter", "number"), series.index().names());
        assertEquals("a", series.indexAt(1, 0));
        assertEquals(2L, series.indexAt(1, 1));
    }

    @Test
    void testOfConvertsToConfiguredKind() {
        Series series = Series.of(List.of("1", "2", "x"), Config.builder().kind(Kind.INT).build());
        assertEquals(Kind.INT, series.kind());
        assertEquals(List.of(1L, 2L, 0L), series.values());
        assertEquals(List.of(2), series.nullPositions());
        assertEquals(List.of(0, 1), series.validPositions());
    }

    @Test
    void testOfErrors() {
        Exception exception = assertThrows(ConstructionException.class, () -> Series.of(new Object()));
        assertEquals("unsupported data type: java.lang.Object", exception.getMessage());

        exception = assertThrows(ConstructionException.class,
            () -> Series.of(List.of(1, 2), Config.builder().index(List.of("a")).build()));
        assertEquals("index has 1 labels but the data has 2 elements", exception.getMessage());

        Config ambiguous = Config.builder().index(List.of("a")).multiIndex(List.of(List.of("a"))).build();
        assertThrows(AmbiguousConfigException.class, () -> Series.of(List.of(1), ambiguous));

        exception = assertThrows(NullPointerException.class, () -> Series.of(List.of(1), null));
        assertEquals("config must not be null", exception.getMessage());
    }

    @Test
    void testEmpty() {
        Series empty = Series.empty();
        assertEquals(0, empty.len());
        assertEquals(Kind.GENERIC, empty.kind());
        assertEquals(1, empty.numIndexLevels());
        assertEquals(empty, Series.of(List.of()));
    }

    @Test
    void testRename() {
        Series series = Series.of(List.of(1));
        series.rename("renamed");
        assertEquals("renamed", series.name());

        series.inPlace().rename("again");
        assertEquals("again", series.name());

        assertThrows(NullPointerException.class, () -> series.rename(null));
        assertEquals("again", series.name());
    }

    @Test
    void testElement() {
        Series series = lettered(Arrays.asList(1.5, null), "a", "b");

        Element first = series.element(0);
        assertEquals(1.5, first.value());
        assertFalse(first.isNull());
        assertEquals(List.of("a"), first.labels());
        assertEquals(List.of(Kind.STRING), first.labelKinds());

        Element second = series.element(1);
        assertTrue(Double.isNaN((Double) second.value()));
        assertTrue(second.isNull());
        assertEquals(List.of("b"), second.labels());

        Exception exception = assertThrows(BoundsException.class, () -> series.element(2));
        assertEquals("invalid row position 2 (length 2)", exception.getMessage());
    }

    @Test
    void testNullRepresentations() {
        Series ints = Series.of(Arrays.asList(1, null));
        assertEquals(0L, ints.element(1).value());
        assertTrue(ints.element(1).isNull());

        // a real zero is not null.
        Series zero = Series.of(List.of(0));
        assertEquals(0L, zero.element(0).value());
        assertFalse(zero.element(0).isNull());

        Series strings = Series.of(Arrays.asList("a", null));
        assertNull(strings.element(1).value());
        assertTrue(strings.element(1).isNull());
    }

    @Test
    void testIndexIsCopied() {
        Series series = lettered(List.of(1, 2), "a", "b");
        Index index = series.index();
        index.level(0).labels.drop(0);
        assertEquals(List.of("a", "b"), labels(series, 0));
    }

    @Test
    void testSubset() {
        Series series = lettered(List.of(10, 20, 30), "a", "b", "c");
        Series subset = series.subset(List.of(2, 0, 2));
        assertEquals(List.of(30L, 10L, 30L), subset.values());
        assertEquals(List.of("c", "a", "c"), labels(subset, 0));
        assertEquals(List.of(0, 2), subset.index().level(0).positions("c"));

        Exception exception = assertThrows(BoundsException.class, () -> series.subset(List.of(3)));
        assertEquals("invalid row position 3 (length 3)", exception.getMessage());
    }

    @Test
    void testSubsetChecksAlignmentFirst() {
        Series series = lettered(List.of(10, 20, 30), "a", "b", "c");
        series.index.level(0).labels.drop(0);

        // alignment is checked before the positions.
        Exception exception = assertThrows(AlignmentException.class, () -> series.subset(List.of(7)));
        assertEquals("index has 2 labels but the Series has 3 values", exception.getMessage());
    }

    @Test
    void testInsert() {
        Series series = lettered(List.of(1, 3), "a", "c");
        Series inserted = series.insert(1, 2, List.of("b"));

        assertEquals(List.of(1L, 2L, 3L), inserted.values());
        assertEquals(List.of("a", "b", "c"), labels(inserted, 0));
        assertEquals(List.of(1), inserted.index().level(0).positions("b"));

        // the original is unchanged.
        assertEquals(List.of(1L, 3L), series.values());

        // inserting at the length appends.
        Series appended = series.insert(2, 4, List.of("d"));
        assertEquals(List.of(1L, 3L, 4L), appended.values());
        assertEquals(appended, series.append(4, List.of("d")));

        // a null value is allowed.
        Series withNull = series.insert(0, null, List.of("z"));
        assertEquals(List.of(0), withNull.nullPositions());
    }

    @Test
    void testInsertErrors() {
        Series series = lettered(List.of(1, 3), "a", "c");
        Series original = series.copy();

        Exception exception = assertThrows(BoundsException.class, () -> series.inPlace().insert(3, 1, List.of("x")));
        assertEquals("invalid insert position 3 (length 2)", exception.getMessage());

        exception = assertThrows(IllegalArgumentException.class,
            () -> series.inPlace().insert(0, 1, List.of("x", "y")));
        assertEquals("insert needs one label per index level: got 2 labels for 1 levels", exception.getMessage());

        exception = assertThrows(TypeMismatchException.class, () -> series.inPlace().insert(0, "x", List.of("x")));
        assertEquals("cannot insert x (String) into a column of kind int", exception.getMessage());

        // the value is acceptable but the label isn't.
        exception = assertThrows(TypeMismatchException.class, () -> series.inPlace().insert(0, 5, List.of(5)));
        assertEquals("cannot insert 5 (Integer) into a column of kind string", exception.getMessage());

        // none of the failed inserts changed the Series.
        assertEquals(original, series);
        assertEquals(List.of(0), series.index().level(0).positions("a"));
    }

    @Test
    void testInsertThenDropRestores() {
        Series series = lettered(List.of(1.0, 2.0, 3.0), "a", "b", "c");
        for (int position = 0; position <= series.len(); position++) {
            assertEquals(series, series.insert(position, 9.0, List.of("z")).drop(position));
        }
    }

    @Test
    void testInPlaceMatchesCopy() {
        Series series = lettered(Arrays.asList(3.0, null, 1.0), "a", "b", "c");

        Series sorted = series.copy();
        sorted.inPlace().sort(true);
        assertEquals(series.sort(true), sorted);

        Series dropped = series.copy();
        dropped.inPlace().dropNull();
        assertEquals(series.dropNull(), dropped);

        Series swapped = series.copy();
        swapped.inPlace().swap(0, 2);
        assertEquals(series.swap(0, 2), swapped);

        Series inserted = series.copy();
        inserted.inPlace().insert(1, 2.0, List.of("x"));
        assertEquals(series.insert(1, 2.0, List.of("x")), inserted);

        assertSame(series, series.inPlace().series());
    }

    @Test
    void testDrop() {
        Series series = lettered(List.of(10, 20, 30, 40), "a", "b", "c", "d");

        Series dropped = series.drop(0);
        assertEquals(List.of(20L, 30L, 40L), dropped.values());
        assertEquals(List.of(0), dropped.index().level(0).positions("b"));

        Series rows = series.dropRows(List.of(0, 2, 0));
        assertEquals(List.of(20L, 40L), rows.values());
        assertEquals(List.of("b", "d"), labels(rows, 0));

        Exception exception = assertThrows(BoundsException.class, () -> series.inPlace().dropRows(List.of(1, 4)));
        assertEquals("invalid row position 4 (length 4)", exception.getMessage());
        assertEquals(4, series.len());

        exception = assertThrows(BoundsException.class, () -> series.drop(-1));
        assertEquals("invalid row position -1 (length 4)", exception.getMessage());
    }

    @Test
    void testDropNull() {
        Series series = lettered(Arrays.asList(null, "x", null, "y"), "a", "b", "c", "d");
        Series dropped = series.dropNull();
        assertEquals(List.of("x", "y"), dropped.values());
        assertEquals(List.of("b", "d"), labels(dropped, 0));
        assertTrue(dropped.nullPositions().isEmpty());

        // dropping nulls again changes nothing.
        assertEquals(dropped, dropped.dropNull());
    }

    @Test
    void testJoin() {
        Series ints = Series.of(List.of(1, 2));
        Series floats = Series.of(List.of(2.5));

        // the joined values take the receiver's kind.
        Series joined = ints.join(floats);
        assertEquals(Kind.INT, joined.kind());
        assertEquals(List.of(1L, 2L, 2L), joined.values());
        assertEquals(List.of(0L, 1L, 0L), labels(joined, 0));
        assertEquals(List.of(0, 2), joined.index().level(0).positions("0"));

        // the argument is unchanged.
        assertEquals(1, floats.len());
    }

    @Test
    void testJoinSelf() {
        Series series = lettered(List.of("x", "y"), "a", "b");
        series.inPlace().join(series);
        assertEquals(List.of("x", "y", "x", "y"), series.values());
        assertEquals(List.of("a", "b", "a", "b"), labels(series, 0));
    }

    @Test
    void testJoinLevelMismatch() {
        Series single = Series.of(List.of(1));
        Series multi = Series.of(List.of(1), Config.builder().multiIndex(List.of(List.of("a"), List.of("b"))).build());

        Exception exception = assertThrows(IllegalArgumentException.class, () -> single.join(multi));
        assertEquals("cannot join a Series with 2 index levels to a Series with 1 index levels",
            exception.getMessage());
    }

    @Test
    void testSortIsStableWithNullsLast() {
        Series series = lettered(Arrays.asList(3.0, null, 1.0, 3.0, null), "a", "b", "c", "d", "e");

        Series ascending = series.sort(true);
        assertEquals(Arrays.asList(1.0, 3.0, 3.0, Double.NaN, Double.NaN), ascending.values());
        assertEquals(List.of("c", "a", "d", "b", "e"), labels(ascending, 0));
        assertEquals(List.of(3, 4), ascending.nullPositions());

        Series descending = series.sort(false);
        assertEquals(Arrays.asList(3.0, 3.0, 1.0, Double.NaN, Double.NaN), descending.values());
        assertEquals(List.of("a", "d", "c", "b", "e"), labels(descending, 0));

        // sorting a sorted Series changes nothing.
        assertEquals(ascending, ascending.sort(true));
    }

    @Test
    void testSortIndex() {
        Series series = lettered(List.of(1, 2, 3), "b", "c", "a");

        Series ascending = series.sortIndex(true);
        assertEquals(List.of(3L, 1L, 2L), ascending.values());
        assertEquals(List.of("a", "b", "c"), labels(ascending, 0));
        assertEquals(List.of(0), ascending.index().level(0).positions("a"));

        Series descending = series.sortIndex(false);
        assertEquals(List.of(2L, 1L, 3L), descending.values());
    }

    @Test
    void testSwap() {
        Series series = lettered(List.of(1, 2, 3), "a", "b", "c");
        Series swapped = series.swap(0, 2);
        assertEquals(List.of(3L, 2L, 1L), swapped.values());
        assertEquals(List.of("c", "b", "a"), labels(swapped, 0));
        assertEquals(List.of(2), swapped.index().level(0).positions("a"));

        assertEquals(series, swapped.swap(2, 0));

        Exception exception = assertThrows(BoundsException.class, () -> series.swap(0, 3));
        assertEquals("invalid row position 3 (length 3)", exception.getMessage());
    }

    @Test
    void testConvert() {
        Series series = Series.of(Arrays.asList(1, null, 3));
        Series strings = series.convert(Kind.STRING);
        assertEquals(Kind.STRING, strings.kind());
        assertEquals(Arrays.asList("1", null, "3"), strings.values());

        Series floats = series.convert(Kind.FLOAT);
        assertEquals(Arrays.asList(1.0, Double.NaN, 3.0), floats.values());
        assertEquals(List.of(1), floats.nullPositions());

        // the original is unchanged.
        assertEquals(Kind.INT, series.kind());
    }

    @Test
    void testConvertGenericToNumbers() {
        Series generic = Series.of(Arrays.asList(1, "2", true, Instant.EPOCH));
        assertEquals(Kind.GENERIC, generic.kind());

        Series floats = generic.convert(Kind.FLOAT);
        assertEquals(Arrays.asList(1.0, 2.0, Double.NaN, Double.NaN), floats.values());
        assertEquals(List.of(2, 3), floats.nullPositions());

        Series ints = generic.convert(Kind.INT);
        assertEquals(List.of(1L, 2L, 0L, 0L), ints.values());
        assertEquals(List.of(2, 3), ints.nullPositions());

        // the same rule applies when the kind is set at construction.
        Series configured = Series.of(Arrays.asList(1, "2", true, Instant.EPOCH),
            Config.builder().kind(Kind.FLOAT).build());
        assertEquals(floats, configured);
    }

    @Test
    void testJoinGenericIntoInts() {
        Series ints = Series.of(List.of(7));
        Series joined = ints.join(Series.of(Arrays.asList(1, "2", true, Instant.EPOCH)));
        assertEquals(Kind.INT, joined.kind());
        assertEquals(List.of(7L, 1L, 2L, 0L, 0L), joined.values());
        assertEquals(List.of(3, 4), joined.nullPositions());
    }

    @Test
    void testConvertIndexLevel() {
        Series series = Series.of(List.of("x", "y"));
        Series converted = series.convertIndexLevel(0, Kind.STRING);
        assertEquals(Kind.STRING, converted.index().level(0).kind());
        assertEquals(List.of("0", "1"), labels(converted, 0));
        assertEquals(List.of(1), converted.index().level(0).positions("1"));
        assertEquals(Kind.INT, series.index().level(0).kind());

        Exception exception = assertThrows(BoundsException.class, () -> series.convertIndexLevel(1, Kind.STRING));
        assertEquals("invalid level position 1 (length 1)", exception.getMessage());
    }

    @Test
    void testIndexLevels() {
        Config config = Config.builder().
            multiIndex(List.of(List.of("a", "b"), List.of(1, 2))).
            multiIndexNames(List.of("letter", "number")).
            build();
        Series series = Series.of(List.of(1.0, 2.0), config);

        Series dropped = series.dropIndexLevel(0);
        assertEquals(1, dropped.numIndexLevels());
        assertEquals(List.of("number"), dropped.index().names());
        assertEquals(2, series.numIndexLevels());

        // the last level is never dropped.
        assertEquals(dropped, dropped.dropIndexLevel(0));

        Series reordered = series.selectIndexLevels(List.of(1, 0));
        assertEquals(List.of("number", "letter"), reordered.index().names());
        assertEquals(List.of(2L, "b"), reordered.element(1).labels());
    }

    @Test
    void testValueCounts() {
        Series series = Series.of(Arrays.asList("b", "a", "b", null));
        assertEquals(Map.of("a", 1, "b", 2), series.valueCounts());
        assertEquals(List.of("a", "b"), series.unique());

        Series ints = Series.of(List.of(1, 2, 1));
        assertEquals(Map.of("1", 2, "2", 1), ints.valueCounts());
    }

    @Test
    void testEarliestAndLatest() {
        Instant first = Instant.parse("2020-01-01T00:00:00Z");
        Instant second = Instant.parse("2021-06-15T12:30:00Z");
        Series series = Series.of(Arrays.asList(second, null, first));
        assertEquals(first, series.earliest());
        assertEquals(second, series.latest());

        assertNull(Series.of(new Instant[0]).earliest());

        Exception exception = assertThrows(TypeUnsupportedException.class, () -> Series.of(List.of(1.0)).earliest());
        assertEquals("earliest is not supported for float values", exception.getMessage());
    }

    @Test
    void testDescribeNumeric() {
        Series series = Series.of(Arrays.asList(1.0, 2.0, 3.0, 4.0, null), Config.builder().name("x").build());
        Series expected = Series.of(
            List.of("5", "4", "1", "2.50", "1.00", "1.75", "2.50", "3.25", "4.00"),
            Config.builder().index(List.of("len", "valid", "null", "mean", "min", "25%", "50%", "75%", "max")).
                name("x").
                build());
        assertEquals(expected, series.describe());

        DisplayOptions options = DisplayOptions.builder().floatPrecision(0).build();
        assertEquals("3", series.describe(options).element(3).value());
    }

    @Test
    void testDescribeOtherKinds() {
        Series strings = Series.of(Arrays.asList("a", "b", "a", null)).describe();
        assertEquals(List.of("4", "3", "1", "2"), strings.values());
        assertEquals(List.of("len", "valid", "null", "unique"), labels(strings, 0));

        Instant time = Instant.parse("2020-01-01T00:00:00Z");
        Series times = Series.of(new Instant[] { time, time }).describe();
        assertEquals(List.of("2", "2", "0", "1", "2020-01-01T00:00:00Z", "2020-01-01T00:00:00Z"), times.values());

        Series bools = Series.of(Arrays.asList(true, false, true, null)).describe();
        assertEquals(List.of("4", "3", "1", "2.00", "0.67"), bools.values());
        assertEquals(List.of("len", "valid", "null", "sum", "mean"), labels(bools, 0));

        Series generic = Series.of(List.of(1, "a")).describe();
        assertEquals(List.of("2", "2", "0"), generic.values());
        assertEquals(List.of("len", "valid", "null"), labels(generic, 0));
    }

    @Test
    void testEquals() {
        Series series = lettered(List.of(1, 2), "a", "b");
        assertEquals(series, series.copy());
        assertEquals(series.hashCode(), series.copy().hashCode());

        assertNotEquals(series, lettered(List.of(1, 2), "a", "c"));
        assertNotEquals(series, lettered(List.of(1.0, 2.0), "a", "b"));
        assertNotEquals(series, Series.of(List.of(1, 2), Config.builder().index(List.of("a", "b")).name("n").build()));
        assertNotEquals(series, null);
    }
}
