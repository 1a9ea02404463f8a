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
import static org.junit.jupiter.api.Assertions.assertThrows;

/** Unit tests for {@link ValuesFactory}. */
public class ValuesFactoryTest {

    @Test
    void testNull() {
        Values values = ValuesFactory.fromData(null);
        assertEquals(Kind.GENERIC, values.kind());
        assertEquals(0, values.len());
    }

    @Test
    void testScalars() {
        assertEquals(Values.of(Kind.FLOAT, List.of(1.5)), ValuesFactory.fromData(1.5));
        assertEquals(Values.of(Kind.INT, List.of(3L)), ValuesFactory.fromData(3));
        assertEquals(Values.of(Kind.STRING, List.of("x")), ValuesFactory.fromData("x"));
        assertEquals(Values.of(Kind.BOOL, List.of(true)), ValuesFactory.fromData(true));
        assertEquals(Values.of(Kind.DATE_TIME, List.of(Instant.EPOCH)), ValuesFactory.fromData(Instant.EPOCH));
    }

    @Test
    void testArrays() {
        assertEquals(Values.of(Kind.FLOAT, List.of(1.0, 2.0)), ValuesFactory.fromData(new double[] { 1, 2 }));
        assertEquals(Values.of(Kind.FLOAT, List.of(0.5)), ValuesFactory.fromData(new float[] { 0.5f }));
        assertEquals(Values.of(Kind.INT, List.of(1L, 2L)), ValuesFactory.fromData(new long[] { 1, 2 }));
        assertEquals(Values.of(Kind.INT, List.of(1L, 2L)), ValuesFactory.fromData(new int[] { 1, 2 }));
        assertEquals(Values.of(Kind.INT, List.of(-1L)), ValuesFactory.fromData(new short[] { -1 }));
        assertEquals(Values.of(Kind.INT, List.of(7L)), ValuesFactory.fromData(new byte[] { 7 }));
        assertEquals(Values.of(Kind.BOOL, List.of(true, false)), ValuesFactory.fromData(new boolean[] { true, false }));
        assertEquals(Values.of(Kind.STRING, Arrays.asList("a", null)), ValuesFactory.fromData(new String[] { "a", null }));
        assertEquals(Values.of(Kind.DATE_TIME, List.of(Instant.EPOCH)),
            ValuesFactory.fromData(new Instant[] { Instant.EPOCH }));

        // NaN in a double[] is null.
        Values values = ValuesFactory.fromData(new double[] { Double.NaN, 1 });
        assertEquals(List.of(0), values.nulls());

        // an Object[] is inferred like a list.
        assertEquals(Kind.FLOAT, ValuesFactory.fromData(new Object[] { 1, 2.5 }).kind());
    }

    @Test
    void testInferKind() {
        assertEquals(Kind.INT, ValuesFactory.inferKind(List.of(1, 2L, (short) 3, (byte) 4)));
        assertEquals(Kind.FLOAT, ValuesFactory.inferKind(List.of(1.0, 2.0f)));
        assertEquals(Kind.FLOAT, ValuesFactory.inferKind(List.of(1, 2.5)));
        assertEquals(Kind.STRING, ValuesFactory.inferKind(List.of("a", "b")));
        assertEquals(Kind.BOOL, ValuesFactory.inferKind(List.of(true, false)));
        assertEquals(Kind.DATE_TIME, ValuesFactory.inferKind(List.of(Instant.EPOCH)));

        // nulls don't affect the kind.
        assertEquals(Kind.STRING, ValuesFactory.inferKind(Arrays.asList(null, "a", null)));

        // any other mix is generic.
        assertEquals(Kind.GENERIC, ValuesFactory.inferKind(List.of(1, "a")));
        assertEquals(Kind.GENERIC, ValuesFactory.inferKind(List.of(true, 1)));
        assertEquals(Kind.GENERIC, ValuesFactory.inferKind(List.of(1.5, "a", Instant.EPOCH)));

        // nothing to infer from
        assertEquals(Kind.GENERIC, ValuesFactory.inferKind(List.of()));
        assertEquals(Kind.GENERIC, ValuesFactory.inferKind(Arrays.asList(null, null)));
    }

    @Test
    void testFromList() {
        Values values = ValuesFactory.fromList(Arrays.asList(1, null, 3.5));
        assertEquals(Values.of(Kind.FLOAT, Arrays.asList(1.0, null, 3.5)), values);

        Values generics = ValuesFactory.fromList(List.of(1L, "a"));
        assertEquals(Kind.GENERIC, generics.kind());
        assertEquals(List.of(1L, "a"), generics.values());
    }

    @Test
    void testUnsupportedData() {
        Exception exception = assertThrows(ConstructionException.class, () -> ValuesFactory.fromData(Map.of()));
        assertEquals("unsupported data type: " + Map.of().getClass().getName(), exception.getMessage());

        exception = assertThrows(ConstructionException.class, () -> ValuesFactory.fromData(new char[] { 'a' }));
        assertEquals("unsupported data type: [C", exception.getMessage());

        exception = assertThrows(ConstructionException.class,
            () -> ValuesFactory.fromData(List.of(1, new StringBuilder("x"))));
        assertEquals("unsupported element type: java.lang.StringBuilder (value x)", exception.getMessage());

        // ConstructionException is an IllegalArgumentException
        assertThrows(IllegalArgumentException.class, () -> ValuesFactory.fromData(new Object()));
    }
}
