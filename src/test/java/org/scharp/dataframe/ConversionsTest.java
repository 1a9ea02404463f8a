///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.dataframe;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/** Unit tests for {@link Conversions}. */
public class ConversionsTest {

    @Test
    void testIsSupported() {
        for (Object value : List.of(1.0, 1.0f, 1L, 1, (short) 1, (byte) 1, "1", true, Instant.EPOCH)) {
            assertTrue(Conversions.isSupported(value), value.getClass() + " should be supported");
        }
        assertFalse(Conversions.isSupported(null));
        assertFalse(Conversions.isSupported(new Object()));
        assertFalse(Conversions.isSupported(new java.math.BigDecimal("1")));
        assertFalse(Conversions.isSupported(List.of()));
    }

    @Test
    void testToDouble() {
        assertEquals(2.0, Conversions.toDouble(2L));
        assertEquals(2.5, Conversions.toDouble(2.5f));
        assertEquals(1.0, Conversions.toDouble(true));
        assertEquals(0.0, Conversions.toDouble(false));
        assertEquals(2.5, Conversions.toDouble(" 2.5 "));
        assertEquals(3e9, Conversions.toDouble(Instant.ofEpochSecond(3)));

        assertEquals(Double.NaN, Conversions.toDouble(null));
        assertEquals(Double.NaN, Conversions.toDouble("not a number"));
        assertEquals(Double.NaN, Conversions.toDouble(new Object()));
    }

    @Test
    void testToLong() {
        assertEquals(7L, Conversions.toLong(7));
        assertEquals(2L, Conversions.toLong(2.9)); // truncated
        assertEquals(-2L, Conversions.toLong(-2.9)); // truncated toward zero
        assertEquals(1L, Conversions.toLong(true));
        assertEquals(42L, Conversions.toLong(" 42"));
        assertEquals(2_000_000_001L, Conversions.toLong(Instant.ofEpochSecond(2, 1)));

        assertNull(Conversions.toLong(null));
        assertNull(Conversions.toLong(Double.NaN));
        assertNull(Conversions.toLong("1.5"));
        assertNull(Conversions.toLong(Instant.MAX)); // overflows nanoseconds
    }

    @Test
    void testToText() {
        assertEquals("1", Conversions.toText(1L));
        assertEquals("1.5", Conversions.toText(1.5));
        assertEquals("true", Conversions.toText(true));
        assertEquals("", Conversions.toText(""));
        assertEquals("2019-05-01T00:00:00Z", Conversions.toText(Instant.parse("2019-05-01T00:00:00Z")));

        assertNull(Conversions.toText(null));
        assertNull(Conversions.toText(Double.NaN));
    }

    @Test
    void testToBoolean() {
        assertEquals(Boolean.TRUE, Conversions.toBoolean(true));
        assertEquals(Boolean.TRUE, Conversions.toBoolean(3L));
        assertEquals(Boolean.FALSE, Conversions.toBoolean(0));
        assertEquals(Boolean.FALSE, Conversions.toBoolean(0.0));
        assertEquals(Boolean.TRUE, Conversions.toBoolean(-0.5));
        assertEquals(Boolean.TRUE, Conversions.toBoolean("")); // any other non-null value is true
        assertEquals(Boolean.TRUE, Conversions.toBoolean("false"));
        assertEquals(Boolean.TRUE, Conversions.toBoolean(Instant.EPOCH));

        assertNull(Conversions.toBoolean(null));
        assertNull(Conversions.toBoolean(Double.NaN));
    }

    @Test
    void testToInstant() {
        Instant time = Instant.parse("2019-05-01T12:30:00Z");
        assertEquals(time, Conversions.toInstant(time));
        assertEquals(time, Conversions.toInstant("2019-05-01T12:30:00Z"));

        // numbers are nanoseconds, truncated to whole seconds
        assertEquals(Instant.ofEpochSecond(1), Conversions.toInstant(1_500_000_000L));
        assertEquals(Instant.ofEpochSecond(2), Conversions.toInstant(2e9));
        assertEquals(Instant.EPOCH, Conversions.toInstant(false));

        assertNull(Conversions.toInstant(null));
        assertNull(Conversions.toInstant("May 1, 2019"));
        assertNull(Conversions.toInstant(Double.NaN));
    }

    @Test
    void testRender() {
        assertEquals("NaN", Conversions.render(null));
        assertEquals("NaN", Conversions.render(Double.NaN));
        assertEquals("1", Conversions.render(1L));
        assertEquals("1.0", Conversions.render(1.0));

        // values of different types that have the same text collide.
        assertEquals(Conversions.render(1), Conversions.render("1"));
    }
}
