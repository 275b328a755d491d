package io.memento.memory;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class TimestampsTest {

    @Test
    void shouldParseSqliteAndIsoText() {
        Instant expected = Instant.parse("2026-02-14T09:15:30Z");

        assertEquals(expected, Timestamps.parse("2026-02-14 09:15:30"));
        assertEquals(expected, Timestamps.parse("2026-02-14T09:15:30Z"));
        assertEquals(expected, Timestamps.parse("2026-02-14T09:15:30"));
        assertEquals(Instant.parse("2026-02-14T09:15:30.250Z"), Timestamps.parse("2026-02-14 09:15:30.250"));
        assertEquals(Instant.parse("2026-02-14T00:00:00Z"), Timestamps.parse("2026-02-14"));
    }

    @Test
    void shouldReturnNullForUnparsableText() {
        assertNull(Timestamps.parse(null));
        assertNull(Timestamps.parse("  "));
        assertNull(Timestamps.parse("yesterday"));
    }

    @Test
    void shouldFormatLikeSqliteDatetime() {
        assertEquals("2026-02-14 09:15:30", Timestamps.format(Instant.parse("2026-02-14T09:15:30.987Z")));
        assertNull(Timestamps.format(null));
    }
}
