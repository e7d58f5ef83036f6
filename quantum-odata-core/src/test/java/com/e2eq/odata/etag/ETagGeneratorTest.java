package com.e2eq.odata.etag;

import com.e2eq.odata.SampleCatalog;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Date;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ETagGeneratorTest {

    private final ETagGenerator generator = new ETagGenerator();

    @Test
    void testTimestampBasedTag() {
        Instant updated = Instant.parse("2024-03-01T10:15:30.123Z");
        String expected = "W/\"" + updated.toEpochMilli() + "\"";

        assertEquals(expected, generator.compute(SampleCatalog.record("_id", "1", "updated_at", "2024-03-01T10:15:30.123Z")));
        assertEquals(expected, generator.compute(SampleCatalog.record("updated_at", "2024-03-01T12:15:30.123+02:00")));
        assertEquals(expected, generator.compute(SampleCatalog.record("updated_at", updated)));
        assertEquals(expected, generator.compute(SampleCatalog.record("updated_at", Date.from(updated))));
        assertEquals(expected, generator.compute(SampleCatalog.record("updated_at", updated.toEpochMilli())));
    }

    @Test
    void testSameTimestampSameTag() {
        Map<String, Object> a = SampleCatalog.record("_id", "1", "name", "a", "updated_at", "2024-01-01T00:00:00Z");
        Map<String, Object> b = SampleCatalog.record("_id", "2", "name", "b", "updated_at", "2024-01-01T00:00:00Z");
        assertEquals(generator.compute(a), generator.compute(b));
    }

    @Test
    void testIdBasedTag() {
        assertEquals("W/\"abc\"", generator.compute(SampleCatalog.record("_id", "abc", "name", "x")));
    }

    @Test
    void testContentHashIsStableAndKeyOrderIndependent() {
        String first = generator.compute(SampleCatalog.record("name", "x", "qty", 2));
        String second = generator.compute(SampleCatalog.record("qty", 2, "name", "x"));
        assertEquals(first, second);
        assertTrue(first.matches("W/\"[0-9a-z]+\""), first);
        assertNotEquals(first, generator.compute(SampleCatalog.record("name", "y", "qty", 2)));
    }

    @Test
    void testUnparseableTimestampIsHashed() {
        String tag = generator.compute(SampleCatalog.record("updated_at", "yesterday"));
        assertEquals(ETagGenerator.weak(ETagGenerator.hash("yesterday")), tag);
    }

    @Test
    void testRollingHash() {
        assertEquals("0", ETagGenerator.hash(""));
        // "a" = 97
        assertEquals(Long.toString(97, 36), ETagGenerator.hash("a"));
        // 97 * 31 + 98
        assertEquals(Long.toString(97 * 31 + 98, 36), ETagGenerator.hash("ab"));
    }
}
