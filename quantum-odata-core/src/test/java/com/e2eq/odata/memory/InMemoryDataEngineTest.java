package com.e2eq.odata.memory;

import com.e2eq.odata.SampleCatalog;
import com.e2eq.odata.TickingClock;
import com.e2eq.odata.etag.ETagGenerator;
import com.e2eq.odata.query.OrderByField;
import com.e2eq.odata.query.QueryDescriptor;
import com.e2eq.odata.query.filter.FilterNode;
import com.e2eq.odata.query.filter.FilterParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryDataEngineTest {

    private InMemoryDataEngine engine;

    @BeforeEach
    void setUp() {
        engine = SampleCatalog.seed(new InMemoryDataEngine());
    }

    @Test
    void testCreateAssignsIdAndTimestamps() {
        Map<String, Object> created = engine.create("Products", SampleCatalog.record("name", "Thing"));
        assertNotNull(created.get("_id"));
        assertNotNull(created.get("created_at"));
        assertEquals(created.get("created_at"), created.get("updated_at"));
        assertEquals("Thing", engine.get("Products", (String) created.get("_id")).orElseThrow().get("name"));
    }

    @Test
    void testUpdateMergesAndAdvancesTimestamp() {
        Clock fixed = Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC);
        InMemoryDataEngine frozen = new InMemoryDataEngine(fixed);
        frozen.create("Products", SampleCatalog.record("_id", "x", "name", "A", "price", 1));

        Map<String, Object> first = frozen.update("Products", "x", Map.of("price", 2)).orElseThrow();
        Map<String, Object> second = frozen.update("Products", "x", Map.of("price", 3)).orElseThrow();

        assertEquals("A", second.get("name"));
        assertEquals(3, second.get("price"));
        assertEquals("2024-01-01T00:00:00.001Z", first.get("updated_at"));
        assertEquals("2024-01-01T00:00:00.002Z", second.get("updated_at"));
        assertEquals("2024-01-01T00:00:00Z", second.get("created_at"));
    }

    @Test
    void testUpdatesWithinOneMillisecondGetDistinctETags() {
        InMemoryDataEngine fast = new InMemoryDataEngine(
                new TickingClock(Instant.parse("2026-01-01T00:00:00Z"), Duration.ofNanos(100_000)));
        ETagGenerator etags = new ETagGenerator();

        Map<String, Object> created = fast.create("Products", SampleCatalog.record("_id", "x", "price", 1));
        Map<String, Object> first = fast.update("Products", "x", Map.of("price", 2)).orElseThrow();
        Map<String, Object> second = fast.update("Products", "x", Map.of("price", 3)).orElseThrow();

        assertEquals("2026-01-01T00:00:00Z", created.get("updated_at"));
        assertEquals("2026-01-01T00:00:00.001Z", first.get("updated_at"));
        assertEquals("2026-01-01T00:00:00.002Z", second.get("updated_at"));
        assertNotEquals(etags.compute(created), etags.compute(first));
        assertNotEquals(etags.compute(first), etags.compute(second));
    }

    @Test
    void testUpdateAndDeleteOfMissingRecord() {
        assertTrue(engine.update("Products", "nope", Map.of("a", 1)).isEmpty());
        assertFalse(engine.delete("Products", "nope"));
        assertTrue(engine.delete("Products", "p1"));
        assertTrue(engine.get("Products", "p1").isEmpty());
    }

    @Test
    void testReturnedRecordsAreCopies() {
        engine.get("Products", "p1").orElseThrow().put("name", "changed");
        assertEquals("Widget", engine.get("Products", "p1").orElseThrow().get("name"));
    }

    @Test
    void testFilterComparisonsAcrossNumberTypes() {
        assertEquals(List.of("p2", "p3"), ids(engine.find("Products", query("price gt 50"))));
        assertEquals(List.of("p1"), ids(engine.find("Products", query("price eq 25.0"))));
        assertEquals(List.of("p4"), ids(engine.find("Products", query("price eq null"))));
        assertEquals(List.of("p3"), ids(engine.find("Products", query("active eq false"))));
    }

    @Test
    void testStringFunctionsIgnoreCase() {
        assertEquals(List.of("p2", "p4"), ids(engine.find("Products", query("startswith(name, 'g')"))));
        assertEquals(List.of("p1", "p2"), ids(engine.find("Products", query("endswith(name, 'ET')"))));
        assertEquals(List.of("p3"), ids(engine.find("Products", query("not (active eq true)"))));
    }

    @Test
    void testSortNullsLastThenPage() {
        QueryDescriptor byPriceDesc = QueryDescriptor.builder()
                .orderBy(List.of(OrderByField.desc("price")))
                .build();
        assertEquals(List.of("p2", "p3", "p1", "p4"), ids(engine.find("Products", byPriceDesc)));

        QueryDescriptor page = byPriceDesc.toBuilder().offset(1).limit(2).build();
        assertEquals(List.of("p3", "p1"), ids(engine.find("Products", page)));
    }

    @Test
    void testProjection() {
        QueryDescriptor select = QueryDescriptor.builder()
                .filter(new FilterNode.In("_id", List.of("p1")))
                .fields(List.of("_id", "name"))
                .build();
        assertEquals(List.of(Map.of("_id", "p1", "name", "Widget")), engine.find("Products", select));
    }

    @Test
    void testSearchAndCount() {
        QueryDescriptor search = QueryDescriptor.builder().search("ACME").build();
        assertEquals(3, engine.count("Companies", search));
        assertEquals(2, engine.count("Products", query("category eq 'tools'")));
        assertEquals(0, engine.count("Unknown", QueryDescriptor.empty()));
    }

    private static QueryDescriptor query(String filter) {
        return QueryDescriptor.builder().filter(FilterParser.parse(filter)).build();
    }

    private static List<Object> ids(List<Map<String, Object>> records) {
        return records.stream().map(r -> r.get("_id")).collect(Collectors.toList());
    }
}
