package com.e2eq.odata.memory;

import com.e2eq.odata.query.OrderByField;
import com.e2eq.odata.query.QueryDescriptor;
import com.e2eq.odata.spi.DataEngine;
import com.e2eq.odata.spi.RecordFields;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * {@link DataEngine} keeping records in memory, keyed by object name and {@code _id}. Records are
 * copied on the way in and out. {@code updated_at} strictly increases on every write of a record.
 */
public class InMemoryDataEngine implements DataEngine {
    private static final Logger LOG = Logger.getLogger(InMemoryDataEngine.class);

    private final Map<String, Map<String, Map<String, Object>>> store = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryDataEngine() {
        this(Clock.systemUTC());
    }

    public InMemoryDataEngine(Clock clock) {
        this.clock = clock;
    }

    @Override
    public List<Map<String, Object>> find(String objectName, QueryDescriptor query) {
        QueryDescriptor q = query == null ? QueryDescriptor.empty() : query;
        Stream<Map<String, Object>> stream = matching(objectName, q).stream();

        if (q.getOrderBy() != null && !q.getOrderBy().isEmpty()) {
            stream = stream.sorted(comparator(q.getOrderBy()));
        }
        if (q.getOffset() != null) {
            stream = stream.skip(q.getOffset());
        }
        if (q.getLimit() != null) {
            stream = stream.limit(q.getLimit());
        }
        List<Map<String, Object>> result = stream
                .map(record -> project(record, q.getFields()))
                .collect(Collectors.toList());
        LOG.debugf("find %s returned %d record(s)", objectName, result.size());
        return result;
    }

    @Override
    public Optional<Map<String, Object>> get(String objectName, String id) {
        return Optional.ofNullable(table(objectName).get(id)).map(LinkedHashMap::new);
    }

    @Override
    public Map<String, Object> create(String objectName, Map<String, Object> data) {
        Map<String, Object> record = new LinkedHashMap<>(data);
        Object id = record.get(RecordFields.ID);
        String key = id == null ? UUID.randomUUID().toString() : String.valueOf(id);
        record.put(RecordFields.ID, key);
        String now = clock.instant().truncatedTo(ChronoUnit.MILLIS).toString();
        record.put(RecordFields.CREATED_AT, now);
        record.put(RecordFields.UPDATED_AT, now);
        table(objectName).put(key, record);
        return new LinkedHashMap<>(record);
    }

    @Override
    public Optional<Map<String, Object>> update(String objectName, String id, Map<String, Object> data) {
        Map<String, Object> updated = table(objectName).computeIfPresent(id, (key, existing) -> {
            Map<String, Object> merged = new LinkedHashMap<>(existing);
            merged.putAll(data);
            merged.put(RecordFields.ID, key);
            merged.put(RecordFields.CREATED_AT, existing.get(RecordFields.CREATED_AT));
            merged.put(RecordFields.UPDATED_AT, nextTimestamp(existing.get(RecordFields.UPDATED_AT)));
            return merged;
        });
        return Optional.ofNullable(updated).map(LinkedHashMap::new);
    }

    @Override
    public boolean delete(String objectName, String id) {
        return table(objectName).remove(id) != null;
    }

    @Override
    public long count(String objectName, QueryDescriptor query) {
        return matching(objectName, query == null ? QueryDescriptor.empty() : query).size();
    }

    public void clear() {
        store.clear();
    }

    private List<Map<String, Object>> matching(String objectName, QueryDescriptor q) {
        List<Map<String, Object>> result = new ArrayList<>();
        Map<String, Map<String, Object>> table = table(objectName);
        synchronized (table) {
            for (Map<String, Object> record : table.values()) {
                if (InMemoryFilterEvaluator.matches(q.getFilter(), record) && matchesSearch(q.getSearch(), record)) {
                    result.add(record);
                }
            }
        }
        return result;
    }

    private Map<String, Map<String, Object>> table(String objectName) {
        return store.computeIfAbsent(objectName, k -> Collections.synchronizedMap(new LinkedHashMap<>()));
    }

    /**
     * Millisecond precision, the resolution entity tags are computed at.
     */
    private String nextTimestamp(Object previous) {
        Instant now = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        if (previous != null) {
            Instant prev = Instant.parse(String.valueOf(previous)).truncatedTo(ChronoUnit.MILLIS);
            if (!now.isAfter(prev)) {
                now = prev.plusMillis(1);
            }
        }
        return now.toString();
    }

    static boolean matchesSearch(String search, Map<String, Object> record) {
        if (search == null || search.isBlank()) {
            return true;
        }
        String needle = search.toLowerCase(Locale.ROOT);
        for (Object value : record.values()) {
            if (value instanceof String text && text.toLowerCase(Locale.ROOT).contains(needle)) {
                return true;
            }
        }
        return false;
    }

    private static Comparator<Map<String, Object>> comparator(List<OrderByField> orderBy) {
        Comparator<Map<String, Object>> result = null;
        for (OrderByField field : orderBy) {
            Comparator<Map<String, Object>> next = (a, b) -> {
                Object va = a.get(field.getFieldName());
                Object vb = b.get(field.getFieldName());
                // nulls last in both directions
                if (va == null || vb == null) {
                    return va == vb ? 0 : va == null ? 1 : -1;
                }
                int cmp = InMemoryFilterEvaluator.compare(va, vb);
                return field.getDirection() == OrderByField.Direction.DESC ? -cmp : cmp;
            };
            result = result == null ? next : result.thenComparing(next);
        }
        return result;
    }

    private static Map<String, Object> project(Map<String, Object> record, List<String> fields) {
        if (fields == null || fields.isEmpty()) {
            return new LinkedHashMap<>(record);
        }
        Map<String, Object> projected = new LinkedHashMap<>();
        for (String field : fields) {
            if (record.containsKey(field)) {
                projected.put(field, record.get(field));
            }
        }
        return projected;
    }
}
