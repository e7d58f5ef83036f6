package com.e2eq.odata.spi;

import com.e2eq.odata.query.QueryDescriptor;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Generic record store the protocol layer translates into. Records are plain maps keyed by field
 * name; the identifier lives under {@link RecordFields#ID}.
 * <p>
 * Implementations report failures with unchecked exceptions, ideally {@link DataEngineException}
 * or another {@link CodedError}, so the error mapper can classify them.
 */
public interface DataEngine {

    List<Map<String, Object>> find(String objectName, QueryDescriptor query);

    Optional<Map<String, Object>> get(String objectName, String id);

    /** Returns the stored record including generated identifier and timestamps. */
    Map<String, Object> create(String objectName, Map<String, Object> data);

    /** Merges {@code data} into the record; empty when no record has {@code id}. */
    Optional<Map<String, Object>> update(String objectName, String id, Map<String, Object> data);

    boolean delete(String objectName, String id);

    /** Counts records matching the filter and search of {@code query}; paging is ignored. */
    long count(String objectName, QueryDescriptor query);
}
