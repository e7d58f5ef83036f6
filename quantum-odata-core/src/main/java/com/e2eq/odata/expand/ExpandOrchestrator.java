package com.e2eq.odata.expand;

import com.e2eq.odata.query.OrderByField;
import com.e2eq.odata.query.QueryDescriptor;
import com.e2eq.odata.query.QueryOptionTranslator;
import com.e2eq.odata.query.filter.FilterNode;
import com.e2eq.odata.query.filter.FilterParser;
import com.e2eq.odata.spi.DataEngine;
import com.e2eq.odata.spi.FieldMetadata;
import com.e2eq.odata.spi.MetadataRegistry;
import com.e2eq.odata.spi.ObjectMetadata;
import com.e2eq.odata.spi.RecordFields;
import org.apache.commons.lang3.StringUtils;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves {@code $expand} by replacing relationship field values (identifiers) with the related
 * records. Related records are fetched with one query per navigation property and level.
 * Recursion stops at {@code maxExpandDepth}; there is no cycle detection.
 */
public class ExpandOrchestrator {
    private static final Logger LOG = Logger.getLogger(ExpandOrchestrator.class);

    private final MetadataRegistry metadataRegistry;
    private final DataEngine dataEngine;
    private final int maxExpandDepth;

    public ExpandOrchestrator(MetadataRegistry metadataRegistry, DataEngine dataEngine, int maxExpandDepth) {
        this.metadataRegistry = metadataRegistry;
        this.dataEngine = dataEngine;
        this.maxExpandDepth = maxExpandDepth;
    }

    /**
     * Expands {@code records} of {@code entitySet} in place.
     *
     * @param depth current nesting level, 0 for the top-level request
     */
    public void expand(String entitySet, List<Map<String, Object>> records, String expandParam, int depth) {
        if (records == null || records.isEmpty() || expandParam == null || expandParam.isBlank()) {
            return;
        }
        expand(entitySet, records, ExpandParser.parse(expandParam), depth);
    }

    public void expand(String entitySet, List<Map<String, Object>> records, List<ExpandSpec> specs, int depth) {
        if (depth >= maxExpandDepth) {
            LOG.debugf("Expand depth %d reached max %d for %s; skipping", depth, maxExpandDepth, entitySet);
            return;
        }
        Optional<ObjectMetadata> metadata = metadataRegistry.getObjectMetadata(entitySet);
        if (metadata.isEmpty()) {
            LOG.debugf("No metadata for %s; skipping $expand", entitySet);
            return;
        }
        for (ExpandSpec spec : specs) {
            Optional<FieldMetadata> field = metadata.get().field(spec.property());
            if (field.isEmpty() || !field.get().isRelationship()) {
                LOG.debugf("%s.%s is not a relationship; skipping $expand", entitySet, spec.property());
                continue;
            }
            expandField(records, field.get(), spec, depth);
        }
    }

    private void expandField(List<Map<String, Object>> records, FieldMetadata field, ExpandSpec spec, int depth) {
        String fieldName = field.getName() != null ? field.getName() : spec.property();
        Set<String> ids = new LinkedHashSet<>();
        for (Map<String, Object> record : records) {
            Object value = record.get(fieldName);
            if (value != null && !(value instanceof Map)) {
                ids.add(String.valueOf(value));
            }
        }
        if (ids.isEmpty()) {
            return;
        }

        QueryDescriptor query = relatedQuery(ids, spec);
        List<Map<String, Object>> related = dataEngine.find(field.getReference(), query);
        LOG.debugf("Expanded %s -> %s: %d ids, %d related records at depth %d",
                fieldName, field.getReference(), ids.size(), related.size(), depth);

        String nestedExpand = spec.option(QueryOptionTranslator.EXPAND);
        if (nestedExpand != null && !nestedExpand.isBlank()) {
            expand(field.getReference(), related, nestedExpand, depth + 1);
        }

        Map<String, Map<String, Object>> byId = new HashMap<>();
        for (Map<String, Object> relatedRecord : related) {
            Object id = relatedRecord.get(RecordFields.ID);
            if (id != null) {
                byId.put(String.valueOf(id), relatedRecord);
            }
        }
        for (Map<String, Object> record : records) {
            Object value = record.get(fieldName);
            if (value == null || value instanceof Map) {
                continue;
            }
            Map<String, Object> match = byId.get(String.valueOf(value));
            if (match != null) {
                record.put(fieldName, match);
            }
        }
    }

    private QueryDescriptor relatedQuery(Set<String> ids, ExpandSpec spec) {
        FilterNode filter = new FilterNode.In(RecordFields.ID, new ArrayList<>(ids));
        String nestedFilter = spec.option(QueryOptionTranslator.FILTER);
        if (StringUtils.isNotBlank(nestedFilter)) {
            filter = FilterNode.and(List.of(filter, FilterParser.parse(nestedFilter)));
        }
        QueryDescriptor.QueryDescriptorBuilder builder = QueryDescriptor.builder().filter(filter);

        String select = spec.option(QueryOptionTranslator.SELECT);
        if (StringUtils.isNotBlank(select)) {
            List<String> fields = QueryOptionTranslator.parseSelect(select);
            if (!fields.contains(RecordFields.ID)) {
                fields.add(0, RecordFields.ID);
            }
            builder.fields(fields);
        }
        String orderBy = spec.option(QueryOptionTranslator.ORDER_BY);
        if (StringUtils.isNotBlank(orderBy)) {
            List<OrderByField> order = QueryOptionTranslator.parseOrderBy(orderBy);
            builder.orderBy(order);
        }
        String top = spec.option(QueryOptionTranslator.TOP);
        if (StringUtils.isNotBlank(top)) {
            builder.limit(QueryOptionTranslator.parseNonNegative(QueryOptionTranslator.TOP, top));
        }
        return builder.build();
    }
}
