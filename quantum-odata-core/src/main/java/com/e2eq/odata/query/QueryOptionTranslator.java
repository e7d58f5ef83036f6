package com.e2eq.odata.query;

import com.e2eq.odata.error.ODataErrorCode;
import com.e2eq.odata.error.ODataException;
import com.e2eq.odata.query.filter.FilterParser;
import com.e2eq.odata.query.filter.WhereClauseRenderer;
import org.apache.commons.lang3.StringUtils;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Translates OData system query options into a {@link QueryDescriptor}.
 */
public class QueryOptionTranslator {
    private static final Logger LOG = Logger.getLogger(QueryOptionTranslator.class);

    public static final String FILTER = "$filter";
    public static final String ORDER_BY = "$orderby";
    public static final String TOP = "$top";
    public static final String SKIP = "$skip";
    public static final String SELECT = "$select";
    public static final String SEARCH = "$search";
    public static final String COUNT = "$count";
    public static final String EXPAND = "$expand";

    private final boolean searchEnabled;

    public QueryOptionTranslator(boolean searchEnabled) {
        this.searchEnabled = searchEnabled;
    }

    public QueryDescriptor translate(Map<String, String> options) {
        QueryDescriptor.QueryDescriptorBuilder builder = QueryDescriptor.builder();

        // empty option values are treated as absent
        String filter = options.get(FILTER);
        if (StringUtils.isNotBlank(filter)) {
            builder.filter(FilterParser.parse(filter));
        }
        String orderBy = options.get(ORDER_BY);
        if (StringUtils.isNotBlank(orderBy)) {
            builder.orderBy(parseOrderBy(orderBy));
        }
        String top = options.get(TOP);
        if (StringUtils.isNotBlank(top)) {
            builder.limit(parseNonNegative(TOP, top));
        }
        String skip = options.get(SKIP);
        if (StringUtils.isNotBlank(skip)) {
            builder.offset(parseNonNegative(SKIP, skip));
        }
        String select = options.get(SELECT);
        if (StringUtils.isNotBlank(select)) {
            builder.fields(parseSelect(select));
        }
        String search = options.get(SEARCH);
        if (searchEnabled && StringUtils.isNotBlank(search)) {
            builder.search(search);
        }

        QueryDescriptor descriptor = builder.build();
        if (LOG.isDebugEnabled()) {
            LOG.debugf("Translated query options %s to where=%s orderBy=%s limit=%s offset=%s fields=%s",
                    options, WhereClauseRenderer.render(descriptor.getFilter()), descriptor.getOrderBy(),
                    descriptor.getLimit(), descriptor.getOffset(), descriptor.getFields());
        }
        return descriptor;
    }

    /**
     * Descriptor for {@code @odata.count} and {@code /$count}: filter and search only, no paging,
     * ordering or projection.
     */
    public QueryDescriptor countDescriptor(QueryDescriptor query) {
        return QueryDescriptor.builder()
                .filter(query.getFilter())
                .search(query.getSearch())
                .build();
    }

    public static boolean isCountRequested(Map<String, String> options) {
        return "true".equalsIgnoreCase(StringUtils.trim(options.get(COUNT)));
    }

    public static List<OrderByField> parseOrderBy(String orderBy) {
        List<OrderByField> fields = new ArrayList<>();
        for (String segment : orderBy.split(",")) {
            String clean = segment.trim();
            if (clean.isEmpty()) {
                continue;
            }
            String[] parts = clean.split("\\s+");
            if (parts.length > 2) {
                throw invalidOrderBy("Invalid $orderby segment '" + clean + "'");
            }
            OrderByField.Direction direction = OrderByField.Direction.ASC;
            if (parts.length == 2) {
                switch (parts[1].toLowerCase(Locale.ROOT)) {
                    case "asc":
                        break;
                    case "desc":
                        direction = OrderByField.Direction.DESC;
                        break;
                    default:
                        throw invalidOrderBy("Invalid $orderby direction '" + parts[1]
                                + "' for field '" + parts[0] + "'. Expected asc or desc.");
                }
            }
            fields.add(new OrderByField(parts[0], direction));
        }
        if (fields.isEmpty()) {
            throw invalidOrderBy("$orderby must name at least one field");
        }
        return fields;
    }

    public static List<String> parseSelect(String select) {
        List<String> fields = new ArrayList<>();
        for (String part : select.split(",")) {
            String clean = part.trim();
            if (!clean.isEmpty()) {
                fields.add(clean);
            }
        }
        if (fields.isEmpty()) {
            throw new ODataException(ODataErrorCode.INVALID_SELECT, "$select must name at least one field", SELECT);
        }
        return fields;
    }

    public static int parseNonNegative(String option, String value) {
        String clean = StringUtils.trimToEmpty(value);
        int parsed;
        try {
            parsed = Integer.parseInt(clean);
        } catch (NumberFormatException e) {
            throw ODataException.invalidQuery(option + " must be a non-negative integer, got '" + clean + "'", option);
        }
        if (parsed < 0) {
            throw ODataException.invalidQuery(option + " must be a non-negative integer, got '" + clean + "'", option);
        }
        return parsed;
    }

    private static ODataException invalidOrderBy(String message) {
        return new ODataException(ODataErrorCode.INVALID_ORDER_BY, message, ORDER_BY);
    }
}
