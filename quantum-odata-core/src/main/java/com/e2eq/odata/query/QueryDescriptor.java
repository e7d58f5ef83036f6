package com.e2eq.odata.query;

import com.e2eq.odata.query.filter.FilterNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Backend-neutral query handed to a {@link com.e2eq.odata.spi.DataEngine}. Every member is
 * optional; {@code limit} and {@code offset} are never negative.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class QueryDescriptor {
    private FilterNode filter;
    private List<OrderByField> orderBy;
    private Integer limit;
    private Integer offset;
    private List<String> fields;
    private String search;

    public static QueryDescriptor empty() {
        return new QueryDescriptor();
    }
}
