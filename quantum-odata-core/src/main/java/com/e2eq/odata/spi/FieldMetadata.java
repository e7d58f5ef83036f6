package com.e2eq.odata.spi;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.apache.commons.lang3.StringUtils;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FieldMetadata {
    public static final String TYPE_LOOKUP = "lookup";
    public static final String TYPE_MASTER_DETAIL = "master_detail";

    private String name;
    /** Field type keyword such as {@code text}, {@code number} or {@code lookup}. */
    private String type;
    /** Target object type of a relationship field. */
    private String reference;
    private String label;
    private boolean required;

    /**
     * True for {@code lookup} and {@code master_detail} fields that name a target object type.
     */
    public boolean isRelationship() {
        return (TYPE_LOOKUP.equals(type) || TYPE_MASTER_DETAIL.equals(type))
                && StringUtils.isNotBlank(reference);
    }
}
