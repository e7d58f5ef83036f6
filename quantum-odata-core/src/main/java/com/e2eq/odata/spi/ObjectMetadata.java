package com.e2eq.odata.spi;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Description of one object type (entity set). Field order is preserved.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ObjectMetadata {
    private String name;
    private String label;
    @Builder.Default
    private Map<String, FieldMetadata> fields = new LinkedHashMap<>();

    public Optional<FieldMetadata> field(String fieldName) {
        return fields == null ? Optional.empty() : Optional.ofNullable(fields.get(fieldName));
    }

    public ObjectMetadata addField(FieldMetadata field) {
        if (fields == null) {
            fields = new LinkedHashMap<>();
        }
        fields.put(field.getName(), field);
        return this;
    }
}
