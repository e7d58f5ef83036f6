package com.e2eq.odata.metadata;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Service root document listing the available entity sets.
 */
public record ServiceDocument(@JsonProperty("@odata.context") String context, List<Entry> value) {

    public record Entry(String name, String kind, String url) {
        public static Entry entitySet(String name) {
            return new Entry(name, "EntitySet", name);
        }
    }

    public static ServiceDocument of(String basePath, List<String> entitySets) {
        return new ServiceDocument(basePath + "/$metadata", entitySets.stream().map(Entry::entitySet).toList());
    }
}
