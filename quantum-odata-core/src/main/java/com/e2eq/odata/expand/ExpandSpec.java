package com.e2eq.odata.expand;

import java.util.Map;

/**
 * One navigation property named in {@code $expand} with its nested query options, e.g.
 * {@code owner($select=name;$expand=company)} gives property {@code owner} and options
 * {@code {$select=name, $expand=company}}.
 */
public record ExpandSpec(String property, Map<String, String> options) {

    public ExpandSpec {
        options = options == null ? Map.of() : Map.copyOf(options);
    }

    public ExpandSpec(String property) {
        this(property, Map.of());
    }

    public String option(String name) {
        return options.get(name);
    }
}
