package com.e2eq.odata.service;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Transport-neutral OData request. Header names are case-insensitive.
 */
@Getter
@ToString
public class ODataRequest {
    private final String method;
    private final String path;
    private final String queryString;
    private final Map<String, String> headers;
    private final String body;

    @Builder
    private ODataRequest(String method, String path, String queryString, Map<String, String> headers, String body) {
        this.method = method == null ? "GET" : method.toUpperCase(Locale.ROOT);
        this.path = path == null ? "" : path;
        this.queryString = queryString;
        this.headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            headers.forEach((name, value) -> {
                if (name != null && value != null) {
                    this.headers.put(name, value);
                }
            });
        }
        this.body = body;
    }

    public String header(String name) {
        return headers.get(name);
    }
}
