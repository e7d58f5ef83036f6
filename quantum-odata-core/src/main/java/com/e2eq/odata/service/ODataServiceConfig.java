package com.e2eq.odata.service;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable engine settings, built once at startup.
 */
@Value
public class ODataServiceConfig {
    int port;
    /** Normalized: leading slash, no trailing slash, empty for the root. */
    String basePath;
    boolean enableCors;
    String namespace;
    int maxExpandDepth;
    boolean enableBatch;
    boolean enableSearch;
    boolean enableEtags;
    boolean verboseErrors;

    @Builder
    private ODataServiceConfig(int port, String basePath, boolean enableCors, String namespace, int maxExpandDepth,
                               boolean enableBatch, boolean enableSearch, boolean enableEtags, boolean verboseErrors) {
        if (maxExpandDepth < 0) {
            throw new IllegalArgumentException("maxExpandDepth must be >= 0, got " + maxExpandDepth);
        }
        if (namespace == null || namespace.isBlank()) {
            throw new IllegalArgumentException("namespace must not be blank");
        }
        this.port = port;
        this.basePath = normalizeBasePath(basePath);
        this.enableCors = enableCors;
        this.namespace = namespace;
        this.maxExpandDepth = maxExpandDepth;
        this.enableBatch = enableBatch;
        this.enableSearch = enableSearch;
        this.enableEtags = enableEtags;
        this.verboseErrors = verboseErrors;
    }

    public static ODataServiceConfig defaults() {
        return builder().build();
    }

    static String normalizeBasePath(String basePath) {
        if (basePath == null) {
            return "";
        }
        String path = basePath.trim();
        while (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        if (!path.isEmpty() && !path.startsWith("/")) {
            path = "/" + path;
        }
        return path;
    }

    public static class ODataServiceConfigBuilder {
        private int port = 8080;
        private String basePath = "/odata";
        private boolean enableCors = true;
        private String namespace = "QuantumOData";
        private int maxExpandDepth = 3;
        private boolean enableBatch = true;
        private boolean enableSearch = true;
        private boolean enableEtags = true;
        private boolean verboseErrors = false;
    }
}
