package com.e2eq.odata.config;

import com.e2eq.odata.service.ODataServiceConfig;
import io.quarkus.runtime.annotations.StaticInitSafe;
import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

@StaticInitSafe
@ConfigMapping(prefix = "odata")
public interface ODataConfig {

    @WithDefault("8080")
    int port();

    @WithDefault("/odata")
    String basePath();

    @WithDefault("true")
    boolean enableCors();

    @WithDefault("QuantumOData")
    String namespace();

    @WithDefault("3")
    int maxExpandDepth();

    @WithDefault("true")
    boolean enableBatch();

    @WithDefault("true")
    boolean enableSearch();

    @WithDefault("true")
    boolean enableEtags();

    /** Attach {@code innererror} (exception type and stack trace) to error responses. */
    @WithDefault("false")
    boolean verboseErrors();

    default ODataServiceConfig toServiceConfig() {
        return ODataServiceConfig.builder()
                .port(port())
                .basePath(basePath())
                .enableCors(enableCors())
                .namespace(namespace())
                .maxExpandDepth(maxExpandDepth())
                .enableBatch(enableBatch())
                .enableSearch(enableSearch())
                .enableEtags(enableEtags())
                .verboseErrors(verboseErrors())
                .build();
    }
}
