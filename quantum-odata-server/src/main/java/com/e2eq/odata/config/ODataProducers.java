package com.e2eq.odata.config;

import com.e2eq.odata.batch.CompensationLog;
import com.e2eq.odata.batch.LoggingCompensationLog;
import com.e2eq.odata.memory.InMemoryDataEngine;
import com.e2eq.odata.memory.InMemoryMetadataRegistry;
import com.e2eq.odata.service.ODataProtocolService;
import com.e2eq.odata.service.ODataServiceConfig;
import com.e2eq.odata.spi.DataEngine;
import com.e2eq.odata.spi.MetadataRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.quarkus.arc.DefaultBean;
import io.quarkus.logging.Log;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

/**
 * Wires the OData engine. The in-memory registry and engine are defaults; an application
 * provides its own {@link MetadataRegistry} and {@link DataEngine} beans to replace them.
 */
@ApplicationScoped
public class ODataProducers {

    @Inject
    ODataConfig odataConfig;

    @Inject
    ObjectMapper mapper;

    @Produces
    @Singleton
    public ODataServiceConfig serviceConfig() {
        ODataServiceConfig config = odataConfig.toServiceConfig();
        Log.infof("ODataProducers: OData service at '%s' (namespace %s, batch=%s, etags=%s, maxExpandDepth=%d)",
                config.getBasePath(), config.getNamespace(), config.isEnableBatch(), config.isEnableEtags(),
                config.getMaxExpandDepth());
        return config;
    }

    @Produces
    @DefaultBean
    @Singleton
    public MetadataRegistry metadataRegistry() {
        Log.info("ODataProducers: no MetadataRegistry bean found, using in-memory registry");
        return new InMemoryMetadataRegistry();
    }

    @Produces
    @DefaultBean
    @Singleton
    public DataEngine dataEngine() {
        Log.info("ODataProducers: no DataEngine bean found, using in-memory engine");
        return new InMemoryDataEngine();
    }

    @Produces
    @DefaultBean
    @Singleton
    public CompensationLog compensationLog() {
        return new LoggingCompensationLog();
    }

    @Produces
    @Singleton
    public ODataProtocolService protocolService(ODataServiceConfig config, MetadataRegistry metadataRegistry,
                                                DataEngine dataEngine, CompensationLog compensationLog) {
        return new ODataProtocolService(config, metadataRegistry, dataEngine, mapper, compensationLog);
    }
}
