package com.e2eq.odata.rest.filters;

import com.e2eq.odata.service.ODataProtocolService;
import com.e2eq.odata.service.ODataServiceConfig;
import jakarta.inject.Inject;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerResponseContext;
import jakarta.ws.rs.container.ContainerResponseFilter;
import jakarta.ws.rs.ext.Provider;

/**
 * Adds the CORS headers to every response when {@code odata.enable-cors} is on.
 */
@Provider
public class CorsResponseFilter implements ContainerResponseFilter {

    @Inject
    ODataServiceConfig config;

    @Override
    public void filter(ContainerRequestContext requestContext, ContainerResponseContext responseContext) {
        if (!config.isEnableCors()) {
            return;
        }
        ODataProtocolService.CORS_HEADERS.forEach((name, value) -> {
            if (!responseContext.getHeaders().containsKey(name)) {
                responseContext.getHeaders().putSingle(name, value);
            }
        });
    }
}
