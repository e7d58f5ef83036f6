package com.e2eq.odata.rest.exceptions;

import com.e2eq.odata.error.ODataError;
import com.e2eq.odata.error.ODataErrorCode;
import com.e2eq.odata.error.ODataErrorMapper;
import com.e2eq.odata.error.ODataErrorResponse;
import com.e2eq.odata.service.ODataServiceConfig;
import com.e2eq.odata.util.ExceptionLoggingUtils;
import jakarta.inject.Inject;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.apache.commons.lang3.StringUtils;

import java.util.Arrays;

/**
 * Renders anything escaping the resource layer as the OData error envelope. JAX-RS errors keep
 * their status; everything else goes through {@link ODataErrorMapper}.
 */
@Provider
public class ODataRuntimeExceptionMapper implements ExceptionMapper<RuntimeException> {

    @Inject
    ODataServiceConfig config;

    @Override
    public Response toResponse(RuntimeException exception) {
        ODataError error = toError(exception);
        int status = error.getHttpStatus();
        if (exception instanceof WebApplicationException wae) {
            status = wae.getResponse().getStatus();
        }

        if (status >= 500) {
            ExceptionLoggingUtils.logError(exception, "An unexpected / uncaught exception occurred");
        } else {
            ExceptionLoggingUtils.logWarn(exception, "Request rejected with status %d", status);
        }

        return Response.status(status)
                .type(MediaType.APPLICATION_JSON_TYPE)
                .header("OData-Version", "4.0")
                .entity(new ODataErrorResponse(error))
                .build();
    }

    ODataError toError(RuntimeException exception) {
        ODataErrorMapper mapper = new ODataErrorMapper(config != null && config.isVerboseErrors());
        if (exception instanceof WebApplicationException wae) {
            int status = wae.getResponse().getStatus();
            ODataError error = mapper.map(exception);
            error.setCode(codeFor(status).getCode());
            error.setMessage(StringUtils.defaultIfBlank(exception.getMessage(), codeFor(status).getCode()));
            return error;
        }
        return mapper.map(exception);
    }

    static ODataErrorCode codeFor(int status) {
        return Arrays.stream(ODataErrorCode.values())
                .filter(code -> code.getHttpStatus() == status)
                .findFirst()
                .orElse(status >= 500 ? ODataErrorCode.INTERNAL_SERVER_ERROR : ODataErrorCode.BAD_REQUEST);
    }
}
