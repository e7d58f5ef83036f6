package com.e2eq.odata.batch;

import com.e2eq.odata.service.ODataResponse;

/**
 * Executes one batch operation through the single-request path. Failures are reported as error
 * responses, not exceptions.
 */
@FunctionalInterface
public interface BatchOperationDispatcher {
    ODataResponse dispatch(BatchPart.Request request);
}
