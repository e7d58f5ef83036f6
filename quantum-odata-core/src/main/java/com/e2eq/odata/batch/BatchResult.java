package com.e2eq.odata.batch;

import com.e2eq.odata.service.ODataResponse;

import java.util.List;

/**
 * @param responses per-operation responses in request order
 * @param envelope  the {@code multipart/mixed} response body
 * @param boundary  boundary of {@code envelope}
 */
public record BatchResult(List<ODataResponse> responses, String envelope, String boundary) {

    public String contentType() {
        return "multipart/mixed; boundary=" + boundary;
    }
}
