package com.e2eq.odata.batch;

import com.e2eq.odata.service.ODataResponse;

import java.util.List;
import java.util.UUID;

/**
 * Writes batch responses as a {@code multipart/mixed} envelope, one {@code application/http}
 * part per response.
 */
public final class BatchResponseWriter {

    private BatchResponseWriter() {
    }

    public static String newBoundary() {
        return "batch_" + UUID.randomUUID();
    }

    public static String write(List<ODataResponse> responses, String boundary) {
        StringBuilder sb = new StringBuilder();
        for (ODataResponse response : responses) {
            sb.append("--").append(boundary).append("\r\n");
            sb.append("Content-Type: application/http\r\n");
            sb.append("Content-Transfer-Encoding: binary\r\n");
            sb.append("\r\n");
            sb.append(response.toHttpString());
            sb.append("\r\n");
        }
        sb.append("--").append(boundary).append("--\r\n");
        return sb.toString();
    }
}
