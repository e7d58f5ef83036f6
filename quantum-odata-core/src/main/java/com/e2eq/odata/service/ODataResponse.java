package com.e2eq.odata.service;

import lombok.Getter;
import lombok.ToString;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Transport-neutral OData response.
 */
@Getter
@ToString
public class ODataResponse {
    public static final String CONTENT_TYPE = "Content-Type";
    public static final String ETAG = "ETag";
    public static final String LOCATION = "Location";
    public static final String ODATA_VERSION = "OData-Version";

    public static final String APPLICATION_JSON = "application/json";
    public static final String APPLICATION_XML = "application/xml";
    public static final String TEXT_PLAIN = "text/plain";

    private static final Map<Integer, String> REASONS = Map.ofEntries(
            Map.entry(200, "OK"),
            Map.entry(201, "Created"),
            Map.entry(204, "No Content"),
            Map.entry(304, "Not Modified"),
            Map.entry(400, "Bad Request"),
            Map.entry(401, "Unauthorized"),
            Map.entry(403, "Forbidden"),
            Map.entry(404, "Not Found"),
            Map.entry(405, "Method Not Allowed"),
            Map.entry(406, "Not Acceptable"),
            Map.entry(409, "Conflict"),
            Map.entry(412, "Precondition Failed"),
            Map.entry(500, "Internal Server Error"),
            Map.entry(501, "Not Implemented"),
            Map.entry(503, "Service Unavailable"));

    private final int status;
    private final Map<String, String> headers = new LinkedHashMap<>();
    private final String body;

    public ODataResponse(int status, String body) {
        this.status = status;
        this.body = body;
    }

    public static ODataResponse of(int status, String contentType, String body) {
        return new ODataResponse(status, body).header(CONTENT_TYPE, contentType);
    }

    public static ODataResponse noContent(int status) {
        return new ODataResponse(status, null);
    }

    public ODataResponse header(String name, String value) {
        if (value != null) {
            headers.put(name, value);
        }
        return this;
    }

    public String header(String name) {
        for (Map.Entry<String, String> entry : headers.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(name)) {
                return entry.getValue();
            }
        }
        return null;
    }

    public boolean isError() {
        return status >= 400;
    }

    public static String reasonPhrase(int status) {
        return REASONS.getOrDefault(status, status >= 500 ? "Server Error" : status >= 400 ? "Client Error" : "OK");
    }

    /**
     * Renders the response as an HTTP/1.1 message, as embedded in {@code $batch} responses.
     */
    public String toHttpString() {
        StringBuilder sb = new StringBuilder();
        sb.append("HTTP/1.1 ").append(status).append(' ').append(reasonPhrase(status)).append("\r\n");
        headers.forEach((name, value) -> sb.append(name).append(": ").append(value).append("\r\n"));
        sb.append("\r\n");
        if (body != null) {
            sb.append(body);
        }
        return sb.toString();
    }
}
