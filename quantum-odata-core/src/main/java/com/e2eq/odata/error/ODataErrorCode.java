package com.e2eq.odata.error;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * OData error codes. Each code carries the HTTP status a response using it is sent with.
 */
public enum ODataErrorCode {
    // client errors
    BAD_REQUEST("BadRequest", 400),
    UNAUTHORIZED("Unauthorized", 401),
    FORBIDDEN("Forbidden", 403),
    NOT_FOUND("NotFound", 404),
    METHOD_NOT_ALLOWED("MethodNotAllowed", 405),
    NOT_ACCEPTABLE("NotAcceptable", 406),
    PRECONDITION_FAILED("PreconditionFailed", 412),

    // server errors
    INTERNAL_SERVER_ERROR("InternalServerError", 500),
    NOT_IMPLEMENTED("NotImplemented", 501),
    SERVICE_UNAVAILABLE("ServiceUnavailable", 503),

    // query option errors
    INVALID_QUERY("InvalidQuery", 400),
    INVALID_FILTER("InvalidFilter", 400),
    INVALID_ORDER_BY("InvalidOrderBy", 400),
    INVALID_EXPAND("InvalidExpand", 400),
    INVALID_SELECT("InvalidSelect", 400);

    private final String code;
    private final int httpStatus;

    ODataErrorCode(String code, int httpStatus) {
        this.code = code;
        this.httpStatus = httpStatus;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public int getHttpStatus() {
        return httpStatus;
    }

    public static Optional<ODataErrorCode> fromCode(String code) {
        return Arrays.stream(values())
                .filter(c -> c.code.equals(code))
                .findFirst();
    }
}
