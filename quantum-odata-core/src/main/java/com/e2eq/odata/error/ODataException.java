package com.e2eq.odata.error;

import java.util.List;

/**
 * Error raised by the protocol layers (parser, translator, routing). The error mapper passes it
 * through unchanged, keeping its code, target and details.
 */
public class ODataException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final ODataErrorCode code;
    private final String target;
    private final List<ODataError.Detail> details;

    public ODataException(ODataErrorCode code, String message) {
        this(code, message, null, null, null);
    }

    public ODataException(ODataErrorCode code, String message, String target) {
        this(code, message, target, null, null);
    }

    public ODataException(ODataErrorCode code, String message, String target, List<ODataError.Detail> details) {
        this(code, message, target, details, null);
    }

    public ODataException(ODataErrorCode code, String message, String target, List<ODataError.Detail> details, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.target = target;
        this.details = details;
    }

    public ODataErrorCode getCode() {
        return code;
    }

    public String getTarget() {
        return target;
    }

    public List<ODataError.Detail> getDetails() {
        return details;
    }

    public int getHttpStatus() {
        return code.getHttpStatus();
    }

    public static ODataException invalidFilter(String message) {
        return new ODataException(ODataErrorCode.INVALID_FILTER, message, "$filter");
    }

    public static ODataException invalidQuery(String message, String target) {
        return new ODataException(ODataErrorCode.INVALID_QUERY, message, target);
    }

    public static ODataException notFound(String message) {
        return new ODataException(ODataErrorCode.NOT_FOUND, message);
    }

    public static ODataException badRequest(String message) {
        return new ODataException(ODataErrorCode.BAD_REQUEST, message);
    }
}
