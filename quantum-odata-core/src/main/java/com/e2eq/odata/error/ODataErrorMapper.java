package com.e2eq.odata.error;

import com.e2eq.odata.spi.CodedError;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.exception.ExceptionUtils;

import java.util.Set;

/**
 * Classifies arbitrary errors into the OData error taxonomy.
 * <p>
 * {@link ODataException}s pass through untouched. Anything else is matched by simple class name
 * and, for {@link CodedError}s, by code, in this order: validation, permission, authentication,
 * not-found, database. Unrecognized errors become {@code InternalServerError}.
 */
public class ODataErrorMapper {

    static final String DATABASE_ERROR_MESSAGE = "An error occurred while processing your request";

    private static final Set<String> VALIDATION_NAMES =
            Set.of("ValidationError", "ValidationException", "ConstraintViolationException");
    private static final Set<String> PERMISSION_NAMES =
            Set.of("PermissionError", "PermissionException", "AccessDeniedException", "ForbiddenException");
    private static final Set<String> AUTHENTICATION_NAMES =
            Set.of("AuthenticationError", "AuthenticationException", "NotAuthorizedException");
    private static final Set<String> NOT_FOUND_NAMES =
            Set.of("NotFoundError", "NotFoundException");
    private static final Set<String> DATABASE_NAMES =
            Set.of("DatabaseError", "DatabaseException");

    private final boolean includeInnerError;

    public ODataErrorMapper() {
        this(false);
    }

    public ODataErrorMapper(boolean includeInnerError) {
        this.includeInnerError = includeInnerError;
    }

    public ODataError map(Throwable err) {
        if (err instanceof ODataException oe) {
            return ODataError.builder()
                    .code(oe.getCode().getCode())
                    .message(oe.getMessage())
                    .target(oe.getTarget())
                    .details(oe.getDetails())
                    .innererror(innerError(err))
                    .build();
        }

        String name = err.getClass().getSimpleName();
        String code = err instanceof CodedError ce ? ce.getCode() : null;
        String message = err.getMessage();

        ODataErrorCode mapped;
        if (VALIDATION_NAMES.contains(name) || "VALIDATION_ERROR".equals(code)) {
            mapped = ODataErrorCode.BAD_REQUEST;
            message = StringUtils.defaultIfBlank(message, "Validation failed");
        } else if (PERMISSION_NAMES.contains(name) || "FORBIDDEN".equals(code)) {
            mapped = ODataErrorCode.FORBIDDEN;
            message = StringUtils.defaultIfBlank(message, "Access forbidden");
        } else if (AUTHENTICATION_NAMES.contains(name) || "UNAUTHORIZED".equals(code)) {
            mapped = ODataErrorCode.UNAUTHORIZED;
            message = StringUtils.defaultIfBlank(message, "Authentication required");
        } else if (NOT_FOUND_NAMES.contains(name) || "NOT_FOUND".equals(code)) {
            mapped = ODataErrorCode.NOT_FOUND;
            message = StringUtils.defaultIfBlank(message, "Resource not found");
        } else if (DATABASE_NAMES.contains(name) || (code != null && code.startsWith("DB_"))) {
            // storage details never reach the caller
            mapped = ODataErrorCode.INTERNAL_SERVER_ERROR;
            message = DATABASE_ERROR_MESSAGE;
        } else {
            mapped = ODataErrorCode.INTERNAL_SERVER_ERROR;
            message = StringUtils.defaultIfBlank(message, "Internal server error");
        }

        return ODataError.builder()
                .code(mapped.getCode())
                .message(message)
                .innererror(innerError(err))
                .build();
    }

    public ODataErrorResponse toResponse(Throwable err) {
        return new ODataErrorResponse(map(err));
    }

    private ODataError.InnerError innerError(Throwable err) {
        if (!includeInnerError) {
            return null;
        }
        return new ODataError.InnerError(
                StringUtils.defaultString(err.getMessage()),
                err.getClass().getName(),
                ExceptionUtils.getStackTrace(err));
    }
}
