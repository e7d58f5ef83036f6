package com.e2eq.odata.etag;

import com.e2eq.odata.error.ODataErrorCode;
import com.e2eq.odata.error.ODataException;

import java.util.Map;

/**
 * Optimistic concurrency checks for {@code If-Match} and {@code If-None-Match}.
 */
public class ConcurrencyGuard {

    public static final String ANY = "*";

    private final ETagGenerator generator;

    public ConcurrencyGuard(ETagGenerator generator) {
        this.generator = generator;
    }

    public String etag(Map<String, Object> entity) {
        return generator.compute(entity);
    }

    /**
     * @throws ODataException {@code PreconditionFailed} when {@code ifMatch} does not match the
     *                        current entity's tag
     */
    public void checkIfMatch(String ifMatch, Map<String, Object> current) {
        String currentTag = etag(current);
        if (!matches(currentTag, ifMatch)) {
            throw new ODataException(ODataErrorCode.PRECONDITION_FAILED,
                    "Precondition Failed: ETag mismatch (current " + currentTag + ")", "If-Match");
        }
    }

    public boolean isNotModified(String ifNoneMatch, String etag) {
        return ifNoneMatch != null && matches(etag, ifNoneMatch);
    }

    /**
     * True when {@code header} is {@code *} or lists {@code etag} among its comma separated tags.
     */
    public static boolean matches(String etag, String header) {
        if (header == null) {
            return false;
        }
        for (String candidate : header.split(",")) {
            String clean = candidate.trim();
            if (ANY.equals(clean) || clean.equals(etag)) {
                return true;
            }
        }
        return false;
    }
}
