package com.e2eq.odata.spi;

/**
 * Implemented by collaborator exceptions that carry a machine readable code
 * such as {@code VALIDATION_ERROR} or {@code DB_CONNECTION_LOST}.
 */
public interface CodedError {
    String getCode();
}
