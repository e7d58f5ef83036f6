package com.e2eq.odata.spi;

/**
 * Failure reported by a {@link DataEngine} or {@link MetadataRegistry} implementation.
 */
public class DataEngineException extends RuntimeException implements CodedError {
    private static final long serialVersionUID = 1L;

    private final String code;

    public DataEngineException(String code, String message) {
        super(message);
        this.code = code;
    }

    public DataEngineException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    @Override
    public String getCode() {
        return code;
    }
}
