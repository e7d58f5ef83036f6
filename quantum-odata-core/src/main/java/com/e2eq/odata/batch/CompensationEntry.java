package com.e2eq.odata.batch;

/**
 * @param operationIndex 1-based position of the operation in its changeset
 * @param entityId       affected record, when it could be determined
 */
public record CompensationEntry(CompensationAction action, String method, String url, int operationIndex,
                                String entityId) {
}
