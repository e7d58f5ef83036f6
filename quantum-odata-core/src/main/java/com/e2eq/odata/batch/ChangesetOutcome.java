package com.e2eq.odata.batch;

import com.e2eq.odata.service.ODataResponse;

import java.util.List;

/**
 * Result of one changeset. When {@code failed}, {@code responses} holds the single failure
 * response and {@code failedOperation} the 1-based position of the operation that failed.
 *
 * @param completedOperations operations that ran, the failing one included
 */
public record ChangesetOutcome(List<ODataResponse> responses, int completedOperations, int totalOperations,
                               boolean failed, Integer failedOperation) {

    public ChangesetOutcome {
        responses = List.copyOf(responses);
    }

    public static ChangesetOutcome succeeded(List<ODataResponse> responses) {
        return new ChangesetOutcome(responses, responses.size(), responses.size(), false, null);
    }
}
