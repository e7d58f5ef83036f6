package com.e2eq.odata.batch;

import com.e2eq.odata.error.ODataError;
import com.e2eq.odata.error.ODataErrorMapper;
import com.e2eq.odata.service.ODataResponse;
import com.e2eq.odata.spi.RecordFields;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Executes {@code $batch} requests. Plain requests are independent of each other. Changeset
 * operations run sequentially and stop at the first 4xx/5xx response; earlier successful
 * operations are not undone, their compensation is only recorded in the {@link CompensationLog}.
 */
public class BatchExecutor {
    private static final Logger LOG = Logger.getLogger(BatchExecutor.class);

    public static final String CHANGESET_FAILED = "ChangesetFailed";

    private static final Pattern KEY = Pattern.compile("\\(\\s*'?([^')]*)'?\\s*\\)");

    private final BatchOperationDispatcher dispatcher;
    private final CompensationLog compensationLog;
    private final ODataErrorMapper errorMapper;
    private final ObjectMapper mapper;

    public BatchExecutor(BatchOperationDispatcher dispatcher, CompensationLog compensationLog,
                         ODataErrorMapper errorMapper, ObjectMapper mapper) {
        this.dispatcher = dispatcher;
        this.compensationLog = compensationLog;
        this.errorMapper = errorMapper;
        this.mapper = mapper;
    }

    public BatchResult execute(String rawBody, String boundary) {
        List<BatchPart> parts = BatchParser.parse(rawBody, boundary);
        LOG.debugf("Executing batch with %d part(s)", parts.size());

        List<ODataResponse> responses = new ArrayList<>();
        for (BatchPart part : parts) {
            if (part instanceof BatchPart.Changeset changeset) {
                responses.addAll(executeChangeset(changeset).responses());
            } else if (part instanceof BatchPart.Request request) {
                responses.add(dispatchSafely(request));
            }
        }

        String responseBoundary = BatchResponseWriter.newBoundary();
        return new BatchResult(responses, BatchResponseWriter.write(responses, responseBoundary), responseBoundary);
    }

    public ChangesetOutcome executeChangeset(BatchPart.Changeset changeset) {
        List<BatchPart.Request> requests = changeset.requests();
        List<ODataResponse> succeeded = new ArrayList<>();

        for (int i = 0; i < requests.size(); i++) {
            BatchPart.Request request = requests.get(i);
            ODataResponse response = dispatchSafely(request);
            if (response.isError()) {
                int completed = i + 1;
                String changesetId = UUID.randomUUID().toString();
                LOG.warnf("Changeset %s operation %d/%d (%s %s) failed with status %d; skipping the rest",
                        changesetId, completed, requests.size(), request.method(), request.url(), response.getStatus());
                compensationLog.record(changesetId, compensationEntries(requests, succeeded));
                ODataResponse failure = failureResponse(response, completed, succeeded.size(), requests.size());
                return new ChangesetOutcome(List.of(failure), completed, requests.size(), true, completed);
            }
            succeeded.add(response);
        }
        return ChangesetOutcome.succeeded(succeeded);
    }

    private ODataResponse dispatchSafely(BatchPart.Request request) {
        try {
            return dispatcher.dispatch(request);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Batch operation %s %s failed", request.method(), request.url());
            ODataError error = errorMapper.map(e);
            return ODataResponse.of(error.getHttpStatus(), ODataResponse.APPLICATION_JSON,
                    writeJson(Map.of("error", error)));
        }
    }

    /**
     * Compensation intents for the successful operations, last first.
     */
    List<CompensationEntry> compensationEntries(List<BatchPart.Request> requests, List<ODataResponse> succeeded) {
        List<CompensationEntry> entries = new ArrayList<>();
        for (int i = succeeded.size() - 1; i >= 0; i--) {
            BatchPart.Request request = requests.get(i);
            CompensationAction action = CompensationAction.forMethod(request.method());
            if (action == null) {
                continue;
            }
            String entityId = action == CompensationAction.DELETE_CREATED
                    ? createdId(succeeded.get(i))
                    : keyOf(request.url());
            entries.add(new CompensationEntry(action, request.method(), request.url(), i + 1, entityId));
        }
        return entries;
    }

    private ODataResponse failureResponse(ODataResponse failed, int completed, int succeeded, int total) {
        String cause = errorMessage(failed);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("completedOperations", completed);
        details.put("succeededOperations", succeeded);
        details.put("totalOperations", total);
        details.put("failedOperation", completed);
        details.put("rollbackAttempted", true);

        Map<String, Object> error = new LinkedHashMap<>();
        error.put("code", CHANGESET_FAILED);
        error.put("message", "Changeset operation " + completed + "/" + total + " failed: " + cause);
        error.put("details", details);

        return ODataResponse.of(failed.getStatus(), ODataResponse.APPLICATION_JSON, writeJson(Map.of("error", error)));
    }

    private String errorMessage(ODataResponse response) {
        if (response.getBody() != null) {
            try {
                JsonNode message = mapper.readTree(response.getBody()).path("error").path("message");
                if (message.isTextual()) {
                    return message.asText();
                }
            } catch (JsonProcessingException e) {
                LOG.debugf("Failed operation returned a non-JSON body: %s", e.getOriginalMessage());
            }
        }
        return "HTTP " + response.getStatus() + " " + ODataResponse.reasonPhrase(response.getStatus());
    }

    private String createdId(ODataResponse response) {
        if (response.getBody() == null) {
            return null;
        }
        try {
            JsonNode id = mapper.readTree(response.getBody()).path(RecordFields.ID);
            return id.isMissingNode() || id.isNull() ? null : id.asText();
        } catch (JsonProcessingException e) {
            LOG.debugf("Created entity body is not JSON: %s", e.getOriginalMessage());
            return null;
        }
    }

    static String keyOf(String url) {
        Matcher m = KEY.matcher(url);
        return m.find() ? m.group(1) : null;
    }

    private String writeJson(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize batch error body", e);
        }
    }
}
