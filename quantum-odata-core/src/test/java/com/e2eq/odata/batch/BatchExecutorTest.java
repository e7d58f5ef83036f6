package com.e2eq.odata.batch;

import com.e2eq.odata.error.ODataErrorMapper;
import com.e2eq.odata.service.ODataResponse;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BatchExecutorTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final List<String> dispatched = new ArrayList<>();
    private final List<List<CompensationEntry>> compensations = new ArrayList<>();
    private BatchExecutor executor;

    @BeforeEach
    void setUp() {
        BatchOperationDispatcher dispatcher = request -> {
            dispatched.add(request.method() + " " + request.url());
            if (request.url().contains("missing")) {
                return ODataResponse.of(404, ODataResponse.APPLICATION_JSON,
                        "{\"error\":{\"code\":\"NotFound\",\"message\":\"Entity 'missing' not found\"}}");
            }
            if (request.url().contains("boom")) {
                throw new IllegalStateException("boom");
            }
            if ("POST".equals(request.method())) {
                return ODataResponse.of(201, ODataResponse.APPLICATION_JSON, "{\"_id\":\"new-1\"}");
            }
            if ("DELETE".equals(request.method())) {
                return ODataResponse.noContent(204);
            }
            return ODataResponse.of(200, ODataResponse.APPLICATION_JSON, "{\"url\":\"" + request.url() + "\"}");
        };
        CompensationLog log = (changesetId, entries) -> compensations.add(entries);
        executor = new BatchExecutor(dispatcher, log, new ODataErrorMapper(), mapper);
    }

    @Test
    void testResponsesFollowRequestOrder() {
        String body = batch("b",
                request("GET", "A"),
                changeset("cs", request("POST", "B"), request("PATCH", "C('1')")),
                request("GET", "D"));
        BatchResult result = executor.execute(body, "b");

        assertEquals(List.of("GET A", "POST B", "PATCH C('1')", "GET D"), dispatched);
        assertEquals(List.of(200, 201, 200, 200), result.responses().stream().map(ODataResponse::getStatus).toList());
        assertTrue(result.boundary().startsWith("batch_"));
        assertEquals("multipart/mixed; boundary=" + result.boundary(), result.contentType());

        int a = result.envelope().indexOf("\"url\":\"A\"");
        int d = result.envelope().indexOf("\"url\":\"D\"");
        assertTrue(a > 0 && d > a);
        assertTrue(result.envelope().contains("HTTP/1.1 201 Created\r\n"));
        assertTrue(result.envelope().endsWith("--" + result.boundary() + "--\r\n"));
    }

    @Test
    void testFailingRequestOnlyAffectsItsOwnPart() {
        BatchResult result = executor.execute(batch("b",
                request("GET", "missing"), request("GET", "B")), "b");
        assertEquals(List.of(404, 200), result.responses().stream().map(ODataResponse::getStatus).toList());
    }

    @Test
    void testThrowingDispatcherBecomesErrorPart() throws Exception {
        BatchResult result = executor.execute(batch("b", request("GET", "boom"), request("GET", "B")), "b");
        ODataResponse failed = result.responses().get(0);
        assertEquals(500, failed.getStatus());
        assertEquals("InternalServerError", mapper.readTree(failed.getBody()).path("error").path("code").asText());
        assertEquals(200, result.responses().get(1).getStatus());
    }

    @Test
    void testChangesetAbortsOnFirstFailure() throws Exception {
        BatchPart.Changeset changeset = new BatchPart.Changeset(List.of(
                new BatchPart.Request("POST", "Products"),
                new BatchPart.Request("PATCH", "Products('missing')"),
                new BatchPart.Request("PATCH", "Products('p2')")));

        ChangesetOutcome outcome = executor.executeChangeset(changeset);

        assertTrue(outcome.failed());
        assertEquals(2, outcome.completedOperations());
        assertEquals(3, outcome.totalOperations());
        assertEquals(2, outcome.failedOperation());
        // the third operation is never attempted
        assertEquals(List.of("POST Products", "PATCH Products('missing')"), dispatched);

        assertEquals(1, outcome.responses().size());
        ODataResponse failure = outcome.responses().get(0);
        assertEquals(404, failure.getStatus());
        JsonNode error = mapper.readTree(failure.getBody()).path("error");
        assertEquals("ChangesetFailed", error.path("code").asText());
        assertTrue(error.path("message").asText().contains("Entity 'missing' not found"));
        JsonNode details = error.path("details");
        assertEquals(2, details.path("completedOperations").asInt());
        assertEquals(1, details.path("succeededOperations").asInt());
        assertEquals(3, details.path("totalOperations").asInt());
        assertEquals(2, details.path("failedOperation").asInt());
        assertTrue(details.path("rollbackAttempted").asBoolean());
    }

    @Test
    void testCompensationIsLoggedInReverseOrder() {
        executor.executeChangeset(new BatchPart.Changeset(List.of(
                new BatchPart.Request("POST", "Products"),
                new BatchPart.Request("DELETE", "Products('p1')"),
                new BatchPart.Request("PUT", "Products('p2')"),
                new BatchPart.Request("DELETE", "Products('missing')"))));

        assertEquals(1, compensations.size());
        List<CompensationEntry> entries = compensations.get(0);
        assertEquals(List.of(
                new CompensationEntry(CompensationAction.REVERT_UPDATE, "PUT", "Products('p2')", 3, "p2"),
                new CompensationEntry(CompensationAction.RESTORE_DELETED, "DELETE", "Products('p1')", 2, "p1"),
                new CompensationEntry(CompensationAction.DELETE_CREATED, "POST", "Products", 1, "new-1")),
                entries);
    }

    @Test
    void testSuccessfulChangesetKeepsAllResponses() {
        ChangesetOutcome outcome = executor.executeChangeset(new BatchPart.Changeset(List.of(
                new BatchPart.Request("POST", "Products"),
                new BatchPart.Request("DELETE", "Products('p1')"))));
        assertFalse(outcome.failed());
        assertEquals(List.of(201, 204), outcome.responses().stream().map(ODataResponse::getStatus).toList());
        assertTrue(compensations.isEmpty());
    }

    static String batch(String boundary, String... parts) {
        StringBuilder sb = new StringBuilder();
        for (String part : parts) {
            sb.append("--").append(boundary).append("\r\n").append(part).append("\r\n");
        }
        return sb.append("--").append(boundary).append("--\r\n").toString();
    }

    static String changeset(String boundary, String... requests) {
        return "Content-Type: multipart/mixed; boundary=" + boundary + "\r\n\r\n" + batch(boundary, requests);
    }

    static String request(String method, String url) {
        return "Content-Type: application/http\r\nContent-Transfer-Encoding: binary\r\n\r\n"
                + method + " " + url + " HTTP/1.1\r\n\r\n";
    }
}
