package com.e2eq.odata.service;

import com.e2eq.odata.batch.BatchExecutor;
import com.e2eq.odata.batch.BatchOperationDispatcher;
import com.e2eq.odata.batch.BatchParser;
import com.e2eq.odata.batch.BatchPart;
import com.e2eq.odata.batch.BatchResult;
import com.e2eq.odata.batch.CompensationLog;
import com.e2eq.odata.batch.LoggingCompensationLog;
import com.e2eq.odata.error.ODataError;
import com.e2eq.odata.error.ODataErrorCode;
import com.e2eq.odata.error.ODataErrorMapper;
import com.e2eq.odata.error.ODataException;
import com.e2eq.odata.etag.ConcurrencyGuard;
import com.e2eq.odata.etag.ETagGenerator;
import com.e2eq.odata.expand.ExpandOrchestrator;
import com.e2eq.odata.metadata.EdmxMetadataGenerator;
import com.e2eq.odata.metadata.ServiceDocument;
import com.e2eq.odata.query.QueryDescriptor;
import com.e2eq.odata.query.QueryOptionTranslator;
import com.e2eq.odata.query.QueryOptionsParser;
import com.e2eq.odata.spi.DataEngine;
import com.e2eq.odata.spi.MetadataRegistry;
import com.e2eq.odata.spi.RecordFields;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.jboss.logging.Logger;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Single-request OData path: routes an {@link ODataRequest} under the base path, dispatches it to
 * the collaborators and renders the response. Every failure is turned into the OData error
 * envelope here. The same path serves the operations of a {@code $batch}.
 */
public class ODataProtocolService implements BatchOperationDispatcher {
    private static final Logger LOG = Logger.getLogger(ODataProtocolService.class);

    public static final String METADATA = "$metadata";
    public static final String BATCH = "$batch";
    public static final String COUNT_SEGMENT = "$count";

    public static final Map<String, String> CORS_HEADERS = Map.of(
            "Access-Control-Allow-Origin", "*",
            "Access-Control-Allow-Methods", "GET, POST, PUT, PATCH, DELETE, OPTIONS",
            "Access-Control-Allow-Headers", "Content-Type, Authorization, If-Match, If-None-Match, OData-Version, OData-MaxVersion",
            "Access-Control-Expose-Headers", "ETag, Location, OData-Version");

    private static final TypeReference<Map<String, Object>> RECORD_TYPE = new TypeReference<>() {
    };

    /** {@code Set}, {@code Set('key')}, {@code Set(key)} or {@code Set/$count}. */
    private static final Pattern RESOURCE = Pattern.compile(
            "^([A-Za-z_][A-Za-z0-9_.]*)(?:\\(\\s*(?:'((?:[^']|'')*)'|([^)'\\s]+))\\s*\\))?(?:/(\\$count))?$");

    private final ODataServiceConfig config;
    private final MetadataRegistry metadataRegistry;
    private final DataEngine dataEngine;
    private final ObjectMapper mapper;
    private final ODataErrorMapper errorMapper;
    private final QueryOptionTranslator translator;
    private final ExpandOrchestrator expandOrchestrator;
    private final EdmxMetadataGenerator metadataGenerator;
    private final ConcurrencyGuard concurrencyGuard;
    private final BatchExecutor batchExecutor;

    public ODataProtocolService(ODataServiceConfig config, MetadataRegistry metadataRegistry, DataEngine dataEngine) {
        this(config, metadataRegistry, dataEngine, new ObjectMapper(), new LoggingCompensationLog());
    }

    public ODataProtocolService(ODataServiceConfig config, MetadataRegistry metadataRegistry, DataEngine dataEngine,
                                ObjectMapper mapper, CompensationLog compensationLog) {
        this.config = config;
        this.metadataRegistry = metadataRegistry;
        this.dataEngine = dataEngine;
        this.mapper = mapper;
        this.errorMapper = new ODataErrorMapper(config.isVerboseErrors());
        this.translator = new QueryOptionTranslator(config.isEnableSearch());
        this.expandOrchestrator = new ExpandOrchestrator(metadataRegistry, dataEngine, config.getMaxExpandDepth());
        this.metadataGenerator = new EdmxMetadataGenerator(metadataRegistry);
        this.concurrencyGuard = new ConcurrencyGuard(new ETagGenerator(mapper));
        this.batchExecutor = new BatchExecutor(this, compensationLog, errorMapper, mapper);
    }

    public ODataServiceConfig getConfig() {
        return config;
    }

    public ODataResponse handle(ODataRequest request) {
        try {
            return route(request).header(ODataResponse.ODATA_VERSION, "4.0");
        } catch (RuntimeException e) {
            return errorResponse(e, request);
        }
    }

    @Override
    public ODataResponse dispatch(BatchPart.Request operation) {
        String url = operation.url();
        String path = url;
        String query = null;
        try {
            URI uri = new URI(url);
            if (uri.isAbsolute()) {
                path = uri.getRawPath();
                query = uri.getRawQuery();
            } else {
                int q = url.indexOf('?');
                if (q >= 0) {
                    path = url.substring(0, q);
                    query = url.substring(q + 1);
                }
            }
        } catch (URISyntaxException e) {
            int q = url.indexOf('?');
            if (q >= 0) {
                path = url.substring(0, q);
                query = url.substring(q + 1);
            }
        }
        path = StringUtils.defaultString(path);
        if (!path.startsWith("/")) {
            path = config.getBasePath() + "/" + path;
        } else if (!isUnderBasePath(path)) {
            path = config.getBasePath() + path;
        }
        if (relativePath(path).equals(BATCH)) {
            return errorResponse(ODataException.badRequest("Nested $batch requests are not supported"), null);
        }
        return handle(ODataRequest.builder()
                .method(operation.method())
                .path(path)
                .queryString(query)
                .headers(operation.headers())
                .body(operation.body())
                .build());
    }

    private ODataResponse route(ODataRequest request) {
        String method = request.getMethod();
        if (!isUnderBasePath(request.getPath())) {
            throw ODataException.notFound("Resource not found: " + request.getPath());
        }
        if ("OPTIONS".equals(method) && config.isEnableCors()) {
            ODataResponse response = ODataResponse.noContent(204);
            CORS_HEADERS.forEach(response::header);
            return response;
        }

        String relative = relativePath(request.getPath());
        if (relative.isEmpty()) {
            requireMethod(method, "GET");
            return json(200, ServiceDocument.of(config.getBasePath(), metadataRegistry.listObjectTypes()));
        }
        if (METADATA.equals(relative)) {
            requireMethod(method, "GET");
            return ODataResponse.of(200, ODataResponse.APPLICATION_XML, metadataGenerator.render(config.getNamespace()));
        }
        if (BATCH.equals(relative)) {
            return handleBatch(request);
        }

        Matcher m = RESOURCE.matcher(relative);
        if (!m.matches()) {
            throw ODataException.badRequest("Invalid OData path: " + relative);
        }
        String entitySet = m.group(1);
        String key = m.group(2) != null ? m.group(2).replace("''", "'") : m.group(3);
        boolean count = m.group(4) != null;
        if (!metadataRegistry.isKnownType(entitySet)) {
            throw ODataException.notFound("Entity set '" + entitySet + "' not found");
        }
        Map<String, String> options = QueryOptionsParser.parse(request.getQueryString());

        if (count) {
            if (key != null) {
                throw ODataException.badRequest("$count is not supported on a single entity");
            }
            requireMethod(method, "GET");
            return countEntitySet(entitySet, options);
        }

        switch (method) {
            case "GET":
                return key == null ? queryEntitySet(entitySet, options) : getEntity(entitySet, key, options, request);
            case "POST":
                if (key != null) {
                    throw methodNotAllowed(method, relative);
                }
                return createEntity(entitySet, request);
            case "PUT":
            case "PATCH":
                return updateEntity(entitySet, requireKey(key, method), request);
            case "DELETE":
                dataEngine.delete(entitySet, requireKey(key, method));
                return ODataResponse.noContent(204);
            default:
                throw methodNotAllowed(method, relative);
        }
    }

    private ODataResponse queryEntitySet(String entitySet, Map<String, String> options) {
        QueryDescriptor query = translator.translate(options);
        List<Map<String, Object>> records = new ArrayList<>(dataEngine.find(entitySet, query));
        expandOrchestrator.expand(entitySet, records, options.get(QueryOptionTranslator.EXPAND), 0);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("@odata.context", contextUrl(entitySet));
        if (QueryOptionTranslator.isCountRequested(options)) {
            body.put("@odata.count", dataEngine.count(entitySet, translator.countDescriptor(query)));
        }
        body.put("value", records);
        return json(200, body);
    }

    private ODataResponse countEntitySet(String entitySet, Map<String, String> options) {
        QueryDescriptor query = translator.countDescriptor(translator.translate(options));
        long count = dataEngine.count(entitySet, query);
        return ODataResponse.of(200, ODataResponse.TEXT_PLAIN, Long.toString(count));
    }

    private ODataResponse getEntity(String entitySet, String key, Map<String, String> options, ODataRequest request) {
        Map<String, Object> entity = findEntity(entitySet, key);
        String etag = null;
        if (config.isEnableEtags()) {
            etag = concurrencyGuard.etag(entity);
            if (concurrencyGuard.isNotModified(request.header("If-None-Match"), etag)) {
                return ODataResponse.noContent(304).header(ODataResponse.ETAG, etag);
            }
        }
        List<Map<String, Object>> single = new ArrayList<>(List.of(entity));
        expandOrchestrator.expand(entitySet, single, options.get(QueryOptionTranslator.EXPAND), 0);
        return json(200, entityBody(entitySet, single.get(0))).header(ODataResponse.ETAG, etag);
    }

    private ODataResponse createEntity(String entitySet, ODataRequest request) {
        Map<String, Object> created = dataEngine.create(entitySet, readBody(request));
        ODataResponse response = json(201, entityBody(entitySet, created));
        if (config.isEnableEtags()) {
            response.header(ODataResponse.ETAG, concurrencyGuard.etag(created));
        }
        Object id = created.get(RecordFields.ID);
        if (id != null) {
            response.header(ODataResponse.LOCATION,
                    config.getBasePath() + "/" + entitySet + "('" + String.valueOf(id).replace("'", "''") + "')");
        }
        return response;
    }

    private ODataResponse updateEntity(String entitySet, String key, ODataRequest request) {
        String ifMatch = request.header("If-Match");
        if (config.isEnableEtags() && ifMatch != null) {
            concurrencyGuard.checkIfMatch(ifMatch, findEntity(entitySet, key));
        }
        Map<String, Object> updated = dataEngine.update(entitySet, key, readBody(request))
                .orElseThrow(() -> ODataException.notFound("Entity '" + key + "' not found in " + entitySet));
        ODataResponse response = json(200, entityBody(entitySet, updated));
        if (config.isEnableEtags()) {
            response.header(ODataResponse.ETAG, concurrencyGuard.etag(updated));
        }
        return response;
    }

    private ODataResponse handleBatch(ODataRequest request) {
        if (!"POST".equals(request.getMethod())) {
            throw methodNotAllowed(request.getMethod(), BATCH);
        }
        if (!config.isEnableBatch()) {
            throw new ODataException(ODataErrorCode.NOT_IMPLEMENTED, "$batch is not enabled");
        }
        String contentType = request.header(ODataResponse.CONTENT_TYPE);
        String boundary = BatchParser.extractBoundary(contentType)
                .orElseThrow(() -> ODataException.badRequest(
                        "Invalid batch content type '" + contentType + "': missing boundary parameter"));
        BatchResult result = batchExecutor.execute(request.getBody(), boundary);
        return ODataResponse.of(200, result.contentType(), result.envelope());
    }

    private Map<String, Object> findEntity(String entitySet, String key) {
        Optional<Map<String, Object>> entity = dataEngine.get(entitySet, key);
        return entity.orElseThrow(() -> ODataException.notFound("Entity '" + key + "' not found in " + entitySet));
    }

    private Map<String, Object> readBody(ODataRequest request) {
        if (StringUtils.isBlank(request.getBody())) {
            return new LinkedHashMap<>();
        }
        try {
            Map<String, Object> body = mapper.readValue(request.getBody(), RECORD_TYPE);
            if (body == null) {
                throw ODataException.badRequest("Request body must be a JSON object");
            }
            return body;
        } catch (JsonProcessingException e) {
            throw new ODataException(ODataErrorCode.BAD_REQUEST, "Invalid JSON: " + e.getOriginalMessage(),
                    null, null, e);
        }
    }

    private Map<String, Object> entityBody(String entitySet, Map<String, Object> entity) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("@odata.context", contextUrl(entitySet) + "/$entity");
        body.putAll(entity);
        return body;
    }

    private String contextUrl(String entitySet) {
        return config.getBasePath() + "/" + METADATA + "#" + entitySet;
    }

    private ODataResponse json(int status, Object body) {
        try {
            return ODataResponse.of(status, ODataResponse.APPLICATION_JSON, mapper.writeValueAsString(body));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize response body", e);
        }
    }

    ODataResponse errorResponse(Throwable e, ODataRequest request) {
        ODataError error = errorMapper.map(e);
        int status = error.getHttpStatus();
        String where = request == null ? "" : request.getMethod() + " " + request.getPath();
        if (status >= 500) {
            LOG.errorf(e, "OData request %s failed: %s", where, e.getMessage());
        } else {
            LOG.warnf("OData request %s rejected with %d %s: %s", where, status, error.getCode(), error.getMessage());
        }
        Map<String, Object> body = Map.of("error", error);
        String json;
        try {
            json = mapper.writeValueAsString(body);
        } catch (JsonProcessingException ex) {
            LOG.error("Failed to serialize error envelope", ex);
            json = "{\"error\":{\"code\":\"InternalServerError\",\"message\":\"Internal server error\"}}";
        }
        return ODataResponse.of(status, ODataResponse.APPLICATION_JSON, json).header(ODataResponse.ODATA_VERSION, "4.0");
    }

    private boolean isUnderBasePath(String path) {
        String base = config.getBasePath();
        return base.isEmpty() || path.equals(base) || path.startsWith(base + "/");
    }

    /** Path below the base path without leading or trailing slashes. */
    private String relativePath(String path) {
        String relative = path.substring(config.getBasePath().length());
        return StringUtils.strip(relative, "/");
    }

    private static void requireMethod(String method, String expected) {
        if (!expected.equals(method)) {
            throw methodNotAllowed(method, null);
        }
    }

    private static String requireKey(String key, String method) {
        if (key == null) {
            throw ODataException.badRequest(method + " requires an entity key, e.g. Set('id')");
        }
        return key;
    }

    private static ODataException methodNotAllowed(String method, String resource) {
        return new ODataException(ODataErrorCode.METHOD_NOT_ALLOWED,
                "Method " + method + " not allowed" + (resource == null ? "" : " on " + resource));
    }
}
