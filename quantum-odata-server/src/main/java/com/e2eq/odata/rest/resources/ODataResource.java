package com.e2eq.odata.rest.resources;

import com.e2eq.odata.service.ODataProtocolService;
import com.e2eq.odata.service.ODataRequest;
import com.e2eq.odata.service.ODataResponse;
import io.quarkus.logging.Log;
import jakarta.inject.Inject;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.OPTIONS;
import jakarta.ws.rs.PATCH;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * HTTP entry point. Every path is handed to {@link ODataProtocolService}, which owns routing
 * below the configured base path and renders all responses, errors included.
 */
@Path("/")
@Tag(name = "odata", description = "OData V4 service")
public class ODataResource {

   @Inject
   ODataProtocolService protocolService;

   @GET
   @Path("{path: .*}")
   @Operation(summary = "Service document, $metadata, entity set queries, single entities and $count")
   @APIResponses(value = {
           @APIResponse(responseCode = "200", description = "Success"),
           @APIResponse(responseCode = "304", description = "Entity unchanged (If-None-Match)"),
           @APIResponse(responseCode = "400", description = "Invalid query options"),
           @APIResponse(responseCode = "404", description = "Unknown entity set or entity")
   })
   public Response get(@Context UriInfo uriInfo, @Context HttpHeaders headers) {
      return handle("GET", uriInfo, headers, null);
   }

   @POST
   @Path("{path: .*}")
   @Operation(summary = "Create an entity or execute a $batch request")
   @APIResponses(value = {
           @APIResponse(responseCode = "200", description = "Batch executed"),
           @APIResponse(responseCode = "201", description = "Entity created"),
           @APIResponse(responseCode = "400", description = "Malformed body")
   })
   public Response post(@Context UriInfo uriInfo, @Context HttpHeaders headers, String body) {
      return handle("POST", uriInfo, headers, body);
   }

   @PUT
   @Path("{path: .*}")
   @Operation(summary = "Update an entity")
   @APIResponses(value = {
           @APIResponse(responseCode = "200", description = "Entity updated"),
           @APIResponse(responseCode = "404", description = "Entity not found"),
           @APIResponse(responseCode = "412", description = "If-Match does not match the current ETag")
   })
   public Response put(@Context UriInfo uriInfo, @Context HttpHeaders headers, String body) {
      return handle("PUT", uriInfo, headers, body);
   }

   @PATCH
   @Path("{path: .*}")
   @Operation(summary = "Update an entity")
   @APIResponses(value = {
           @APIResponse(responseCode = "200", description = "Entity updated"),
           @APIResponse(responseCode = "404", description = "Entity not found"),
           @APIResponse(responseCode = "412", description = "If-Match does not match the current ETag")
   })
   public Response patch(@Context UriInfo uriInfo, @Context HttpHeaders headers, String body) {
      return handle("PATCH", uriInfo, headers, body);
   }

   @DELETE
   @Path("{path: .*}")
   @Operation(summary = "Delete an entity")
   @APIResponse(responseCode = "204", description = "Deleted")
   public Response delete(@Context UriInfo uriInfo, @Context HttpHeaders headers) {
      return handle("DELETE", uriInfo, headers, null);
   }

   @OPTIONS
   @Path("{path: .*}")
   @Operation(summary = "CORS preflight")
   @APIResponse(responseCode = "204", description = "CORS headers")
   public Response options(@Context UriInfo uriInfo, @Context HttpHeaders headers) {
      return handle("OPTIONS", uriInfo, headers, null);
   }

   protected Response handle(String method, UriInfo uriInfo, HttpHeaders headers, String body) {
      String path = uriInfo.getPath();
      if (!path.startsWith("/")) {
         path = "/" + path;
      }
      ODataRequest request = ODataRequest.builder()
              .method(method)
              .path(path)
              .queryString(uriInfo.getRequestUri().getRawQuery())
              .headers(flatten(headers))
              .body(body)
              .build();
      if (Log.isDebugEnabled()) {
         Log.debugf("ODataResource: %s %s?%s", method, path, request.getQueryString());
      }
      return toResponse(protocolService.handle(request));
   }

   static Map<String, String> flatten(HttpHeaders headers) {
      Map<String, String> flat = new LinkedHashMap<>();
      for (Map.Entry<String, List<String>> entry : headers.getRequestHeaders().entrySet()) {
         flat.put(entry.getKey(), String.join(", ", entry.getValue()));
      }
      return flat;
   }

   static Response toResponse(ODataResponse response) {
      Response.ResponseBuilder builder = Response.status(response.getStatus());
      response.getHeaders().forEach(builder::header);
      if (response.getBody() != null) {
         builder.entity(response.getBody());
      }
      return builder.build();
   }
}
