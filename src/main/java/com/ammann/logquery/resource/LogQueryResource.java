/* (C)2026 */
package com.ammann.logquery.resource;

import com.ammann.logquery.dto.ErrorResponseDTO;
import com.ammann.logquery.dto.QueryResultDTO;
import com.ammann.logquery.exception.ApiException;
import com.ammann.logquery.exception.ResponseEncodingException;
import com.ammann.logquery.exception.ValidationException;
import com.ammann.logquery.observability.ObservabilityRecorder;
import com.ammann.logquery.observability.RequestLogScope;
import com.ammann.logquery.properties.ApiProperties;
import com.ammann.logquery.service.LogQueryService;
import com.ammann.logquery.service.ResponseCompressionService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.vertx.core.http.HttpServerRequest;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.concurrent.TimeUnit;
import java.util.function.BiFunction;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

/**
 * REST resource for log queries over the joined application server log tables.
 *
 * <p>The body is read as raw text so that unparsable JSON is reported as a 400 with a
 * completion record like any other validation failure. Every response carries
 * {@value ApiProperties#COMPRESSION_HEADER}.
 */
@Path(ApiProperties.Query.BASE)
@Tag(name = "Log Query API", description = "Filtered, paginated and aggregated log search")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class LogQueryResource {

    private static final Logger LOG = Logger.getLogger(LogQueryResource.class);
    private static final String UNKNOWN_ADDRESS = "unknown";
    private static final String GENERIC_FAILURE = "Query execution failed";

    @Inject LogQueryService queryService;

    @Inject ObservabilityRecorder recorder;

    @Inject ResponseCompressionService compressionService;

    @Inject ObjectMapper objectMapper;

    @POST
    @Operation(
            summary = "Simple Log Query",
            description =
                    "Returns log rows inside a time window ('interval' or 'dateRange'), newest"
                            + " first unless 'sort' is given")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Matching rows"),
        @APIResponse(
                responseCode = "400",
                description = "Malformed body or missing time window",
                content = @Content(schema = @Schema(implementation = ErrorResponseDTO.class))),
        @APIResponse(
                responseCode = "500",
                description = "Query execution failed",
                content = @Content(schema = @Schema(implementation = ErrorResponseDTO.class)))
    })
    public Response simpleQuery(
            String body,
            @HeaderParam(HttpHeaders.ACCEPT_ENCODING) String acceptEncoding,
            @HeaderParam(ApiProperties.FORWARDED_FOR_HEADER) String forwardedFor,
            @Context HttpServerRequest request) {
        return handle(
                ApiProperties.Query.BASE,
                body,
                acceptEncoding,
                remoteAddress(forwardedFor, request),
                queryService::simpleQuery);
    }

    @POST
    @Path(ApiProperties.Query.FACETED)
    @Operation(
            summary = "Faceted Log Query",
            description =
                    "Returns one page of rows with the total count, an optional group aggregate"
                            + " and an optional hourly breakdown, all over the same filters")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Composite result",
                content = @Content(schema = @Schema(implementation = QueryResultDTO.class))),
        @APIResponse(
                responseCode = "400",
                description = "Malformed body",
                content = @Content(schema = @Schema(implementation = ErrorResponseDTO.class))),
        @APIResponse(
                responseCode = "500",
                description = "Query execution failed",
                content = @Content(schema = @Schema(implementation = ErrorResponseDTO.class)))
    })
    public Response facetedQuery(
            String body,
            @HeaderParam(HttpHeaders.ACCEPT_ENCODING) String acceptEncoding,
            @HeaderParam(ApiProperties.FORWARDED_FOR_HEADER) String forwardedFor,
            @Context HttpServerRequest request) {
        return handle(
                ApiProperties.Query.FACETED_PATH,
                body,
                acceptEncoding,
                remoteAddress(forwardedFor, request),
                queryService::facetedQuery);
    }

    private Response handle(
            String endpoint,
            String rawBody,
            String acceptEncoding,
            String remoteAddress,
            BiFunction<JsonNode, RequestLogScope, ?> operation) {
        JsonNode body = parseBody(rawBody);

        try (RequestLogScope scope =
                recorder.open(endpoint, remoteAddress, body != null ? body : rawBody)) {
            int status;
            Object entity;
            String error = null;
            try {
                entity = operation.apply(body, scope);
                status = Response.Status.OK.getStatusCode();
            } catch (ValidationException e) {
                LOG.debugf("Rejected %s request: %s", endpoint, e.getMessage());
                status = Response.Status.BAD_REQUEST.getStatusCode();
                error = e.getMessage();
                entity = new ErrorResponseDTO(error);
            } catch (ApiException e) {
                status = Response.Status.INTERNAL_SERVER_ERROR.getStatusCode();
                error = e.getMessage() != null ? e.getMessage() : GENERIC_FAILURE;
                entity = new ErrorResponseDTO(error);
            }
            return render(scope, status, entity, error, acceptEncoding);
        }
    }

    private Response render(
            RequestLogScope scope, int status, Object entity, String error, String acceptEncoding) {
        byte[] payload;
        try {
            payload = objectMapper.writeValueAsBytes(entity);
        } catch (JsonProcessingException e) {
            throw new ResponseEncodingException(e);
        }

        long transformStart = System.nanoTime();
        boolean compress = compressionService.shouldCompress(acceptEncoding);
        if (compress) {
            payload = compressionService.gzip(payload);
        }
        scope.transformed(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - transformStart), compress);
        scope.responded(status, payload.length, error);

        Response.ResponseBuilder builder =
                Response.status(status)
                        .entity(payload)
                        .type(MediaType.APPLICATION_JSON_TYPE)
                        .header(ApiProperties.COMPRESSION_HEADER, Boolean.toString(compress));
        if (compress) {
            builder.header(HttpHeaders.CONTENT_ENCODING, "gzip");
        }
        return builder.build();
    }

    private JsonNode parseBody(String rawBody) {
        if (rawBody == null) {
            return null;
        }
        try {
            return objectMapper.readTree(rawBody);
        } catch (JsonProcessingException e) {
            LOG.debugf("Unparsable request body: %s", e.getOriginalMessage());
            return null;
        }
    }

    static String remoteAddress(String forwardedFor, HttpServerRequest request) {
        if (forwardedFor != null && !forwardedFor.isBlank()) {
            return forwardedFor.split(",")[0].trim();
        }
        if (request != null && request.remoteAddress() != null) {
            return request.remoteAddress().host();
        }
        return UNKNOWN_ADDRESS;
    }
}
