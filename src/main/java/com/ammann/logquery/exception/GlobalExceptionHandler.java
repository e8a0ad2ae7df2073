/* (C)2026 */
package com.ammann.logquery.exception;

import com.ammann.logquery.dto.ErrorResponseDTO;
import com.ammann.logquery.properties.ApiProperties;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

/**
 * Global JAX-RS exception mapper that translates exceptions escaping a resource into the
 * {@code {"error": ...}} body used by the query endpoints.
 *
 * <p>Validation failures map to 400, query and encoding failures to 500. Unhandled exceptions
 * are logged at ERROR level and returned as HTTP 500 without internal details. Error bodies are
 * never compressed.
 */
@Provider
public class GlobalExceptionHandler implements ExceptionMapper<Exception>
{
    private static final Logger LOG = Logger.getLogger(GlobalExceptionHandler.class);

    @Context
    UriInfo uriInfo;

    @Override
    public Response toResponse(Exception exception)
    {
        String path = uriInfo != null ? uriInfo.getPath() : null;

        if (exception instanceof ValidationException) {
            LOG.debugf("Validation failed for path %s: %s", path, exception.getMessage());
            return createResponse(Response.Status.BAD_REQUEST, exception.getMessage());
        }

        if (exception instanceof QueryExecutionException queryFailure) {
            if (queryFailure.getStatement() != null) {
                LOG.errorf(exception, "Query failed for path %s: %s params=%s", path,
                        queryFailure.getStatement().sql(), queryFailure.getStatement().parameters());
            } else {
                LOG.errorf(exception, "Query failed for path %s", path);
            }
            return createResponse(Response.Status.INTERNAL_SERVER_ERROR, exception.getMessage());
        }

        if (exception instanceof NotFoundException) {
            return createResponse(Response.Status.NOT_FOUND, exception.getMessage());
        }

        if (exception instanceof WebApplicationException webFailure) {
            Response.StatusType status = webFailure.getResponse().getStatusInfo();
            return createResponse(status.getStatusCode(), exception.getMessage());
        }

        if (exception instanceof ApiException) {
            LOG.errorf(exception, "Request failed for path %s", path);
            return createResponse(Response.Status.INTERNAL_SERVER_ERROR, exception.getMessage());
        }

        LOG.error("Unhandled exception: " + exception.getClass().getSimpleName(), exception);
        return createResponse(
                Response.Status.INTERNAL_SERVER_ERROR,
                "An unexpected error occurred");
    }

    private Response createResponse(Response.Status status, String message)
    {
        return createResponse(status.getStatusCode(), message);
    }

    private Response createResponse(int status, String message)
    {
        return Response.status(status)
                .type(MediaType.APPLICATION_JSON_TYPE)
                .header(ApiProperties.COMPRESSION_HEADER, "false")
                .entity(new ErrorResponseDTO(message))
                .build();
    }
}
