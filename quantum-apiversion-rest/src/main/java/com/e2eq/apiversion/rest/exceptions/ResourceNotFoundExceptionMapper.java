package com.e2eq.apiversion.rest.exceptions;

import com.e2eq.apiversion.exceptions.ResourceNotFoundException;
import com.e2eq.apiversion.rest.models.ApiError;
import io.quarkus.logging.Log;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

@Provider
public class ResourceNotFoundExceptionMapper implements ExceptionMapper<ResourceNotFoundException> {
    @Override
    public Response toResponse(ResourceNotFoundException exception) {
        // not found is a client error, keep it out of the error log
        Log.debug(exception.getMessage());

        ApiError error = ApiError.builder().build();
        error.setStatus(Response.Status.NOT_FOUND.getStatusCode());
        error.setStatusMessage(exception.getMessage());
        error.setReasonMessage(String.format("No %s with id %s", exception.getKind(), exception.getUid()));

        return Response.status(Response.Status.NOT_FOUND).entity(error).build();
    }
}
