package com.e2eq.apiversion.rest.exceptions;

import com.e2eq.apiversion.exceptions.RequestDecodeException;
import com.e2eq.apiversion.rest.models.ApiError;
import io.quarkus.logging.Log;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

@Provider
public class RequestDecodeExceptionMapper implements ExceptionMapper<RequestDecodeException> {
    @Override
    public Response toResponse(RequestDecodeException exception) {
        Log.debugf("Request body rejected: %s", exception.getMessage());

        ApiError error = ApiError.builder().build();
        error.setStatus(Response.Status.BAD_REQUEST.getStatusCode());
        error.setStatusMessage(exception.getMessage());
        error.setReasonMessage("The request body could not be decoded for the requested version");

        return Response.status(Response.Status.BAD_REQUEST).entity(error).build();
    }
}
