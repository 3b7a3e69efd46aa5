package com.e2eq.apiversion.rest.exceptions;

import com.e2eq.apiversion.exceptions.RequestCancelledException;
import com.e2eq.apiversion.rest.models.ApiError;
import io.quarkus.logging.Log;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

@Provider
public class RequestCancelledExceptionMapper implements ExceptionMapper<RequestCancelledException> {
    @Override
    public Response toResponse(RequestCancelledException exception) {
        Log.info(exception.getMessage());

        ApiError error = ApiError.builder().build();
        error.setStatus(Response.Status.SERVICE_UNAVAILABLE.getStatusCode());
        error.setStatusMessage(exception.getMessage());
        error.setReasonMessage("The request was cancelled before it was handled");

        return Response.status(Response.Status.SERVICE_UNAVAILABLE).entity(error).build();
    }
}
