package com.e2eq.apiversion.rest.exceptions;

import com.e2eq.apiversion.exceptions.RuntimeConversionException;
import com.e2eq.apiversion.rest.models.ApiError;
import io.quarkus.logging.Log;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

/**
 * Conversion failures after startup mean generated converters and configuration drifted apart.
 * Details go to the log only; the client gets a generic message.
 */
@Provider
public class RuntimeConversionExceptionMapper implements ExceptionMapper<RuntimeConversionException> {
    @Override
    public Response toResponse(RuntimeConversionException exception) {
        Log.errorf(exception, "Conversion failed at stage %s", exception.getStage());

        ApiError error = ApiError.builder().build();
        error.setStatus(Response.Status.INTERNAL_SERVER_ERROR.getStatusCode());
        error.setStatusMessage("Internal conversion error");
        error.setReasonMessage("The resource could not be converted between API versions");

        return Response.status(Response.Status.INTERNAL_SERVER_ERROR).entity(error).build();
    }
}
