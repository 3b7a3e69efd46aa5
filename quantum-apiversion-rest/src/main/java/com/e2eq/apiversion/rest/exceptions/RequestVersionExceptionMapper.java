package com.e2eq.apiversion.rest.exceptions;

import com.e2eq.apiversion.exceptions.RequestVersionException;
import com.e2eq.apiversion.rest.models.ApiError;
import io.quarkus.logging.Log;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

/**
 * A version asked for in the Accept header that the group does not serve is 406; one named in the
 * body is 400; an unknown group is 404. The supported versions are listed in every case.
 */
@Provider
public class RequestVersionExceptionMapper implements ExceptionMapper<RequestVersionException> {
    @Override
    public Response toResponse(RequestVersionException exception) {
        Log.debugf("Rejected version %s for group %s: %s", exception.getRequestedVersion(),
                exception.getGroup(), exception.getMessage());

        Response.Status status = switch (exception.getSource()) {
            case ACCEPT_HEADER -> Response.Status.NOT_ACCEPTABLE;
            case BODY -> Response.Status.BAD_REQUEST;
            case DEFAULT -> Response.Status.NOT_FOUND;
        };

        ApiError error = ApiError.builder().build();
        error.setStatus(status.getStatusCode());
        error.setStatusMessage(exception.getMessage());
        error.setReasonMessage(String.format("Version %s is not served by %s", exception.getRequestedVersion(),
                exception.getGroup()));
        error.setGroup(exception.getGroup());
        error.setRequestedVersion(exception.getRequestedVersion());
        error.setSupportedVersions(exception.getSupportedVersions());

        return Response.status(status).entity(error).build();
    }
}
