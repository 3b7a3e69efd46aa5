package com.e2eq.apiversion.exceptions;

/**
 * Thrown when a request was cancelled before it reached the hub handler.
 */
public class RequestCancelledException extends ApiVersioningException {
    private static final long serialVersionUID = 1L;

    public RequestCancelledException(String message) {
        super(message);
    }
}
