package com.e2eq.apiversion.exceptions;

/**
 * Thrown when a request payload is not valid JSON or does not fit the resolved spoke type.
 */
public class RequestDecodeException extends ApiVersioningException {
    private static final long serialVersionUID = 1L;

    public RequestDecodeException(String message) {
        super(message);
    }

    public RequestDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
