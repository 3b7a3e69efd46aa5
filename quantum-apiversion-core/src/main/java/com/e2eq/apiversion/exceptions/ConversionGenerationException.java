package com.e2eq.apiversion.exceptions;

/**
 * Thrown while building conversions when two matched fields disagree on their declared type,
 * when a rename override names a field that does not exist, or when strict required field
 * checking finds a hub field no spoke field can populate.
 */
public class ConversionGenerationException extends ApiVersioningException {
    private static final long serialVersionUID = 1L;

    public ConversionGenerationException(String message) {
        super(message);
    }

    public ConversionGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
