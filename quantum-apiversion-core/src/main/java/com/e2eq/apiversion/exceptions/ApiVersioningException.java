package com.e2eq.apiversion.exceptions;

/**
 * Base type for every failure raised by the API versioning subsystem.
 * <p>
 * Configuration and generation failures ({@link ConfigException}, {@link CatalogLookupException},
 * {@link ConversionGenerationException}) are fatal and block startup. Request scoped failures
 * ({@link RequestVersionException}, {@link RequestDecodeException}) are client errors, and
 * {@link RuntimeConversionException} signals drift between generated converters and configuration.
 * </p>
 */
public class ApiVersioningException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public ApiVersioningException(String message) {
        super(message);
    }

    public ApiVersioningException(String message, Throwable cause) {
        super(message, cause);
    }
}
