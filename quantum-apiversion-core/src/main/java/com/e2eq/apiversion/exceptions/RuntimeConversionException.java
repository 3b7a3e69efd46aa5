package com.e2eq.apiversion.exceptions;

import com.e2eq.apiversion.negotiation.PipelineStage;

/**
 * Thrown when a generated converter fails at request time. This is not expected once generation
 * succeeded and points at drift between configuration and the bound version types.
 */
public class RuntimeConversionException extends ApiVersioningException {
    private static final long serialVersionUID = 1L;

    private final PipelineStage stage;

    public RuntimeConversionException(String message, Throwable cause) {
        super(message, cause);
        this.stage = null;
    }

    public RuntimeConversionException(PipelineStage stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }

    public PipelineStage getStage() {
        return stage;
    }
}
