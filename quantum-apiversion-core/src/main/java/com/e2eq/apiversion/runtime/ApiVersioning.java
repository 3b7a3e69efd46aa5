package com.e2eq.apiversion.runtime;

import com.e2eq.apiversion.catalog.TypeCatalog;
import com.e2eq.apiversion.conversion.ConverterRegistry;
import com.e2eq.apiversion.negotiation.VersionNegotiator;
import com.e2eq.apiversion.negotiation.VersionedRequestPipeline;
import com.e2eq.apiversion.registry.SchemaVersionRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Everything bootstrap produced. All parts are immutable and shared.
 */
public record ApiVersioning(SchemaVersionRegistry registry,
                            TypeCatalog catalog,
                            ConverterRegistry converters,
                            VersionNegotiator negotiator,
                            VersionedRequestPipeline pipeline,
                            ObjectMapper objectMapper) {
}
