package com.e2eq.apiversion.runtime;

import com.e2eq.apiversion.catalog.TypeCatalog;
import com.e2eq.apiversion.config.ApiConfig;
import com.e2eq.apiversion.config.ApiConfigLoader;
import com.e2eq.apiversion.conversion.ConverterRegistry;
import com.e2eq.apiversion.exceptions.ConfigException;
import com.e2eq.apiversion.negotiation.VersionNegotiator;
import com.e2eq.apiversion.negotiation.VersionedRequestPipeline;
import com.e2eq.apiversion.registry.SchemaVersionRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Loads {@code apis.yaml} from the classpath at startup, runs {@link ApiVersioningBootstrap} and
 * exposes the result for injection. A broken configuration or an unmappable version fails
 * application startup.
 */
@Startup
@ApplicationScoped
public class ApiVersioningProducer {

    private final ObjectMapper objectMapper;
    private final String configLocation;
    private final boolean strictRequiredFields;
    private final Optional<List<String>> sourceDirs;

    private ApiVersioning versioning;

    @Inject
    public ApiVersioningProducer(ObjectMapper objectMapper,
                                 @ConfigProperty(name = "quantum.apiversion.config", defaultValue = "apis.yaml")
                                 String configLocation,
                                 @ConfigProperty(name = "quantum.apiversion.strict-required-fields", defaultValue = "false")
                                 boolean strictRequiredFields,
                                 @ConfigProperty(name = "quantum.apiversion.source-dirs")
                                 Optional<List<String>> sourceDirs) {
        this.objectMapper = objectMapper;
        this.configLocation = configLocation;
        this.strictRequiredFields = strictRequiredFields;
        this.sourceDirs = sourceDirs;
    }

    @PostConstruct
    void init() {
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        ApiConfig config;
        try {
            config = new ApiConfigLoader(cl).loadFromClasspath(configLocation);
        } catch (IOException e) {
            throw new ConfigException("Failed to load API configuration from " + configLocation, e);
        }
        ApiVersioningBootstrap bootstrap = ApiVersioningBootstrap.builder()
                .config(config)
                .classLoader(cl)
                .objectMapper(objectMapper)
                .strictRequiredFields(strictRequiredFields);
        sourceDirs.orElse(List.of()).forEach(dir -> bootstrap.sourceDirectory(Path.of(dir)));
        this.versioning = bootstrap.build();
    }

    @Produces
    public ApiVersioning versioning() {
        return versioning;
    }

    @Produces
    public SchemaVersionRegistry registry() {
        return versioning.registry();
    }

    @Produces
    public TypeCatalog catalog() {
        return versioning.catalog();
    }

    @Produces
    public ConverterRegistry converters() {
        return versioning.converters();
    }

    @Produces
    public VersionNegotiator negotiator() {
        return versioning.negotiator();
    }

    @Produces
    public VersionedRequestPipeline pipeline() {
        return versioning.pipeline();
    }
}
