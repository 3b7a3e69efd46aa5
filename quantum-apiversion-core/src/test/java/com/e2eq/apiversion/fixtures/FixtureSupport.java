package com.e2eq.apiversion.fixtures;

import com.e2eq.apiversion.catalog.TypeCatalog;
import com.e2eq.apiversion.config.ApiConfig;
import com.e2eq.apiversion.config.ApiConfigLoader;
import com.e2eq.apiversion.conversion.ConverterKey;
import com.e2eq.apiversion.conversion.ResourceBinding;
import com.e2eq.apiversion.model.VersionedResource;
import com.e2eq.apiversion.registry.SchemaVersionRegistry;
import com.e2eq.apiversion.registry.SchemaVersionRegistry.ApiGroup;
import com.e2eq.apiversion.registry.SchemaVersionRegistry.ApiResource;
import com.e2eq.apiversion.runtime.ApiVersioning;
import com.e2eq.apiversion.runtime.ApiVersioningBootstrap;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.Map;

/** Shared setup for tests built on {@code apis-test.yaml}. */
public final class FixtureSupport {
    private FixtureSupport() {}

    public static ApiConfig config() {
        try {
            return new ApiConfigLoader().loadFromClasspath("apis-test.yaml");
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static ApiVersioning bootstrap() {
        return ApiVersioningBootstrap.builder().config(config()).build();
    }

    /** Bindings by package convention, with every spec and status class reflected into {@code catalog}. */
    @SuppressWarnings("unchecked")
    public static Map<ConverterKey, ResourceBinding> bind(SchemaVersionRegistry registry, TypeCatalog catalog) {
        Map<ConverterKey, ResourceBinding> bindings = new LinkedHashMap<>();
        for (ApiGroup group : registry.groups()) {
            for (ApiResource resource : group.resources().values()) {
                for (String version : group.versions()) {
                    String className = group.versionPackage(version) + "." + resource.kind();
                    Class<? extends VersionedResource<?, ?>> cls;
                    try {
                        cls = (Class<? extends VersionedResource<?, ?>>) Class.forName(className);
                    } catch (ClassNotFoundException e) {
                        throw new IllegalStateException(className, e);
                    }
                    ResourceBinding binding = ResourceBinding.of(group.name(), version, resource.kind(), cls);
                    catalog.registerClass(binding.specType());
                    catalog.registerClass(binding.statusType());
                    bindings.put(binding.key(), binding);
                }
            }
        }
        return bindings;
    }
}
