package com.e2eq.apiversion.runtime;

import com.e2eq.apiversion.catalog.ReflectiveTypeIntrospector;
import com.e2eq.apiversion.catalog.TypeCatalog;
import com.e2eq.apiversion.catalog.TypeKey;
import com.e2eq.apiversion.config.ApiConfig;
import com.e2eq.apiversion.conversion.ConversionGenerator;
import com.e2eq.apiversion.conversion.ConverterKey;
import com.e2eq.apiversion.conversion.ConverterRegistry;
import com.e2eq.apiversion.conversion.ResourceBinding;
import com.e2eq.apiversion.exceptions.CatalogLookupException;
import com.e2eq.apiversion.model.VersionedResource;
import com.e2eq.apiversion.negotiation.VersionNegotiator;
import com.e2eq.apiversion.negotiation.VersionedRequestPipeline;
import com.e2eq.apiversion.registry.InMemorySchemaVersionRegistry;
import com.e2eq.apiversion.registry.SchemaVersionRegistry;
import com.e2eq.apiversion.registry.SchemaVersionRegistry.ApiGroup;
import com.e2eq.apiversion.registry.SchemaVersionRegistry.ApiImport;
import com.e2eq.apiversion.registry.SchemaVersionRegistry.ApiResource;
import com.e2eq.apiversion.registry.SchemaVersionRegistry.ExposedImport;
import com.e2eq.apiversion.registry.SchemaVersionRegistry.ImportPackage;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Single threaded startup sequence: validate the configuration, build the registry, fill and
 * freeze the type catalog, bind version classes and generate every converter. Any failure
 * aborts startup.
 * <p>
 * Version classes are found by convention as {@code <package>.<version>.<Kind>} unless bound
 * explicitly with {@link #bind}.
 * </p>
 */
public final class ApiVersioningBootstrap {

    private static final Logger LOG = Logger.getLogger(ApiVersioningBootstrap.class);

    private ApiConfig config;
    private ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
    private ObjectMapper objectMapper;
    private boolean strictRequiredFields;
    private final List<Path> sourceDirectories = new ArrayList<>();
    private final Map<ConverterKey, Class<? extends VersionedResource<?, ?>>> explicitBindings = new LinkedHashMap<>();
    private final ReflectiveTypeIntrospector introspector = new ReflectiveTypeIntrospector();

    private ApiVersioningBootstrap() {}

    public static ApiVersioningBootstrap builder() {
        return new ApiVersioningBootstrap();
    }

    public ApiVersioningBootstrap config(ApiConfig config) {
        this.config = config;
        return this;
    }

    public ApiVersioningBootstrap classLoader(ClassLoader classLoader) {
        this.classLoader = classLoader;
        return this;
    }

    public ApiVersioningBootstrap objectMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        return this;
    }

    public ApiVersioningBootstrap strictRequiredFields(boolean strict) {
        this.strictRequiredFields = strict;
        return this;
    }

    /** A directory of {@code .java} sources to catalog, scanned recursively. */
    public ApiVersioningBootstrap sourceDirectory(Path dir) {
        this.sourceDirectories.add(dir);
        return this;
    }

    public ApiVersioningBootstrap bind(String group, String version, String kind,
                                       Class<? extends VersionedResource<?, ?>> envelopeType) {
        explicitBindings.put(new ConverterKey(group, version, kind), envelopeType);
        return this;
    }

    public ApiVersioning build() {
        Objects.requireNonNull(config, "config");
        SchemaVersionRegistry registry = InMemorySchemaVersionRegistry.fromConfig(config);
        ObjectMapper mapper = objectMapper != null ? objectMapper : ObjectMappers.create();

        TypeCatalog catalog = new TypeCatalog();
        for (Path dir : sourceDirectories) {
            try {
                catalog.loadFromDirectory(dir);
            } catch (IOException e) {
                throw new CatalogLookupException("cannot scan source directory " + dir, e);
            }
        }

        Map<ConverterKey, ResourceBinding> bindings = new LinkedHashMap<>();
        for (ApiGroup group : registry.groups()) {
            for (ApiImport imp : group.imports()) {
                catalog.addModule(imp.modulePath(), imp.versionTag());
            }
            for (ApiResource resource : group.resources().values()) {
                for (String version : group.versions()) {
                    ResourceBinding binding = ResourceBinding.of(group.name(), version, resource.kind(),
                            envelopeClass(group, version, resource.kind()));
                    catalogSection(catalog, group, binding, binding.specType(), true);
                    catalogSection(catalog, group, binding, binding.statusType(), false);
                    bindings.put(binding.key(), binding);
                }
            }
        }

        ConverterRegistry converters = new ConversionGenerator(catalog, strictRequiredFields, mapper)
                .generateAll(registry, bindings);
        catalog.freeze();

        VersionNegotiator negotiator = new VersionNegotiator(registry);
        VersionedRequestPipeline pipeline = new VersionedRequestPipeline(registry, negotiator, converters, mapper);
        LOG.infof("API versioning ready: %d groups, %d converters", registry.groups().size(), converters.size());
        return new ApiVersioning(registry, catalog, converters, negotiator, pipeline, mapper);
    }

    @SuppressWarnings("unchecked")
    private Class<? extends VersionedResource<?, ?>> envelopeClass(ApiGroup group, String version, String kind) {
        Class<? extends VersionedResource<?, ?>> bound = explicitBindings.get(new ConverterKey(group.name(), version, kind));
        if (bound != null) {
            return bound;
        }
        String className = group.versionPackage(version) + "." + kind;
        Class<?> cls;
        try {
            cls = Class.forName(className, true, classLoader);
        } catch (ClassNotFoundException e) {
            throw new CatalogLookupException(String.format("%s %s %s: expected class %s was not found",
                    group.name(), version, kind, className), e);
        }
        if (!VersionedResource.class.isAssignableFrom(cls)) {
            throw new CatalogLookupException(className + " does not extend " + VersionedResource.class.getSimpleName());
        }
        return (Class<? extends VersionedResource<?, ?>>) cls;
    }

    /**
     * Makes sure the catalog knows a spec or status type and the local or imported types its
     * fields are built from. Local types are reflected directly; anything else must come from a
     * pinned import or from a scanned source directory.
     */
    private void catalogSection(TypeCatalog catalog, ApiGroup group, ResourceBinding binding, Class<?> type,
                                boolean spec) {
        TypeKey key = TypeKey.of(type);
        if (group.isHub(binding.version())) {
            Optional<ExposedImport> exposed = group.exposedImport(binding.kind());
            if (exposed.isPresent()) {
                ExposedImport ei = exposed.get();
                Optional<TypeKey> declared = spec ? ei.type().specKey(ei.pkg().path()) : ei.type().statusKey(ei.pkg().path());
                if (declared.isPresent()) {
                    if (!declared.get().equals(key)) {
                        throw new CatalogLookupException(key.packagePath(), key.typeName(), String.format(
                                "hub %s of %s uses %s but the import of %s exposes %s",
                                spec ? "spec" : "status", binding.key(), key, ei.module().modulePath(), declared.get()));
                    }
                    catalog.registerImportedClass(ei.module().modulePath(), type);
                    catalogNested(catalog, group, type, new HashSet<>());
                    return;
                }
            }
        }

        if (!registerKnown(catalog, group, type)) {
            // neither local nor imported: only a scanned source directory can provide it
            catalog.getTypeInfo(key);
        }
        catalogNested(catalog, group, type, new HashSet<>());
    }

    // nested values are copied whole, so the generator compares their shapes too
    private void catalogNested(TypeCatalog catalog, ApiGroup group, Class<?> type, Set<Class<?>> seen) {
        if (!seen.add(type)) {
            return;
        }
        for (Class<?> nested : introspector.referencedTypes(type)) {
            TypeKey key = TypeKey.of(nested);
            if (catalog.contains(key.packagePath(), key.typeName()) || registerKnown(catalog, group, nested)) {
                catalogNested(catalog, group, nested, seen);
            } else {
                LOG.debugf("%s is neither local nor imported; matched by name only", nested.getName());
            }
        }
    }

    private static boolean registerKnown(TypeCatalog catalog, ApiGroup group, Class<?> type) {
        String pkgName = type.getPackageName();
        String base = group.basePackage();
        if (base != null && (pkgName.equals(base) || pkgName.startsWith(base + "."))) {
            catalog.registerClass(type);
            return true;
        }
        for (ApiImport imp : group.imports()) {
            for (ImportPackage pkg : imp.packages()) {
                if (pkg.path().equals(pkgName)) {
                    catalog.registerImportedClass(imp.modulePath(), type);
                    return true;
                }
            }
        }
        return false;
    }
}
