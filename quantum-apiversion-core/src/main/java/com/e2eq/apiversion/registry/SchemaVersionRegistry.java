package com.e2eq.apiversion.registry;

import com.e2eq.apiversion.catalog.TypeKey;
import com.e2eq.apiversion.config.ApiConfig;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only view of the configured API groups, their hub and spoke versions, resource kinds and
 * rename overrides. Implementations are immutable once built and safe to share.
 */
public interface SchemaVersionRegistry {

    Optional<ApiGroup> group(String name);

    List<ApiGroup> groups();

    /** The group when it exists and, if {@code version} is given, supports that version. */
    default Optional<ApiGroup> resolve(String groupName, String version) {
        return group(groupName).filter(g -> version == null || version.isEmpty() || g.supports(version));
    }

    default boolean isVersionSupported(String groupName, String version) {
        return group(groupName).map(g -> g.supports(version)).orElse(false);
    }

    default Optional<String> storageVersion(String groupName) {
        return group(groupName).map(ApiGroup::storageVersion);
    }

    default Optional<String> preferredVersion(String groupName) {
        return group(groupName).map(ApiGroup::preferredVersion);
    }

    default Optional<ApiResource> resource(String groupName, String kind) {
        return group(groupName).flatMap(g -> g.resource(kind));
    }

    default List<String> listVersions(String groupName) {
        return group(groupName).map(ApiGroup::versions).orElse(List.of());
    }

    static SchemaVersionRegistry fromConfig(ApiConfig config) {
        return InMemorySchemaVersionRegistry.fromConfig(config);
    }

    record ApiGroup(String name,
                    String storageVersion,
                    String preferredVersion,
                    List<String> versions,
                    String basePackage,
                    Map<String, ApiResource> resources,
                    List<ApiImport> imports) {

        public ApiGroup {
            versions = List.copyOf(versions);
            resources = resources == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(resources));
            imports = imports == null ? List.of() : List.copyOf(imports);
            preferredVersion = preferredVersion == null || preferredVersion.isEmpty() ? storageVersion : preferredVersion;
        }

        public boolean supports(String version) {
            return versions.contains(version);
        }

        public boolean isHub(String version) {
            return storageVersion.equals(version);
        }

        public Optional<ApiResource> resource(String kind) {
            return Optional.ofNullable(resources.get(kind));
        }

        /** {@code group/version} for one of this group's versions. */
        public String apiVersion(String version) {
            return ApiVersions.format(name, version);
        }

        /** The package holding a version's local types: {@code <basePackage>.<version>}. */
        public String versionPackage(String version) {
            return basePackage + "." + version;
        }

        /** The imported types exposed for {@code kind}, if any import declares it. */
        public Optional<ExposedImport> exposedImport(String kind) {
            for (ApiImport imp : imports) {
                for (ImportPackage pkg : imp.packages()) {
                    for (ExposedType exp : pkg.exposedTypes()) {
                        if (exp.kind().equals(kind)) {
                            return Optional.of(new ExposedImport(imp, pkg, exp));
                        }
                    }
                }
            }
            return Optional.empty();
        }
    }

    record ApiResource(String kind, Map<String, List<FieldRename>> renamesByVersion) {
        public ApiResource {
            renamesByVersion = renamesByVersion == null ? Map.of() : Map.copyOf(renamesByVersion);
        }

        public List<FieldRename> renames(String version) {
            return renamesByVersion.getOrDefault(version, List.of());
        }
    }

    /**
     * A rename override: {@code from} is the spoke field, {@code to} the hub field. Either side may
     * carry a {@code spec.} or {@code status.} prefix; without one the field belongs to spec.
     */
    record FieldRename(String from, String to) {
        public FieldPath fromPath() {
            return FieldPath.parse(from);
        }

        public FieldPath toPath() {
            return FieldPath.parse(to);
        }
    }

    record FieldPath(String section, String field) {
        public static final String SPEC = "spec";
        public static final String STATUS = "status";

        public static FieldPath parse(String path) {
            if (path.startsWith(SPEC + ".")) return new FieldPath(SPEC, path.substring(SPEC.length() + 1));
            if (path.startsWith(STATUS + ".")) return new FieldPath(STATUS, path.substring(STATUS.length() + 1));
            return new FieldPath(SPEC, path);
        }
    }

    record ApiImport(String modulePath, String versionTag, List<ImportPackage> packages) {
        public ApiImport {
            packages = packages == null ? List.of() : List.copyOf(packages);
        }
    }

    record ImportPackage(String path, List<ExposedType> exposedTypes) {
        public ImportPackage {
            exposedTypes = exposedTypes == null ? List.of() : List.copyOf(exposedTypes);
        }
    }

    /** Names the imported spec and status types a kind's hub is built from. */
    record ExposedType(String kind, String specFrom, String statusFrom) {
        public Optional<TypeKey> specKey(String packagePath) {
            return keyOf(specFrom, packagePath);
        }

        public Optional<TypeKey> statusKey(String packagePath) {
            return keyOf(statusFrom, packagePath);
        }

        private static Optional<TypeKey> keyOf(String ref, String packagePath) {
            if (ref == null || ref.isBlank()) return Optional.empty();
            TypeKey parsed = TypeKey.parse(ref);
            // bare or nested names such as NetDeviceSpec or NetDevice.Spec live in the import package
            return Optional.of(parsed.packagePath().isEmpty() ? new TypeKey(packagePath, parsed.typeName()) : parsed);
        }
    }

    record ExposedImport(ApiImport module, ImportPackage pkg, ExposedType type) {}
}
