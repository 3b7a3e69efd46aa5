package com.e2eq.apiversion.config;

import com.e2eq.apiversion.catalog.TypeKey;
import com.e2eq.apiversion.config.ApiConfig.ExposeConfig;
import com.e2eq.apiversion.config.ApiConfig.GroupConfig;
import com.e2eq.apiversion.config.ApiConfig.ImportConfig;
import com.e2eq.apiversion.config.ApiConfig.ImportPackageConfig;
import com.e2eq.apiversion.config.ApiConfig.MappingConfig;
import com.e2eq.apiversion.config.ApiConfig.RenameConfig;
import com.e2eq.apiversion.config.ApiConfig.ResourceConfig;
import com.e2eq.apiversion.exceptions.ConfigException;
import com.e2eq.apiversion.registry.ApiVersions;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * All-or-nothing validation of an {@link ApiConfig}. The first violation found is thrown as a
 * {@link ConfigException} naming the group by index and name.
 */
public final class ApiConfigValidator {
    private ApiConfigValidator() {}

    public static void validate(ApiConfig config) {
        if (config == null || config.groups() == null || config.groups().isEmpty()) {
            throw new ConfigException("at least one API group must be defined");
        }

        // structural checks for every group first
        List<GroupConfig> groups = config.groups();
        for (int i = 0; i < groups.size(); i++) {
            GroupConfig g = groups.get(i);
            if (g == null) {
                throw new ConfigException(i, null, "group entry is empty");
            }
            require(!isBlank(g.name()), i, g, "name is required");
            require(!isBlank(g.storageVersion()), i, g, "storageVersion is required");
            require(g.versions() != null && !g.versions().isEmpty(), i, g, "at least one version is required");
            require(g.versions().contains(g.storageVersion()), i, g,
                    "storageVersion " + g.storageVersion() + " must be listed in versions " + g.versions());
        }

        Set<String> groupNames = new HashSet<>();
        for (int i = 0; i < groups.size(); i++) {
            GroupConfig g = groups.get(i);
            validateVersions(i, g);
            require(groupNames.add(g.name()), i, g, "duplicate group name");
            if (!isBlank(g.preferredVersion())) {
                require(g.versions().contains(g.preferredVersion()), i, g,
                        "preferredVersion " + g.preferredVersion() + " must be listed in versions " + g.versions());
            }
            validateResources(i, g);
            validateImports(i, g);
        }
    }

    private static void validateVersions(int i, GroupConfig g) {
        Set<String> seen = new HashSet<>();
        for (String v : g.versions()) {
            require(ApiVersions.isValidVersion(v), i, g,
                    "invalid version format '" + v + "' (expected v1, v1alpha1, v1beta1, ...)");
            require(seen.add(v), i, g, "duplicate version " + v);
        }
    }

    private static void validateResources(int i, GroupConfig g) {
        List<ResourceConfig> resources = Optional.ofNullable(g.resources()).orElse(List.of());
        if (resources.isEmpty()) return;
        require(!isBlank(g.basePackage()), i, g, "package is required when resources are declared");

        Set<String> kinds = new HashSet<>();
        for (ResourceConfig r : resources) {
            require(r != null && !isBlank(r.kind()), i, g, "resource kind is required");
            require(kinds.add(r.kind()), i, g, "duplicate resource kind " + r.kind());
            Map<String, MappingConfig> mappings = Optional.ofNullable(r.mappings()).orElse(Map.of());
            for (Map.Entry<String, MappingConfig> m : mappings.entrySet()) {
                require(g.versions().contains(m.getKey()), i, g,
                        "mappings for " + r.kind() + " name undeclared version " + m.getKey());
                List<RenameConfig> renames = m.getValue() == null || m.getValue().renames() == null
                        ? List.of() : m.getValue().renames();
                for (RenameConfig rename : renames) {
                    require(rename != null && !isBlank(rename.from()) && !isBlank(rename.to()), i, g,
                            "rename for " + r.kind() + " " + m.getKey() + " needs both from and to");
                }
            }
        }
    }

    private static void validateImports(int i, GroupConfig g) {
        List<ImportConfig> imports = Optional.ofNullable(g.imports()).orElse(List.of());
        Set<String> kinds = new HashSet<>();
        Optional.ofNullable(g.resources()).orElse(List.of()).forEach(r -> kinds.add(r.kind()));

        for (ImportConfig imp : imports) {
            require(imp != null && !isBlank(imp.module()), i, g, "import module is required");
            require(!isBlank(imp.tag()), i, g, "import " + imp.module() + " needs a version tag");
            for (ImportPackageConfig pkg : Optional.ofNullable(imp.packages()).orElse(List.of())) {
                require(pkg != null && !isBlank(pkg.path()), i, g, "import " + imp.module() + " has a package without path");
                for (ExposeConfig exp : Optional.ofNullable(pkg.expose()).orElse(List.of())) {
                    require(exp != null && !isBlank(exp.kind()), i, g, "exposed type in " + pkg.path() + " needs a kind");
                    require(kinds.contains(exp.kind()), i, g,
                            "exposed kind " + exp.kind() + " is not a declared resource");
                    requireInside(exp.specFrom(), pkg.path(), i, g, "specFrom");
                    requireInside(exp.statusFrom(), pkg.path(), i, g, "statusFrom");
                }
            }
        }
    }

    private static void requireInside(String typeRef, String path, int i, GroupConfig g, String what) {
        if (isBlank(typeRef)) return;
        String pkg = TypeKey.parse(typeRef).packagePath();
        require(pkg.isEmpty() || pkg.equals(path), i, g,
                what + " " + typeRef + " is not inside imported package " + path);
    }

    private static void require(boolean cond, int index, GroupConfig g, String msg) {
        if (!cond) throw new ConfigException(index, g == null ? null : g.name(), msg);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
