package com.e2eq.apiversion.registry;

import com.e2eq.apiversion.config.ApiConfig;
import com.e2eq.apiversion.config.ApiConfig.GroupConfig;
import com.e2eq.apiversion.config.ApiConfig.MappingConfig;
import com.e2eq.apiversion.config.ApiConfig.ResourceConfig;
import com.e2eq.apiversion.config.ApiConfigValidator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

public final class InMemorySchemaVersionRegistry implements SchemaVersionRegistry {
    private final Map<String, ApiGroup> groups;

    public InMemorySchemaVersionRegistry(List<ApiGroup> groups) {
        Map<String, ApiGroup> byName = new LinkedHashMap<>();
        for (ApiGroup g : groups) byName.put(g.name(), g);
        this.groups = Collections.unmodifiableMap(byName);
    }

    /** Validates {@code config} and builds the registry from it. */
    public static InMemorySchemaVersionRegistry fromConfig(ApiConfig config) {
        ApiConfigValidator.validate(config);
        List<ApiGroup> out = new ArrayList<>();
        for (GroupConfig g : config.groups()) {
            out.add(toGroup(g));
        }
        return new InMemorySchemaVersionRegistry(out);
    }

    public Optional<ApiGroup> group(String name) { return Optional.ofNullable(groups.get(name)); }
    public List<ApiGroup> groups() { return List.copyOf(groups.values()); }

    private static ApiGroup toGroup(GroupConfig g) {
        Map<String, ApiResource> resources = new LinkedHashMap<>();
        for (ResourceConfig r : Optional.ofNullable(g.resources()).orElse(List.of())) {
            Map<String, List<FieldRename>> renames = new LinkedHashMap<>();
            for (Map.Entry<String, MappingConfig> m : Optional.ofNullable(r.mappings()).orElse(Map.of()).entrySet()) {
                List<FieldRename> list = m.getValue() == null || m.getValue().renames() == null ? List.of()
                        : m.getValue().renames().stream()
                        .map(rc -> new FieldRename(rc.from(), rc.to()))
                        .collect(Collectors.toList());
                renames.put(m.getKey(), list);
            }
            resources.put(r.kind(), new ApiResource(r.kind(), renames));
        }

        List<ApiImport> imports = Optional.ofNullable(g.imports()).orElse(List.of()).stream()
                .map(i -> new ApiImport(i.module(), i.tag(),
                        Optional.ofNullable(i.packages()).orElse(List.of()).stream()
                                .map(p -> new ImportPackage(p.path(),
                                        Optional.ofNullable(p.expose()).orElse(List.of()).stream()
                                                .map(e -> new ExposedType(e.kind(), e.specFrom(), e.statusFrom()))
                                                .collect(Collectors.toList())))
                                .collect(Collectors.toList())))
                .collect(Collectors.toList());

        return new ApiGroup(g.name(), g.storageVersion(), g.preferredVersion(), g.versions(),
                g.basePackage(), resources, imports);
    }
}
