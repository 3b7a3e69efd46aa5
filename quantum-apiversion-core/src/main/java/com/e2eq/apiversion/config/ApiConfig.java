package com.e2eq.apiversion.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * DTOs mirroring {@code apis.yaml}.
 *
 * <pre>
 * groups:
 *   - name: infra.example.io
 *     storageVersion: v1
 *     preferredVersion: v1
 *     package: com.acme.apis.infra
 *     versions: [v1alpha1, v1beta1, v1]
 *     resources:
 *       - kind: Device
 *         mappings:
 *           v1alpha1:
 *             renames:
 *               - { from: spec.ipAddress, to: spec.ip }
 *     imports:
 *       - module: com.acme:netmodel
 *         tag: 1.4.2
 *         packages:
 *           - path: com.acme.netmodel
 *             expose:
 *               - { kind: Device, specFrom: com.acme.netmodel.DeviceSpec, statusFrom: com.acme.netmodel.DeviceStatus }
 * </pre>
 */
public record ApiConfig(List<GroupConfig> groups) {

    public record GroupConfig(
            String name,
            String storageVersion,
            String preferredVersion,
            @JsonProperty("package") String basePackage,
            List<String> versions,
            List<ResourceConfig> resources,
            List<ImportConfig> imports
    ) {}

    public record ResourceConfig(String kind, Map<String, MappingConfig> mappings) {}

    public record MappingConfig(List<RenameConfig> renames) {}

    /** {@code from} names the spoke field, {@code to} the hub field. */
    public record RenameConfig(String from, String to) {}

    public record ImportConfig(String module, String tag, List<ImportPackageConfig> packages) {}

    public record ImportPackageConfig(String path, List<ExposeConfig> expose) {}

    public record ExposeConfig(String kind, String specFrom, String statusFrom) {}
}
