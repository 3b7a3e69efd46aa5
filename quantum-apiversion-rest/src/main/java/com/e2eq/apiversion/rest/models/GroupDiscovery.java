package com.e2eq.apiversion.rest.models;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Everything a client needs to pick a version of a group: the versions with their stability,
 * the storage (hub) and preferred versions and the kinds served.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GroupDiscovery(
        String name,
        String storageVersion,
        String preferredVersion,
        List<VersionEntry> versions,
        List<KindEntry> resources
) {

    public GroupDiscovery {
        versions = versions == null ? List.of() : List.copyOf(versions);
        resources = resources == null ? List.of() : List.copyOf(resources);
    }

    public record VersionEntry(String version, String apiVersion, String stability, boolean storage) {}

    public record KindEntry(String kind, String plural) {}
}
