package com.e2eq.apiversion.negotiation;

import com.e2eq.apiversion.registry.ApiVersions;

public record ResolvedVersion(String group, String version, VersionSource source) {

    public String apiVersion() {
        return ApiVersions.format(group, version);
    }
}
