package com.e2eq.apiversion.conversion;

import com.e2eq.apiversion.registry.ApiVersions;

/** Identifies one spoke converter: a kind at a version of a group. */
public record ConverterKey(String group, String version, String kind) {

    @Override
    public String toString() {
        return ApiVersions.format(group, version) + ", Kind=" + kind;
    }
}
