package com.e2eq.apiversion.conversion;

import com.e2eq.apiversion.registry.ApiVersions;

/**
 * Inspectable result of conversion generation for one spoke.
 */
public record ConversionPlan(ConverterKey key, String hubVersion, SectionPlan spec, SectionPlan status) {

    public boolean isHub() {
        return key.version().equals(hubVersion);
    }

    public String spokeApiVersion() {
        return ApiVersions.format(key.group(), key.version());
    }

    public String hubApiVersion() {
        return ApiVersions.format(key.group(), hubVersion);
    }
}
