package com.e2eq.apiversion.negotiation;

import com.fasterxml.jackson.databind.JsonNode;

/** Encoded response body together with the version it was encoded in. */
public record VersionedResponse(ResolvedVersion version, JsonNode body) {

    public String apiVersion() {
        return version.apiVersion();
    }
}
