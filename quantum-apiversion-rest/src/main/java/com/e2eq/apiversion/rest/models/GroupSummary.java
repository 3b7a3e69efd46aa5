package com.e2eq.apiversion.rest.models;

import java.util.List;

/** Entry of {@code GET /apis}. */
public record GroupSummary(String name, String preferredVersion, List<String> versions) {

    public GroupSummary {
        versions = versions == null ? List.of() : List.copyOf(versions);
    }
}
