package com.e2eq.apiversion.rest.service;

import com.e2eq.apiversion.registry.SchemaVersionRegistry.ApiGroup;

import java.util.Locale;
import java.util.Optional;

/** Maps kinds to the plural path segment used by the REST surface and back. */
public final class ResourceNames {

    private ResourceNames() {
    }

    public static String plural(String kind) {
        return kind.toLowerCase(Locale.ROOT) + "s";
    }

    public static Optional<String> kindFor(ApiGroup group, String plural) {
        return group.resources().keySet().stream()
                .filter(kind -> plural(kind).equals(plural.toLowerCase(Locale.ROOT)))
                .findFirst();
    }

    /** Storage key of a kind; qualified by group so equal kinds of different groups never collide. */
    public static String storageKind(String group, String kind) {
        return plural(kind) + "." + group;
    }
}
