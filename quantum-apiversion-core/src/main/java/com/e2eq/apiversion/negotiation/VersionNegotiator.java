package com.e2eq.apiversion.negotiation;

import com.e2eq.apiversion.exceptions.RequestVersionException;
import com.e2eq.apiversion.registry.ApiVersions;
import com.e2eq.apiversion.registry.ApiVersions.GroupVersion;
import com.e2eq.apiversion.registry.SchemaVersionRegistry;
import com.e2eq.apiversion.registry.SchemaVersionRegistry.ApiGroup;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Picks the spoke version a request is served in.
 * <ol>
 *     <li>{@code apiVersion} of the request body, {@code group/version} or a bare version</li>
 *     <li>an {@code api-version} parameter on the Accept header ({@code version} and {@code v} are
 *     accepted as well), for example {@code application/json; api-version="infra.example.io/v1beta1"}</li>
 *     <li>the group's preferred version</li>
 * </ol>
 * A version that is not registered is rejected; there is no fallback to a nearby version.
 */
public final class VersionNegotiator {

    private static final List<String> ACCEPT_PARAMS = List.of("api-version", "version", "v");

    private final SchemaVersionRegistry registry;

    public VersionNegotiator(SchemaVersionRegistry registry) {
        this.registry = registry;
    }

    public ResolvedVersion resolve(String group, String bodyApiVersion, String acceptHeader) {
        ApiGroup g = registry.group(group).orElseThrow(() -> new RequestVersionException(
                group, null, VersionSource.DEFAULT, List.of(), "API group " + group + " is not registered"));

        if (bodyApiVersion != null && !bodyApiVersion.isBlank()) {
            return check(g, bodyApiVersion, VersionSource.BODY);
        }
        Optional<String> requested = acceptedVersion(acceptHeader);
        if (requested.isPresent()) {
            return check(g, requested.get(), VersionSource.ACCEPT_HEADER);
        }
        return new ResolvedVersion(g.name(), g.preferredVersion(), VersionSource.DEFAULT);
    }

    private ResolvedVersion check(ApiGroup g, String requested, VersionSource source) {
        GroupVersion gv = ApiVersions.parse(requested);
        if (gv.hasGroup() && !gv.group().equals(g.name())) {
            throw new RequestVersionException(g.name(), requested, source, g.versions(), String.format(
                    "apiVersion %s belongs to group %s, not %s", requested, gv.group(), g.name()));
        }
        if (!g.supports(gv.version())) {
            throw new RequestVersionException(g.name(), gv.version(), source, g.versions(), String.format(
                    "version %s is not supported by %s; supported versions are %s", gv.version(), g.name(), g.versions()));
        }
        return new ResolvedVersion(g.name(), gv.version(), source);
    }

    /**
     * Extracts the requested version from an Accept header. {@code api-version} wins over
     * {@code version}, which wins over {@code v}.
     */
    static Optional<String> acceptedVersion(String acceptHeader) {
        if (acceptHeader == null || acceptHeader.isBlank()) {
            return Optional.empty();
        }
        String[] found = new String[ACCEPT_PARAMS.size()];
        for (String mediaRange : acceptHeader.split(",")) {
            String[] parts = mediaRange.split(";");
            for (int i = 1; i < parts.length; i++) {
                int eq = parts[i].indexOf('=');
                if (eq < 0) continue;
                String name = parts[i].substring(0, eq).trim().toLowerCase(Locale.ROOT);
                String value = unquote(parts[i].substring(eq + 1).trim());
                int idx = ACCEPT_PARAMS.indexOf(name);
                if (idx >= 0 && found[idx] == null && !value.isEmpty()) {
                    found[idx] = value;
                }
            }
        }
        for (String value : found) {
            if (value != null) return Optional.of(value);
        }
        return Optional.empty();
    }

    private static String unquote(String value) {
        if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
            return value.substring(1, value.length() - 1).trim();
        }
        return value;
    }
}
