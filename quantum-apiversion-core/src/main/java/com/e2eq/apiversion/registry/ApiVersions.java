package com.e2eq.apiversion.registry;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Helpers for version strings ({@code v1}, {@code v1alpha1}, {@code v2beta3}) and
 * {@code group/version} apiVersion values.
 */
public final class ApiVersions {

    private static final Pattern VERSION = Pattern.compile("^v[0-9]+(?:alpha[0-9]+|beta[0-9]+)?$");

    public enum Stability {
        ALPHA, BETA, STABLE;

        public String label() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    /** A parsed apiVersion. {@code group} is empty when only a bare version was given. */
    public record GroupVersion(String group, String version) {
        public boolean hasGroup() {
            return !group.isEmpty();
        }

        @Override
        public String toString() {
            return format(group, version);
        }
    }

    private ApiVersions() {}

    public static boolean isValidVersion(String version) {
        return version != null && VERSION.matcher(version).matches();
    }

    public static Stability stability(String version) {
        if (version.contains("alpha")) return Stability.ALPHA;
        if (version.contains("beta")) return Stability.BETA;
        return Stability.STABLE;
    }

    public static String format(String group, String version) {
        return group == null || group.isEmpty() ? version : group + "/" + version;
    }

    /**
     * Splits {@code infra.example.io/v1beta1} at its last slash. A value without a slash is
     * treated as a bare version.
     */
    public static GroupVersion parse(String apiVersion) {
        String value = apiVersion == null ? "" : apiVersion.trim();
        int idx = value.lastIndexOf('/');
        if (idx < 0) {
            return new GroupVersion("", value);
        }
        return new GroupVersion(value.substring(0, idx), value.substring(idx + 1));
    }
}
