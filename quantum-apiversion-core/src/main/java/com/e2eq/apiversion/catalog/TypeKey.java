package com.e2eq.apiversion.catalog;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Catalog key. Types are always addressed by package and type name together so that two
 * same-named types from different packages never collide. Nested types carry their enclosing
 * types in the name ({@code Device.Spec}), so {@code Device.Spec} and {@code Switch.Spec} of one
 * package are different keys.
 */
public record TypeKey(String packagePath, String typeName) {

    public TypeKey {
        packagePath = packagePath == null ? "" : packagePath;
        Objects.requireNonNull(typeName, "typeName");
    }

    public static TypeKey of(Class<?> type) {
        return new TypeKey(type.getPackageName(), nestedName(type));
    }

    /**
     * Name of a class inside its package: {@code Device} for a top level class,
     * {@code Device.Spec} for a member class. Local and anonymous classes fall back to the simple
     * name.
     */
    public static String nestedName(Class<?> type) {
        String canonical = type.getCanonicalName();
        if (canonical == null) {
            return type.getSimpleName();
        }
        String pkg = type.getPackageName();
        return pkg.isEmpty() ? canonical : canonical.substring(pkg.length() + 1);
    }

    /**
     * Splits a qualified name such as {@code com.acme.netmodel.DeviceSpec} or
     * {@code com.acme.netmodel.Device.Spec}. The package ends before the first segment that starts
     * with an upper case letter; without one the last segment is the type.
     */
    public static TypeKey parse(String qualifiedName) {
        List<String> segments = Arrays.asList(qualifiedName.split("\\."));
        for (int i = 0; i < segments.size(); i++) {
            String segment = segments.get(i);
            if (!segment.isEmpty() && Character.isUpperCase(segment.charAt(0))) {
                return new TypeKey(String.join(".", segments.subList(0, i)),
                        String.join(".", segments.subList(i, segments.size())));
            }
        }
        int idx = qualifiedName.lastIndexOf('.');
        if (idx < 0) {
            return new TypeKey("", qualifiedName);
        }
        return new TypeKey(qualifiedName.substring(0, idx), qualifiedName.substring(idx + 1));
    }

    public String qualifiedName() {
        return packagePath.isEmpty() ? typeName : packagePath + "." + typeName;
    }

    @Override
    public String toString() {
        return qualifiedName();
    }
}
