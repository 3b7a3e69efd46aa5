package com.e2eq.apiversion.conversion;

import com.e2eq.apiversion.catalog.FieldMeta;
import com.e2eq.apiversion.catalog.TypeCatalog;
import com.e2eq.apiversion.catalog.TypeInfo;
import com.e2eq.apiversion.catalog.TypeKey;
import com.e2eq.apiversion.catalog.TypeNames;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Compares the declared types of two matched fields, looking into named types the catalog
 * knows. Nested values are copied whole, so a catalogued nested type must have the same JSON
 * fields, with compatible types, on both sides. Named types the catalog does not know (JDK value
 * types, enums) match by simple name.
 */
final class NestedTypeMatcher {

    private final TypeCatalog catalog;

    NestedTypeMatcher(TypeCatalog catalog) {
        this.catalog = catalog;
    }

    /**
     * @return why the spoke type cannot be copied into the hub type, or empty when it can
     */
    Optional<String> mismatch(String spokeType, TypeInfo spokeOwner, String hubType, TypeInfo hubOwner) {
        return mismatch(spokeType, spokeOwner, hubType, hubOwner, new HashSet<>());
    }

    private Optional<String> mismatch(String spokeType, TypeInfo spokeOwner, String hubType, TypeInfo hubOwner,
                                      Set<String> inProgress) {
        List<String> reasons = new ArrayList<>();
        boolean ok = TypeNames.compatible(spokeType, hubType, (s, h) -> {
            Optional<String> reason = named(s, spokeOwner, h, hubOwner, inProgress);
            reason.ifPresent(reasons::add);
            return reason.isEmpty();
        });
        if (ok) {
            return Optional.empty();
        }
        return Optional.of(reasons.isEmpty() ? spokeType + " vs " + hubType : reasons.get(0));
    }

    private Optional<String> named(String spokeName, TypeInfo spokeOwner, String hubName, TypeInfo hubOwner,
                                   Set<String> inProgress) {
        Optional<TypeInfo> spoke = resolve(spokeName, spokeOwner);
        Optional<TypeInfo> hub = resolve(hubName, hubOwner);
        if (spoke.isEmpty() && hub.isEmpty()) {
            return TypeNames.simpleName(spokeName).equals(TypeNames.simpleName(hubName))
                    ? Optional.empty()
                    : Optional.of(spokeName + " vs " + hubName);
        }
        if (spoke.isEmpty() || hub.isEmpty()) {
            return Optional.of(String.format("%s vs %s: only %s is a catalogued type",
                    spokeName, hubName, spoke.isPresent() ? spokeName : hubName));
        }
        TypeInfo s = spoke.get();
        TypeInfo h = hub.get();
        if (s.key().equals(h.key())) {
            return Optional.empty();
        }
        // recursive types: a pair already being compared is assumed to match
        String pair = s.key() + "|" + h.key();
        if (!inProgress.add(pair)) {
            return Optional.empty();
        }
        try {
            for (FieldMeta hf : h.fields()) {
                if (s.fieldByJsonName(hf.jsonName()).isEmpty()) {
                    return Optional.of(String.format("%s has field %s which %s lacks", h.key(), hf.jsonName(), s.key()));
                }
            }
            for (FieldMeta sf : s.fields()) {
                Optional<FieldMeta> hf = h.fieldByJsonName(sf.jsonName());
                if (hf.isEmpty()) {
                    return Optional.of(String.format("%s has field %s which %s lacks", s.key(), sf.jsonName(), h.key()));
                }
                Optional<String> nested = mismatch(sf.declaredType(), s, hf.get().declaredType(), h, inProgress);
                if (nested.isPresent()) {
                    return Optional.of(String.format("%s.%s (%s) vs %s.%s (%s): %s", s.key(), sf.jsonName(),
                            sf.declaredType(), h.key(), hf.get().jsonName(), hf.get().declaredType(), nested.get()));
                }
            }
            return Optional.empty();
        } finally {
            inProgress.remove(pair);
        }
    }

    /**
     * Finds a named type as Java scoping would: a qualified name directly, otherwise a member of
     * the owner or of its enclosing types, innermost first, then a type of the owner's package.
     */
    private Optional<TypeInfo> resolve(String name, TypeInfo owner) {
        TypeKey parsed = TypeKey.parse(name);
        if (!parsed.packagePath().isEmpty()) {
            Optional<TypeInfo> direct = catalog.find(parsed.packagePath(), parsed.typeName());
            if (direct.isPresent()) {
                return direct;
            }
        }
        String pkg = owner.owningPackage();
        String scope = owner.name();
        while (!scope.isEmpty()) {
            Optional<TypeInfo> member = catalog.find(pkg, scope + "." + name);
            if (member.isPresent()) {
                return member;
            }
            int idx = scope.lastIndexOf('.');
            scope = idx < 0 ? "" : scope.substring(0, idx);
        }
        return catalog.find(pkg, name);
    }
}
