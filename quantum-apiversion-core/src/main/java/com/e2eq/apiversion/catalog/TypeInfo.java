package com.e2eq.apiversion.catalog;

import java.util.List;
import java.util.Optional;

/**
 * Structural shape of a named type: its owning package and its ordered fields.
 */
public record TypeInfo(String name, String owningPackage, List<FieldMeta> fields) {

    public TypeInfo {
        owningPackage = owningPackage == null ? "" : owningPackage;
        fields = fields == null ? List.of() : List.copyOf(fields);
    }

    public TypeKey key() {
        return new TypeKey(owningPackage, name);
    }

    public Optional<FieldMeta> fieldByJsonName(String jsonName) {
        return fields.stream().filter(f -> f.jsonName().equals(jsonName)).findFirst();
    }

    public Optional<FieldMeta> fieldByName(String fieldName) {
        return fields.stream().filter(f -> f.name().equals(fieldName)).findFirst();
    }
}
