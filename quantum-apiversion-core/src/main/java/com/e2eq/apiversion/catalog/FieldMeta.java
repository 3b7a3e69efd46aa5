package com.e2eq.apiversion.catalog;

import java.util.Objects;

/**
 * Shape of a single field as seen by the catalog.
 *
 * @param name         declared field name
 * @param declaredType normalized type string, see {@link TypeNames}
 * @param wireTag      JSON property name when one is declared, otherwise empty
 * @param required     whether the field is marked as required
 */
public record FieldMeta(String name, String declaredType, String wireTag, boolean required) {

    public FieldMeta {
        Objects.requireNonNull(name, "name");
        declaredType = declaredType == null || declaredType.isBlank() ? TypeNames.OPAQUE : declaredType;
        wireTag = wireTag == null ? "" : wireTag;
    }

    public static FieldMeta of(String name, String declaredType) {
        return new FieldMeta(name, declaredType, "", false);
    }

    public boolean hasWireTag() {
        return !wireTag.isEmpty();
    }

    /** The property name this field is carried under on the wire. */
    public String jsonName() {
        return hasWireTag() ? wireTag : name;
    }
}
