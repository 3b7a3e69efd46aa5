package com.e2eq.apiversion.conversion;

import com.e2eq.apiversion.catalog.TypeKey;
import com.e2eq.apiversion.model.ResourceTypes;
import com.e2eq.apiversion.model.VersionedResource;

/**
 * Binds a kind at a version to its envelope class and the spec and status classes the envelope
 * declares.
 */
public record ResourceBinding(String group,
                              String version,
                              String kind,
                              Class<? extends VersionedResource<?, ?>> envelopeType,
                              Class<?> specType,
                              Class<?> statusType) {

    public static ResourceBinding of(String group, String version, String kind,
                                     Class<? extends VersionedResource<?, ?>> envelopeType) {
        return new ResourceBinding(group, version, kind, envelopeType,
                ResourceTypes.specType(envelopeType), ResourceTypes.statusType(envelopeType));
    }

    public ConverterKey key() {
        return new ConverterKey(group, version, kind);
    }

    public TypeKey specKey() {
        return TypeKey.of(specType);
    }

    public TypeKey statusKey() {
        return TypeKey.of(statusType);
    }
}
