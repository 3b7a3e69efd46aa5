package com.e2eq.apiversion.conversion;

import com.e2eq.apiversion.catalog.FieldMeta;
import com.e2eq.apiversion.catalog.TypeCatalog;
import com.e2eq.apiversion.catalog.TypeInfo;
import com.e2eq.apiversion.conversion.FieldMapping.MatchKind;
import com.e2eq.apiversion.exceptions.CatalogLookupException;
import com.e2eq.apiversion.exceptions.ConversionGenerationException;
import com.e2eq.apiversion.model.VersionedResource;
import com.e2eq.apiversion.registry.SchemaVersionRegistry;
import com.e2eq.apiversion.registry.SchemaVersionRegistry.ApiGroup;
import com.e2eq.apiversion.registry.SchemaVersionRegistry.ApiResource;
import com.e2eq.apiversion.registry.SchemaVersionRegistry.FieldPath;
import com.e2eq.apiversion.registry.SchemaVersionRegistry.FieldRename;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Builds hub/spoke field mappings from the shapes held in the {@link TypeCatalog} and turns them
 * into {@link MappedConverter}s.
 * <p>
 * For every field, in order: an explicit rename override for the spoke version, equal wire tags,
 * equal field names. Fields claimed by a rename never take part in automatic matching. Matched
 * fields must have compatible declared types; nested types known to the catalog must have the same
 * fields on both sides, since nested values are copied whole.
 * </p>
 */
public final class ConversionGenerator {

    private static final Logger LOG = Logger.getLogger(ConversionGenerator.class);

    private final TypeCatalog catalog;
    private final boolean strictRequiredFields;
    private final ObjectMapper mapper;
    private final NestedTypeMatcher nestedTypes;

    /**
     * @param strictRequiredFields when true a required hub field that no spoke field can populate
     *                             fails generation instead of being logged
     */
    public ConversionGenerator(TypeCatalog catalog, boolean strictRequiredFields, ObjectMapper mapper) {
        this.catalog = catalog;
        this.strictRequiredFields = strictRequiredFields;
        this.mapper = mapper;
        this.nestedTypes = new NestedTypeMatcher(catalog);
    }

    public ConversionPlan plan(ApiGroup group, ApiResource resource, ResourceBinding hub, ResourceBinding spoke) {
        ConverterKey key = spoke.key();
        List<FieldRename> renames = resource.renames(spoke.version());
        for (FieldRename r : renames) {
            if (!r.fromPath().section().equals(r.toPath().section())) {
                throw new ConversionGenerationException(String.format(
                        "%s: rename %s -> %s moves a field between spec and status", key, r.from(), r.to()));
            }
        }
        SectionPlan spec = planSection(key, FieldPath.SPEC,
                catalog.getTypeInfo(hub.specKey()), catalog.getTypeInfo(spoke.specKey()), renames);
        SectionPlan status = planSection(key, FieldPath.STATUS,
                catalog.getTypeInfo(hub.statusKey()), catalog.getTypeInfo(spoke.statusKey()), renames);
        return new ConversionPlan(key, group.storageVersion(), spec, status);
    }

    public Converter<?, ?> generate(ApiGroup group, ApiResource resource, ResourceBinding hub, ResourceBinding spoke) {
        ConversionPlan plan = plan(group, resource, hub, spoke);
        return converter(plan, hub.envelopeType(), spoke.envelopeType());
    }

    private <H extends VersionedResource<?, ?>, S extends VersionedResource<?, ?>> Converter<H, S> converter(
            ConversionPlan plan, Class<H> hubType, Class<S> spokeType) {
        return new MappedConverter<>(plan, hubType, spokeType, mapper);
    }

    /**
     * Generates a converter for every version of every kind in the registry, hub included.
     *
     * @param bindings the envelope classes, one per group, version and kind
     */
    public ConverterRegistry generateAll(SchemaVersionRegistry registry, Map<ConverterKey, ResourceBinding> bindings) {
        Map<ConverterKey, Converter<?, ?>> converters = new LinkedHashMap<>();
        for (ApiGroup group : registry.groups()) {
            for (ApiResource resource : group.resources().values()) {
                ResourceBinding hub = requireBinding(bindings, group.name(), group.storageVersion(), resource.kind());
                for (String version : group.versions()) {
                    ResourceBinding spoke = requireBinding(bindings, group.name(), version, resource.kind());
                    Converter<?, ?> converter = generate(group, resource, hub, spoke);
                    converters.put(spoke.key(), converter);
                    LOG.debugf("Generated converter %s -> %s", spoke.key(), group.storageVersion());
                }
            }
        }
        LOG.infof("Generated %d converters", converters.size());
        return new ConverterRegistry(converters, bindings);
    }

    private static ResourceBinding requireBinding(Map<ConverterKey, ResourceBinding> bindings,
                                                  String group, String version, String kind) {
        ConverterKey key = new ConverterKey(group, version, kind);
        ResourceBinding binding = bindings.get(key);
        if (binding == null) {
            throw new CatalogLookupException("no type is bound for " + key);
        }
        return binding;
    }

    private SectionPlan planSection(ConverterKey key, String section, TypeInfo hub, TypeInfo spoke,
                                    List<FieldRename> renames) {
        List<Match> matches = new ArrayList<>();
        Set<String> claimedSpoke = new HashSet<>();
        Set<String> claimedHub = new HashSet<>();

        for (FieldRename r : renames) {
            if (!r.fromPath().section().equals(section)) continue;
            FieldMeta s = lookup(spoke, r.fromPath().field()).orElseThrow(() -> new ConversionGenerationException(
                    String.format("%s: rename %s -> %s names spoke field %s which does not exist in %s",
                            key, r.from(), r.to(), r.fromPath().field(), spoke.key())));
            FieldMeta h = lookup(hub, r.toPath().field()).orElseThrow(() -> new ConversionGenerationException(
                    String.format("%s: rename %s -> %s names hub field %s which does not exist in %s",
                            key, r.from(), r.to(), r.toPath().field(), hub.key())));
            checkTypes(key, section, spoke, s, hub, h);
            matches.add(new Match(s, h, MatchKind.RENAME));
            claimedSpoke.add(s.name());
            claimedHub.add(h.name());
        }

        for (FieldMeta h : hub.fields()) {
            if (claimedHub.contains(h.name())) continue;
            MatchKind kind = MatchKind.TAG;
            Optional<FieldMeta> match = Optional.empty();
            if (h.hasWireTag()) {
                match = spoke.fields().stream()
                        .filter(s -> !claimedSpoke.contains(s.name()))
                        .filter(s -> s.hasWireTag() && s.wireTag().equals(h.wireTag()))
                        .findFirst();
            }
            if (match.isEmpty()) {
                kind = MatchKind.NAME;
                match = spoke.fields().stream()
                        .filter(s -> !claimedSpoke.contains(s.name()))
                        .filter(s -> s.name().equals(h.name()))
                        .findFirst();
            }
            if (match.isPresent()) {
                FieldMeta s = match.get();
                checkTypes(key, section, spoke, s, hub, h);
                matches.add(new Match(s, h, kind));
                claimedSpoke.add(s.name());
                claimedHub.add(h.name());
            }
        }

        List<FieldMapping> toHub = new ArrayList<>();
        List<FieldMapping> fromHub = new ArrayList<>();
        for (Match m : matches) {
            toHub.add(new FieldMapping(m.spoke().jsonName(), m.hub().jsonName(), m.kind()));
            fromHub.add(new FieldMapping(m.hub().jsonName(), m.spoke().jsonName(), m.kind()));
        }

        List<String> unmatchedHub = new ArrayList<>();
        for (FieldMeta h : hub.fields()) {
            if (claimedHub.contains(h.name())) continue;
            unmatchedHub.add(h.jsonName());
            if (h.required()) {
                String msg = String.format("%s: required hub field %s.%s has no counterpart in %s and stays zero-valued",
                        key, section, h.jsonName(), spoke.key());
                if (strictRequiredFields) {
                    throw new ConversionGenerationException(msg);
                }
                LOG.warn(msg);
            }
        }
        List<String> lossy = new ArrayList<>();
        for (FieldMeta s : spoke.fields()) {
            if (!claimedSpoke.contains(s.name())) {
                lossy.add(s.jsonName());
                LOG.infof("%s: spoke field %s.%s has no hub counterpart; its value is not stored",
                        key, section, s.jsonName());
            }
        }
        return new SectionPlan(section, toHub, fromHub, unmatchedHub, lossy);
    }

    private record Match(FieldMeta spoke, FieldMeta hub, MatchKind kind) {}

    private static Optional<FieldMeta> lookup(TypeInfo type, String field) {
        Optional<FieldMeta> byJson = type.fieldByJsonName(field);
        return byJson.isPresent() ? byJson : type.fieldByName(field);
    }

    private void checkTypes(ConverterKey key, String section, TypeInfo spokeType, FieldMeta spoke,
                            TypeInfo hubType, FieldMeta hub) {
        nestedTypes.mismatch(spoke.declaredType(), spokeType, hub.declaredType(), hubType).ifPresent(reason -> {
            throw new ConversionGenerationException(String.format(
                    "%s: %s field %s (%s) cannot be mapped to hub field %s (%s): incompatible types, %s",
                    key, section, spoke.name(), spoke.declaredType(), hub.name(), hub.declaredType(), reason));
        });
    }
}
