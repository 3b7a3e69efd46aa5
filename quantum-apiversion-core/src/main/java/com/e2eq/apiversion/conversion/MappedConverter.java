package com.e2eq.apiversion.conversion;

import com.e2eq.apiversion.exceptions.RuntimeConversionException;
import com.e2eq.apiversion.model.VersionedResource;
import com.e2eq.apiversion.negotiation.PipelineStage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * {@link Converter} driven by a {@link ConversionPlan}. Section values are copied through Jackson
 * trees keyed by JSON property name, so nested values are copied structurally. Metadata is deep
 * copied as a whole and {@code apiVersion}/{@code kind} are stamped for the target version.
 */
public final class MappedConverter<H extends VersionedResource<?, ?>, S extends VersionedResource<?, ?>>
        implements Converter<H, S> {

    private final ConversionPlan plan;
    private final Class<H> hubType;
    private final Class<S> spokeType;
    private final ObjectMapper mapper;

    public MappedConverter(ConversionPlan plan, Class<H> hubType, Class<S> spokeType, ObjectMapper mapper) {
        this.plan = plan;
        this.hubType = hubType;
        this.spokeType = spokeType;
        this.mapper = mapper;
    }

    @Override
    public H convertTo(S spoke) {
        return copy(spoke, hubType, plan.hubApiVersion(),
                plan.spec().toHub(), plan.status().toHub(), PipelineStage.CONVERT_TO_HUB);
    }

    @Override
    public S convertFrom(H hub) {
        return copy(hub, spokeType, plan.spokeApiVersion(),
                plan.spec().fromHub(), plan.status().fromHub(), PipelineStage.CONVERT_HUB_TO_RESPONSE_SPOKE);
    }

    @Override
    public ConversionPlan plan() {
        return plan;
    }

    @Override
    public Class<H> hubType() {
        return hubType;
    }

    @Override
    public Class<S> spokeType() {
        return spokeType;
    }

    private <R extends VersionedResource<?, ?>> R copy(VersionedResource<?, ?> source, Class<R> targetType,
                                                        String apiVersion, List<FieldMapping> specMappings,
                                                        List<FieldMapping> statusMappings, PipelineStage stage) {
        if (source == null) {
            return null;
        }
        try {
            ObjectNode envelope = mapper.createObjectNode();
            envelope.put("apiVersion", apiVersion);
            envelope.put("kind", plan.key().kind());
            envelope.set("spec", copySection(source.getSpec(), specMappings));
            envelope.set("status", copySection(source.getStatus(), statusMappings));

            R target = mapper.treeToValue(envelope, targetType);
            target.setMetadata(source.getMetadata() == null ? null : source.getMetadata().copy());
            return target;
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new RuntimeConversionException(stage, String.format("%s: cannot convert %s to %s: %s",
                    plan.key(), source.getClass().getSimpleName(), targetType.getName(), e.getMessage()), e);
        }
    }

    // a missing section becomes an empty, zero-valued one
    private ObjectNode copySection(Object section, List<FieldMapping> mappings) {
        ObjectNode out = mapper.createObjectNode();
        if (section == null) {
            return out;
        }
        JsonNode tree = mapper.valueToTree(section);
        for (FieldMapping m : mappings) {
            JsonNode value = tree.get(m.source());
            if (value != null && !value.isNull()) {
                out.set(m.target(), value.deepCopy());
            }
        }
        return out;
    }
}
