package com.e2eq.apiversion.rest.service;

import com.e2eq.apiversion.conversion.ConverterKey;
import com.e2eq.apiversion.conversion.ConverterRegistry;
import com.e2eq.apiversion.exceptions.ResourceNotFoundException;
import com.e2eq.apiversion.exceptions.RuntimeConversionException;
import com.e2eq.apiversion.model.Metadata;
import com.e2eq.apiversion.model.VersionedResource;
import com.e2eq.apiversion.negotiation.HubHandler;
import com.e2eq.apiversion.registry.SchemaVersionRegistry;
import com.e2eq.apiversion.spi.StorageBackend;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.quarkus.logging.Log;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Hub-only CRUD on top of a {@link StorageBackend}. Every document it saves or loads is in the
 * storage version of its group.
 */
@ApplicationScoped
public class StorageBackedHubHandler {

    private final StorageBackend storage;
    private final SchemaVersionRegistry registry;
    private final ConverterRegistry converters;
    private final ObjectMapper mapper;

    @Inject
    public StorageBackedHubHandler(StorageBackend storage, SchemaVersionRegistry registry,
                                   ConverterRegistry converters, ObjectMapper mapper) {
        this.storage = storage;
        this.registry = registry;
        this.converters = converters;
        this.mapper = mapper;
    }

    /** Assigns a fresh uid and both timestamps, then stores the hub. */
    public HubHandler creator(String group, String kind) {
        return hub -> {
            Metadata metadata = hub.getMetadata() == null ? new Metadata() : hub.getMetadata();
            Instant now = Instant.now();
            metadata.setUid(ResourceUids.generate(kind));
            metadata.setCreatedAt(now);
            metadata.setUpdatedAt(now);
            hub.setMetadata(metadata);
            storage.save(ResourceNames.storageKind(group, kind), metadata.getUid(), mapper.valueToTree(hub));
            Log.debugf("Created %s %s in %s", kind, metadata.getUid(), group);
            return hub;
        };
    }

    /** Replaces an existing hub, keeping its uid and creation time. */
    public HubHandler updater(String group, String kind, String uid) {
        return hub -> {
            VersionedResource<?, ?> existing = load(group, kind, uid)
                    .orElseThrow(() -> new ResourceNotFoundException(kind, uid));
            Metadata metadata = hub.getMetadata() == null ? new Metadata() : hub.getMetadata();
            metadata.setUid(uid);
            metadata.setCreatedAt(existing.getMetadata() == null ? null : existing.getMetadata().getCreatedAt());
            metadata.setUpdatedAt(Instant.now());
            hub.setMetadata(metadata);
            storage.save(ResourceNames.storageKind(group, kind), uid, mapper.valueToTree(hub));
            return hub;
        };
    }

    public HubHandler.Reader reader(String group, String kind, String uid) {
        return () -> load(group, kind, uid);
    }

    public HubHandler.Lister lister(String group, String kind) {
        return () -> {
            Class<? extends VersionedResource<?, ?>> hubType = hubType(group, kind);
            List<VersionedResource<?, ?>> hubs = new ArrayList<>();
            for (JsonNode doc : storage.loadAll(ResourceNames.storageKind(group, kind))) {
                hubs.add(toHub(doc, hubType));
            }
            return hubs;
        };
    }

    public boolean delete(String group, String kind, String uid) {
        boolean deleted = storage.delete(ResourceNames.storageKind(group, kind), uid);
        if (deleted) {
            Log.debugf("Deleted %s %s in %s", kind, uid, group);
        }
        return deleted;
    }

    private Optional<VersionedResource<?, ?>> load(String group, String kind, String uid) {
        Class<? extends VersionedResource<?, ?>> hubType = hubType(group, kind);
        return storage.load(ResourceNames.storageKind(group, kind), uid).map(doc -> toHub(doc, hubType));
    }

    private Class<? extends VersionedResource<?, ?>> hubType(String group, String kind) {
        String storageVersion = registry.storageVersion(group)
                .orElseThrow(() -> new ResourceNotFoundException("ApiGroup", group));
        return converters.get(new ConverterKey(group, storageVersion, kind)).hubType();
    }

    private VersionedResource<?, ?> toHub(JsonNode doc, Class<? extends VersionedResource<?, ?>> hubType) {
        try {
            return mapper.treeToValue(doc, hubType);
        } catch (JsonProcessingException e) {
            throw new RuntimeConversionException("stored document does not fit " + hubType.getName(), e);
        }
    }
}
