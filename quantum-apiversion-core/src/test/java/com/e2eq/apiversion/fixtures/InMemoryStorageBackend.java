package com.e2eq.apiversion.fixtures;

import com.e2eq.apiversion.spi.StorageBackend;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** Test double keeping hub documents in memory. */
public class InMemoryStorageBackend implements StorageBackend {

    private final Map<String, Map<String, JsonNode>> byKind = new ConcurrentHashMap<>();

    @Override
    public void save(String kind, String uid, JsonNode hub) {
        byKind.computeIfAbsent(kind, k -> new ConcurrentHashMap<>()).put(uid, hub.deepCopy());
    }

    @Override
    public Optional<JsonNode> load(String kind, String uid) {
        return Optional.ofNullable(byKind.getOrDefault(kind, Map.of()).get(uid)).map(JsonNode::deepCopy);
    }

    @Override
    public List<JsonNode> loadAll(String kind) {
        return new ArrayList<>(byKind.getOrDefault(kind, Map.of()).values());
    }

    @Override
    public boolean delete(String kind, String uid) {
        Map<String, JsonNode> docs = byKind.get(kind);
        return docs != null && docs.remove(uid) != null;
    }
}
