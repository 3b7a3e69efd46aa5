package com.e2eq.apiversion.spi;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Optional;

/**
 * Persistence seam for hub documents. Only hub JSON ever reaches a backend; spokes are converted
 * before storage and after loading.
 */
public interface StorageBackend {

    void save(String kind, String uid, JsonNode hub);

    Optional<JsonNode> load(String kind, String uid);

    List<JsonNode> loadAll(String kind);

    /** @return {@code true} when something was deleted */
    boolean delete(String kind, String uid);
}
