package com.e2eq.apiversion.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Metadata shared by every version of every resource. Conversions copy it as a unit and never
 * map it field by field.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class Metadata {
    private String name;
    private String uid;
    private Map<String, String> labels;
    private Map<String, String> annotations;
    private Instant createdAt;
    private Instant updatedAt;

    /** Deep copy; label and annotation maps are not shared with the source. */
    public Metadata copy() {
        return toBuilder()
                .labels(labels == null ? null : new LinkedHashMap<>(labels))
                .annotations(annotations == null ? null : new LinkedHashMap<>(annotations))
                .build();
    }
}
