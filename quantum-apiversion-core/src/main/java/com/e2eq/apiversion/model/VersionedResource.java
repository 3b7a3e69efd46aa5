package com.e2eq.apiversion.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Wire envelope common to all versions of a resource. Each version of a kind is a subclass
 * binding the spec and status types, for example
 * {@code class Device extends VersionedResource<DeviceSpec, DeviceStatus>}.
 *
 * @param <S> spec type
 * @param <T> status type
 */
@Data
@NoArgsConstructor
@JsonPropertyOrder({"apiVersion", "kind", "metadata", "spec", "status"})
public abstract class VersionedResource<S, T> {
    private String apiVersion;
    private String kind;
    private Metadata metadata;
    private S spec;
    private T status;
}
