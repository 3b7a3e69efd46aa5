package com.e2eq.apiversion.rest.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.quarkus.runtime.annotations.RegisterForReflection;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.experimental.SuperBuilder;

import java.util.List;

@Data
@EqualsAndHashCode
@SuperBuilder
@RegisterForReflection
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiError {
   protected int status;
   protected String statusMessage;
   protected String reasonMessage;
   protected String group;
   protected String requestedVersion;
   protected List<String> supportedVersions;
}
