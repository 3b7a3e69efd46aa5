package com.e2eq.apiversion.fixtures.infra.v1alpha1;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class DeviceSpec {
    @NotBlank
    private String name;
    @NotBlank
    private String ipAddress;
    private String deviceType;
    private String description;
}
