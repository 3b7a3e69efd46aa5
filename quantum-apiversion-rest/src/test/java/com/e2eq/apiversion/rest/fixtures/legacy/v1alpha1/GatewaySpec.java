package com.e2eq.apiversion.rest.fixtures.legacy.v1alpha1;

import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class GatewaySpec {
    private String ipAddress;
    private String hostname;
}
