package com.e2eq.apiversion.fixtures.legacy.v1;

import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class DeviceStatus {
    private String phase;
}
