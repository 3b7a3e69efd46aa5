package com.e2eq.apiversion.rest.fixtures.iot.v1beta1;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@NoArgsConstructor
public class SensorSpec {
    private String name;
    private String ipAddress;
    private Map<String, String> tags;
}
