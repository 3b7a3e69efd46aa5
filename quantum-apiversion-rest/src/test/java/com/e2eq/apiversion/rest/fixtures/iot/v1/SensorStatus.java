package com.e2eq.apiversion.rest.fixtures.iot.v1;

import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class SensorStatus {
    private String phase;
    private String health;
}
