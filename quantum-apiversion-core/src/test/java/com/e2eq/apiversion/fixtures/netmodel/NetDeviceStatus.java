package com.e2eq.apiversion.fixtures.netmodel;

import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class NetDeviceStatus {
    private boolean reachable;
}
