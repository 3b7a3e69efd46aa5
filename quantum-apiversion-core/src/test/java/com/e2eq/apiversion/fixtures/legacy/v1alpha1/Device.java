package com.e2eq.apiversion.fixtures.legacy.v1alpha1;

import com.e2eq.apiversion.model.VersionedResource;

public class Device extends VersionedResource<DeviceSpec, DeviceStatus> {
}
