package com.e2eq.apiversion.rest.fixtures.iot.v1alpha1;

import com.e2eq.apiversion.model.VersionedResource;

public class Sensor extends VersionedResource<SensorSpec, SensorStatus> {
}
