package com.e2eq.apiversion.rest.fixtures.legacy.v1alpha1;

import com.e2eq.apiversion.model.VersionedResource;

public class Gateway extends VersionedResource<GatewaySpec, GatewayStatus> {
}
