package com.e2eq.apiversion.fixtures.gadget.v1alpha2;

import com.e2eq.apiversion.model.VersionedResource;

public class Gadget extends VersionedResource<GadgetSpec, GadgetStatus> {
}
