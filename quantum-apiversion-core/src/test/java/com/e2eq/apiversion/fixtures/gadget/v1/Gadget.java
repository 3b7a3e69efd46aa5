package com.e2eq.apiversion.fixtures.gadget.v1;

import com.e2eq.apiversion.model.VersionedResource;

public class Gadget extends VersionedResource<GadgetSpec, GadgetStatus> {
}
