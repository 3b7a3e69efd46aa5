package com.e2eq.apiversion.fixtures.fleet.v1alpha1;

import com.e2eq.apiversion.model.VersionedResource;
import lombok.Data;
import lombok.NoArgsConstructor;

public class Switch extends VersionedResource<Switch.Spec, Switch.Status> {

    @Data
    @NoArgsConstructor
    public static class Spec {
        private int ports;
    }

    @Data
    @NoArgsConstructor
    public static class Status {
        private int linksUp;
    }
}
