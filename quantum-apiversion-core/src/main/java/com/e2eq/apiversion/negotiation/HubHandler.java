package com.e2eq.apiversion.negotiation;

import com.e2eq.apiversion.model.VersionedResource;

import java.util.List;
import java.util.Optional;

/**
 * Business logic seen by the pipeline. Handlers only ever receive and return hub objects.
 */
@FunctionalInterface
public interface HubHandler {

    VersionedResource<?, ?> handle(VersionedResource<?, ?> hub);

    @FunctionalInterface
    interface Reader {
        Optional<? extends VersionedResource<?, ?>> read();
    }

    @FunctionalInterface
    interface Lister {
        List<? extends VersionedResource<?, ?>> list();
    }
}
