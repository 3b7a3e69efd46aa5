package com.e2eq.apiversion.negotiation;

import java.util.function.BooleanSupplier;

/**
 * Transport independent view of an incoming request.
 *
 * @param group        API group from the request path
 * @param kind         resource kind addressed
 * @param uid          addressed resource, {@code null} for create and list
 * @param body         raw JSON body, {@code null} for reads
 * @param acceptHeader raw Accept header, may be {@code null}
 * @param cancelled    polled before dispatch; {@code true} aborts the request
 */
public record VersionedRequest(String group, String kind, String uid, String body, String acceptHeader,
                               BooleanSupplier cancelled) {

    public VersionedRequest {
        cancelled = cancelled == null ? () -> false : cancelled;
    }

    public static VersionedRequest write(String group, String kind, String body, String acceptHeader) {
        return new VersionedRequest(group, kind, null, body, acceptHeader, null);
    }

    public static VersionedRequest read(String group, String kind, String uid, String acceptHeader) {
        return new VersionedRequest(group, kind, uid, null, acceptHeader, null);
    }

    public VersionedRequest withUid(String newUid) {
        return new VersionedRequest(group, kind, newUid, body, acceptHeader, cancelled);
    }

    public VersionedRequest withCancellation(BooleanSupplier signal) {
        return new VersionedRequest(group, kind, uid, body, acceptHeader, signal);
    }

    public boolean isCancelled() {
        return cancelled.getAsBoolean();
    }
}
