package com.e2eq.apiversion.exceptions;

import com.e2eq.apiversion.negotiation.VersionSource;

import java.util.List;

/**
 * Thrown when a request names a version (or group) that is not registered. Never falls back to a
 * nearby version.
 */
public class RequestVersionException extends ApiVersioningException {
    private static final long serialVersionUID = 1L;

    private final String group;
    private final String requestedVersion;
    private final VersionSource source;
    private final List<String> supportedVersions;

    public RequestVersionException(String group, String requestedVersion, VersionSource source,
                                   List<String> supportedVersions, String message) {
        super(message);
        this.group = group;
        this.requestedVersion = requestedVersion;
        this.source = source;
        this.supportedVersions = supportedVersions == null ? List.of() : List.copyOf(supportedVersions);
    }

    public String getGroup() {
        return group;
    }

    public String getRequestedVersion() {
        return requestedVersion;
    }

    /**
     * Where the rejected version came from; the HTTP layer answers 406 for the Accept header
     * and 400 for the body.
     */
    public VersionSource getSource() {
        return source;
    }

    public List<String> getSupportedVersions() {
        return supportedVersions;
    }
}
