package com.e2eq.apiversion.negotiation;

/** Where the version served for a request came from, in order of precedence. */
public enum VersionSource {
    BODY,
    ACCEPT_HEADER,
    DEFAULT
}
