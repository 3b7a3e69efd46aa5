package com.e2eq.apiversion.exceptions;

public class ResourceNotFoundException extends ApiVersioningException {
    private static final long serialVersionUID = 1L;

    private final String kind;
    private final String uid;

    public ResourceNotFoundException(String kind, String uid) {
        super(String.format("%s '%s' not found", kind, uid));
        this.kind = kind;
        this.uid = uid;
    }

    public String getKind() {
        return kind;
    }

    public String getUid() {
        return uid;
    }
}
