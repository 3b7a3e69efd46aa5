package com.e2eq.apiversion.exceptions;

/**
 * Thrown when the type catalog cannot resolve the shape of a type, either because it was never
 * scanned or because an external type was not declared through an explicit import.
 */
public class CatalogLookupException extends ApiVersioningException {
    private static final long serialVersionUID = 1L;

    private final String packagePath;
    private final String typeName;

    public CatalogLookupException(String message) {
        super(message);
        this.packagePath = null;
        this.typeName = null;
    }

    public CatalogLookupException(String message, Throwable cause) {
        super(message, cause);
        this.packagePath = null;
        this.typeName = null;
    }

    public CatalogLookupException(String packagePath, String typeName, String message) {
        super(message);
        this.packagePath = packagePath;
        this.typeName = typeName;
    }

    public String getPackagePath() {
        return packagePath;
    }

    public String getTypeName() {
        return typeName;
    }
}
