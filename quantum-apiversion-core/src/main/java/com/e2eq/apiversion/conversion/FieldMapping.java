package com.e2eq.apiversion.conversion;

/**
 * One copy instruction inside a section: the value under {@code source} is copied to
 * {@code target}. Both are JSON property names.
 */
public record FieldMapping(String source, String target, MatchKind matchKind) {

    public enum MatchKind {
        /** explicit rename override */
        RENAME,
        /** equal wire tags */
        TAG,
        /** equal field names */
        NAME
    }
}
