package com.e2eq.apiversion.catalog;

/**
 * Extracts the wire name from a raw tag as it appears in source or in a struct-tag style string.
 * <p>
 * Accepted inputs include {@code "ipAddress"} (a quoted annotation literal),
 * {@code ipAddress} and {@code `json:"ipAddress,omitempty" validate:"required"`}. Options after
 * the first comma never become part of the name.
 * </p>
 */
public final class WireTags {

    private static final String JSON_KEY = "json:";

    private WireTags() {}

    public static String nameOf(String rawTag) {
        if (rawTag == null) {
            return "";
        }
        String tag = rawTag.trim();
        tag = strip(tag, '`');

        int keyIdx = tag.indexOf(JSON_KEY);
        if (keyIdx >= 0) {
            String rest = tag.substring(keyIdx + JSON_KEY.length());
            if (rest.startsWith("\"")) {
                int close = rest.indexOf('"', 1);
                tag = close > 0 ? rest.substring(1, close) : rest.substring(1);
            } else {
                int space = rest.indexOf(' ');
                tag = space >= 0 ? rest.substring(0, space) : rest;
            }
        } else {
            tag = strip(tag, '"');
        }

        int comma = tag.indexOf(',');
        if (comma >= 0) {
            tag = tag.substring(0, comma);
        }
        tag = tag.trim();
        // "-" means the field is never serialized
        return "-".equals(tag) ? "" : tag;
    }

    private static String strip(String value, char quote) {
        String out = value;
        if (out.length() >= 1 && out.charAt(0) == quote) {
            out = out.substring(1);
        }
        if (out.length() >= 1 && out.charAt(out.length() - 1) == quote) {
            out = out.substring(0, out.length() - 1);
        }
        return out;
    }
}
