package com.e2eq.apiversion.rest.service;

import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Generates resource uids of the form {@code <prefix>-<8 hex>}, the prefix being the first three
 * letters of the kind in lower case ({@code Device} gives {@code dev-1a2b3c4d}).
 */
public final class ResourceUids {

    private static final SecureRandom RANDOM = new SecureRandom();
    private static final int RANDOM_BYTES = 4;
    private static final int PREFIX_LENGTH = 3;

    private ResourceUids() {
    }

    public static String generate(String kind) {
        byte[] bytes = new byte[RANDOM_BYTES];
        RANDOM.nextBytes(bytes);
        return prefixOf(kind) + "-" + HexFormat.of().formatHex(bytes);
    }

    static String prefixOf(String kind) {
        String letters = kind == null ? "" : kind.replaceAll("[^A-Za-z]", "").toLowerCase(Locale.ROOT);
        if (letters.isEmpty()) {
            return "res";
        }
        return letters.length() <= PREFIX_LENGTH ? letters : letters.substring(0, PREFIX_LENGTH);
    }
}
