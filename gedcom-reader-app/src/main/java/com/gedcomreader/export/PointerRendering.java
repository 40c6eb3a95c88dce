package com.gedcomreader.export;

import java.util.Locale;

/**
 * How a resolved pointer is written out.
 */
public enum PointerRendering {
    /** {@code "ref": "@F1@"} */
    REFERENCE,
    /** {@code "target": {...}} with the target record projected in place, one level deep. */
    NESTED;

    public static PointerRendering parse(String text) {
        if (text == null || text.isBlank()) {
            return REFERENCE;
        }
        return valueOf(text.trim().toUpperCase(Locale.ROOT));
    }
}
