package com.gedcomreader.model;

import java.util.regex.Pattern;

/**
 * Cross-reference id syntax: {@code @} + identifier characters + {@code @}.
 * Ids are kept in their delimited form ("@I1@") everywhere in the model.
 */
public final class Xrefs {

    // Letters, digits, underscore and hyphen. The first character may not be '#',
    // which keeps date escapes such as @#DJULIAN@ out.
    private static final Pattern XREF = Pattern.compile("@[A-Za-z0-9_][A-Za-z0-9_\\-]*@");

    private Xrefs() {
    }

    public static boolean isXref(String token) {
        return token != null && XREF.matcher(token).matches();
    }
}
