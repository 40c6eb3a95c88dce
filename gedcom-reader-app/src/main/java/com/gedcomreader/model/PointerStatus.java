package com.gedcomreader.model;

/**
 * Resolution state of a record's value with respect to cross-references.
 */
public enum PointerStatus {
    /** The value is not a pointer, or resolution has not run yet. */
    NONE,
    RESOLVED,
    /** The value has pointer syntax but no record declares the id. */
    UNRESOLVED
}
