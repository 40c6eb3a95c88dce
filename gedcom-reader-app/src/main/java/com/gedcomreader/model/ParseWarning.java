package com.gedcomreader.model;

/**
 * A non-fatal condition found while loading a document.
 */
public record ParseWarning(
    Type type,
    int lineNumber,  // physical line of the record the warning is about, 0 if unknown
    String message
) {
    public enum Type {
        OBSOLETE_TAG,
        UNRESOLVED_POINTER
    }

    @Override
    public String toString() {
        return lineNumber > 0
                ? "[" + type + "] line " + lineNumber + ": " + message
                : "[" + type + "] " + message;
    }
}
