package com.gedcomreader.parser;

/**
 * One tokenized physical line. {@code xrefId} and {@code value} are null when
 * absent; an empty {@code value} means the line ended with the delimiter.
 */
public record RawLine(
    int lineNumber,
    int level,
    String xrefId,
    String tag,
    String value,
    String text      // original line, for error reporting
) {
    public boolean isContinuation() {
        return ContinuationFolder.CONT.equals(tag) || ContinuationFolder.CONC.equals(tag);
    }
}
