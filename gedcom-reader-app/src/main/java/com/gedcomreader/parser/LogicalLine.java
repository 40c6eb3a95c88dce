package com.gedcomreader.parser;

/**
 * A line after CONC/CONT folding. {@code lineNumber} and {@code text} refer to
 * the base (non-continuation) physical line.
 */
public record LogicalLine(
    int lineNumber,
    int level,
    String xrefId,
    String tag,
    String value,
    String text
) {
    static LogicalLine of(RawLine raw) {
        return new LogicalLine(raw.lineNumber(), raw.level(), raw.xrefId(), raw.tag(), raw.value(), raw.text());
    }
}
