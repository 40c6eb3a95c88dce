package com.gedcomreader.parser;

/**
 * Fatal parse failure. No document is produced when one is thrown.
 */
public abstract class GedcomParseException extends Exception {

    private final int lineNumber;
    private final String line;

    protected GedcomParseException(String message, int lineNumber, String line) {
        super(message + " (line " + lineNumber + ": '" + line + "')");
        this.lineNumber = lineNumber;
        this.line = line;
    }

    /**
     * 1-based physical line number of the offending line.
     */
    public int getLineNumber() {
        return lineNumber;
    }

    public String getLine() {
        return line;
    }
}
