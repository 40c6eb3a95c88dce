package com.gedcomreader.parser;

public class DuplicateXrefException extends GedcomParseException {

    private final String xrefId;
    private final int firstLineNumber;

    public DuplicateXrefException(String xrefId, int firstLineNumber, int lineNumber, String line) {
        super("Duplicate cross reference id " + xrefId + ", first declared in line " + firstLineNumber,
                lineNumber, line);
        this.xrefId = xrefId;
        this.firstLineNumber = firstLineNumber;
    }

    public String getXrefId() {
        return xrefId;
    }

    public int getFirstLineNumber() {
        return firstLineNumber;
    }
}
