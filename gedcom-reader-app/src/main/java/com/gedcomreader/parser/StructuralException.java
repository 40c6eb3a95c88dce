package com.gedcomreader.parser;

/**
 * The lines do not form a valid level hierarchy: a level skip, a first line
 * that is not level 0, or a CONC/CONT line with nothing to continue.
 */
public class StructuralException extends GedcomParseException {

    public StructuralException(String message, int lineNumber, String line) {
        super(message, lineNumber, line);
    }
}
