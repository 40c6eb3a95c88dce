package com.gedcomreader.parser;

/**
 * A physical line could not be tokenized: bad level, bad xref id or missing tag.
 */
public class MalformedLineException extends GedcomParseException {

    public MalformedLineException(String message, int lineNumber, String line) {
        super(message, lineNumber, line);
    }
}
