package org.alani.peg.error;

/**
 * Thrown when grammar text or parser input cannot be parsed.
 */
public class ParseException extends Exception {
    private final ParseError error;

    public ParseException(ParseError error) {
        super(error.message());
        this.error = error;
    }

    public ParseError error() {
        return error;
    }
}
