package org.alani.peg.error;

import org.alani.peg.tree.SourceLocation;

/**
 * Parse error with location and context information.
 */
public sealed interface ParseError {
    SourceLocation location();

    String message();

    /**
     * Unexpected input error.
     */
    record UnexpectedInput(
    SourceLocation location,
    String found,
    String expected) implements ParseError {
        @Override
        public String message() {
            return "Unexpected '" + found + "' at " + location + ", expected " + expected;
        }
    }

    /**
     * Unexpected end of input.
     */
    record UnexpectedEof(
    SourceLocation location,
    String expected) implements ParseError {
        @Override
        public String message() {
            return "Unexpected end of input at " + location + ", expected " + expected;
        }
    }

    /**
     * Grammar-level error, e.g. an undefined rule reference or a malformed directive.
     */
    record SemanticError(
    SourceLocation location,
    String reason) implements ParseError {
        @Override
        public String message() {
            return reason + " at " + location;
        }
    }

    /**
     * Input rejected before parsing because it exceeds the configured limit.
     */
    record InputTooLarge(
    int length,
    int limit) implements ParseError {
        @Override
        public SourceLocation location() {
            return SourceLocation.START;
        }

        @Override
        public String message() {
            return "Input of " + length + " characters exceeds the limit of " + limit;
        }
    }

    /**
     * Rule applications nested deeper than the configured limit.
     */
    record NestingTooDeep(
    SourceLocation location,
    int limit) implements ParseError {
        @Override
        public String message() {
            return "Nesting deeper than " + limit + " rules at " + location;
        }
    }
}
