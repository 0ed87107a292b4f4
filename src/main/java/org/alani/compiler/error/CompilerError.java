package org.alani.compiler.error;

import org.alani.peg.error.ParseError;
import org.alani.peg.tree.SourceSpan;

/**
 * Reasons an Alani source text cannot be turned into an AST.
 *
 * <p>Errors raised from a token carry the token's span.
 */
public sealed interface CompilerError {
    String message();

    /**
     * The token source produced no root token.
     */
    record MissingRootNode() implements CompilerError {
        @Override
        public String message() {
            return "Source produced no root node";
        }
    }

    /**
     * A token lacks a child the builder requires.
     */
    record MissingNode(
    String rule,
    SourceSpan span) implements CompilerError {
        @Override
        public String message() {
            return "Missing child node in " + rule + " at " + span;
        }
    }

    /**
     * A token whose rule has no AST counterpart.
     */
    record UnrecognizedSyntax(
    String rule,
    SourceSpan span) implements CompilerError {
        @Override
        public String message() {
            return "Unrecognized syntax '" + rule + "' at " + span;
        }
    }

    record UnrecognizedSymbol(
    String name,
    SourceSpan span) implements CompilerError {
        @Override
        public String message() {
            return "Unrecognized symbol <" + name + "> at " + span;
        }
    }

    record NegativeStartNotAllowed(SourceSpan span) implements CompilerError {
        @Override
        public String message() {
            return "The start anchor cannot be negated, at " + span;
        }
    }

    record NegativeEndNotAllowed(SourceSpan span) implements CompilerError {
        @Override
        public String message() {
            return "The end anchor cannot be negated, at " + span;
        }
    }

    record UnexpectedQuantifierInQuantifier(SourceSpan span) implements CompilerError {
        @Override
        public String message() {
            return "A quantifier cannot quantify another quantifier, at " + span;
        }
    }

    record UnexpectedSkippedNodeInQuantifier(SourceSpan span) implements CompilerError {
        @Override
        public String message() {
            return "Quantifier at " + span + " has nothing to quantify";
        }
    }

    record UnexpectedGroupInQuantifier(SourceSpan span) implements CompilerError {
        @Override
        public String message() {
            return "A quantifier cannot quantify a group, at " + span;
        }
    }

    record UnexpectedAssertionInQuantifier(SourceSpan span) implements CompilerError {
        @Override
        public String message() {
            return "A quantifier cannot quantify an assertion, at " + span;
        }
    }

    record UnexpectedSpecialSymbolInQuantifier(SourceSpan span) implements CompilerError {
        @Override
        public String message() {
            return "A quantifier cannot quantify a special symbol, at " + span;
        }
    }

    record UnexpectedVariableInvocationInQuantifier(SourceSpan span) implements CompilerError {
        @Override
        public String message() {
            return "A quantifier cannot quantify a variable invocation, at " + span;
        }
    }

    /**
     * The grammar rejected the source text.
     */
    record SyntaxError(ParseError cause) implements CompilerError {
        @Override
        public String message() {
            return "Syntax error: " + cause.message();
        }
    }

    /**
     * A quantity range whose lower bound exceeds its upper bound, e.g. {@code 5 to 2 of "a"}.
     */
    record InvalidQuantifierRange(
    int start,
    int end,
    SourceSpan span) implements CompilerError {
        @Override
        public String message() {
            return "Quantifier range " + start + " to " + end + " at " + span + " has its start after its end";
        }
    }

    /**
     * A quantity too large to represent.
     */
    record InvalidQuantity(
    String text,
    SourceSpan span) implements CompilerError {
        @Override
        public String message() {
            return "Quantity '" + text + "' at " + span + " is out of range";
        }
    }
}
