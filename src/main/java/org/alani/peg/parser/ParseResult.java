package org.alani.peg.parser;

import org.alani.peg.tree.CstNode;
import org.alani.peg.tree.SourceLocation;

import java.util.List;

/**
 * Result of parsing an expression - either success with the nodes it produced or failure.
 */
public sealed interface ParseResult {

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    /**
     * Successful parse with the produced nodes and new position.
     * Terminals and predicates succeed with an empty node list.
     */
    record Success(
        List<CstNode> nodes,
        SourceLocation endLocation
    ) implements ParseResult {

        @Override
        public boolean isSuccess() {
            return true;
        }

        public static Success of(List<CstNode> nodes, SourceLocation endLocation) {
            return new Success(nodes, endLocation);
        }

        public static Success empty(SourceLocation endLocation) {
            return new Success(List.of(), endLocation);
        }
    }

    /**
     * Failed parse - no match at current position.
     */
    record Failure(
        SourceLocation location,
        String expected
    ) implements ParseResult {

        @Override
        public boolean isSuccess() {
            return false;
        }

        public static Failure at(SourceLocation location, String expected) {
            return new Failure(location, expected);
        }
    }
}
