package org.alani.compiler.ast;

import java.util.List;

/**
 * Result of compiling an Alani source text.
 */
public sealed interface AlaniAst {
    Empty EMPTY = new Empty();

    /**
     * The source text was empty.
     */
    record Empty() implements AlaniAst {}

    /**
     * Top-level nodes in source order.
     */
    record Root(List<AlaniAstNode> nodes) implements AlaniAst {
        public Root {
            nodes = List.copyOf(nodes);
        }
    }
}
