package org.alani.compiler.ast;

/**
 * A single node of the Alani AST.
 */
public sealed interface AlaniAstNode {
    Skip SKIP = new Skip();

    /**
     * Text to match verbatim, already unescaped.
     */
    record Atom(String text) implements AlaniAstNode {}

    record SymbolNode(Symbol symbol) implements AlaniAstNode {}

    record QuantifierNode(Quantifier quantifier) implements AlaniAstNode {}

    /**
     * Produced for the end-of-input marker; carries no meaning.
     */
    record Skip() implements AlaniAstNode {}
}
