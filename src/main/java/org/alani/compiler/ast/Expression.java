package org.alani.compiler.ast;

/**
 * The operand of a quantifier: the subset of nodes that may be repeated.
 */
public sealed interface Expression {
    record Atom(String text) implements Expression {}

    record SymbolNode(Symbol symbol) implements Expression {}
}
