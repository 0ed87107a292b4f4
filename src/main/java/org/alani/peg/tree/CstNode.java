package org.alani.peg.tree;

import java.util.List;
import java.util.Optional;

/**
 * Concrete Syntax Tree node produced by a rule application.
 *
 * <p>Only rules create nodes: literals, character classes and predicates match text
 * without producing anything. The children of a node are the nodes produced by its
 * rule body, in source order. The text is the exact matched span, without the
 * implicit whitespace skipped before the rule.
 */
public sealed interface CstNode {
    /**
     * The source span covered by this node.
     */
    SourceSpan span();

    /**
     * The rule name that produced this node.
     */
    String rule();

    /**
     * The matched source text.
     */
    String text();

    /**
     * Nodes produced inside this one, in source order.
     */
    List<CstNode> children();

    default Optional<CstNode> firstChild() {
        var children = children();
        return children.isEmpty()
               ? Optional.empty()
               : Optional.of(children.get(0));
    }

    default Optional<CstNode> lastChild() {
        var children = children();
        return children.isEmpty()
               ? Optional.empty()
               : Optional.of(children.get(children.size() - 1));
    }

    /**
     * Create a node for a rule application, choosing the leaf form when nothing was produced inside.
     */
    static CstNode of(SourceSpan span, String rule, String text, List<CstNode> children) {
        return children.isEmpty()
               ? new Terminal(span, rule, text)
               : new NonTerminal(span, rule, text, List.copyOf(children));
    }

    /**
     * Terminal node - a rule that matched text without producing nested nodes.
     */
    record Terminal(
    SourceSpan span,
    String rule,
    String text) implements CstNode {
        @Override
        public List<CstNode> children() {
            return List.of();
        }
    }

    /**
     * Non-terminal node - an interior node with children.
     */
    record NonTerminal(
    SourceSpan span,
    String rule,
    String text,
    List<CstNode> children) implements CstNode {}
}
