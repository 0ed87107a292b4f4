package org.alani.compiler.ast;

import org.alani.compiler.error.AlaniCompileException;
import org.alani.compiler.error.CompilerError;
import org.alani.peg.tree.SourceSpan;

/**
 * Restricts a built node to what a quantifier may repeat.
 */
public final class ExpressionNarrower {
    private ExpressionNarrower() {}

    /**
     * @param span span of the quantifier, reported on failure
     */
    public static Expression narrow(AlaniAstNode node, SourceSpan span) throws AlaniCompileException {
        if (node instanceof AlaniAstNode.Atom atom) {
            return new Expression.Atom(atom.text());
        }
        if (node instanceof AlaniAstNode.SymbolNode symbol) {
            return new Expression.SymbolNode(symbol.symbol());
        }
        if (node instanceof AlaniAstNode.QuantifierNode) {
            throw new AlaniCompileException(new CompilerError.UnexpectedQuantifierInQuantifier(span));
        }
        throw new AlaniCompileException(new CompilerError.UnexpectedSkippedNodeInQuantifier(span));
    }
}
