package org.alani.compiler.ast;

import org.alani.compiler.error.AlaniCompileException;
import org.alani.compiler.error.CompilerError;
import org.alani.peg.tree.CstNode;

/**
 * Resolves a {@code Symbol} token into a {@link Symbol}.
 */
public final class SymbolResolver {
    static final String NEGATION = "not";
    static final String START = "start";
    static final String END = "end";

    private SymbolResolver() {}

    /**
     * The first child is the negation when present, the last child is always the name.
     * Anchors cannot be negated; bare anchors are not symbols either.
     */
    public static Symbol resolve(CstNode token) throws AlaniCompileException {
        var first = Tokens.firstInner(token)
                          .text();
        var name = Tokens.lastInner(token)
                         .text();
        var negated = NEGATION.equals(first);

        if (negated && START.equals(name)) {
            throw new AlaniCompileException(new CompilerError.NegativeStartNotAllowed(token.span()));
        }
        if (negated && END.equals(name)) {
            throw new AlaniCompileException(new CompilerError.NegativeEndNotAllowed(token.span()));
        }
        return SymbolKind.fromKeyword(name)
                         .map(kind -> new Symbol(kind, negated))
                         .orElseThrow(() -> new AlaniCompileException(
                         new CompilerError.UnrecognizedSymbol(name, token.span())));
    }
}
