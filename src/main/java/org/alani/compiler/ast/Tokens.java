package org.alani.compiler.ast;

import org.alani.compiler.error.AlaniCompileException;
import org.alani.compiler.error.CompilerError;
import org.alani.peg.tree.CstNode;

/**
 * Child access for tokens whose shape the builders rely on.
 */
final class Tokens {
    private Tokens() {}

    static CstNode firstInner(CstNode token) throws AlaniCompileException {
        return token.firstChild()
                    .orElseThrow(() -> missing(token));
    }

    static CstNode lastInner(CstNode token) throws AlaniCompileException {
        return token.lastChild()
                    .orElseThrow(() -> missing(token));
    }

    private static AlaniCompileException missing(CstNode token) {
        return new AlaniCompileException(new CompilerError.MissingNode(token.rule(), token.span()));
    }
}
