package org.alani.compiler.ast;

import org.alani.compiler.error.AlaniCompileException;
import org.alani.compiler.error.CompilerError;
import org.alani.peg.tree.SourceLocation;
import org.alani.peg.tree.SourceSpan;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ExpressionNarrowerTest {

    private static final SourceSpan SPAN = SourceSpan.at(SourceLocation.START);

    @Test
    void narrow_atom_becomesExpressionAtom() throws AlaniCompileException {
        assertEquals(new Expression.Atom("x"), ExpressionNarrower.narrow(new AlaniAstNode.Atom("x"), SPAN));
    }

    @Test
    void narrow_symbol_becomesExpressionSymbol() throws AlaniCompileException {
        var symbol = Symbol.negated(SymbolKind.TAB);

        assertEquals(new Expression.SymbolNode(symbol),
                     ExpressionNarrower.narrow(new AlaniAstNode.SymbolNode(symbol), SPAN));
    }

    @Test
    void narrow_quantifier_fails() {
        var nested = new AlaniAstNode.QuantifierNode(
            new Quantifier(QuantifierKind.SOME, false, new Expression.Atom("x")));

        var exception = assertThrows(AlaniCompileException.class, () -> ExpressionNarrower.narrow(nested, SPAN));

        var error = assertInstanceOf(CompilerError.UnexpectedQuantifierInQuantifier.class, exception.error());
        assertEquals(SPAN, error.span());
    }

    @Test
    void narrow_skip_fails() {
        var exception = assertThrows(AlaniCompileException.class,
                                     () -> ExpressionNarrower.narrow(AlaniAstNode.SKIP, SPAN));

        assertInstanceOf(CompilerError.UnexpectedSkippedNodeInQuantifier.class, exception.error());
    }
}
