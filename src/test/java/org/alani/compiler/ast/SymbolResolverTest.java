package org.alani.compiler.ast;

import org.alani.compiler.error.AlaniCompileException;
import org.alani.compiler.error.CompilerError;
import org.alani.peg.tree.CstNode;
import org.alani.peg.tree.SourceLocation;
import org.alani.peg.tree.SourceSpan;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SymbolResolverTest {

    private static final SourceSpan SPAN = SourceSpan.at(SourceLocation.START);

    @Test
    void resolve_plainName_isNotNegated() throws AlaniCompileException {
        assertEquals(Symbol.of(SymbolKind.WHITESPACE), SymbolResolver.resolve(symbol("whitespace")));
    }

    @Test
    void resolve_negatedName_isNegated() throws AlaniCompileException {
        assertEquals(Symbol.negated(SymbolKind.BOUNDARY), SymbolResolver.resolve(negatedSymbol("boundary")));
    }

    @Test
    void resolve_everyKeyword_resolvesToItsKind() throws AlaniCompileException {
        for (var kind : SymbolKind.values()) {
            assertEquals(kind, SymbolResolver.resolve(symbol(kind.keyword())).kind());
        }
    }

    @Test
    void resolve_negatedStart_fails() {
        var exception = assertThrows(AlaniCompileException.class,
                                     () -> SymbolResolver.resolve(negatedSymbol("start")));

        assertInstanceOf(CompilerError.NegativeStartNotAllowed.class, exception.error());
    }

    @Test
    void resolve_negatedEnd_fails() {
        var exception = assertThrows(AlaniCompileException.class,
                                     () -> SymbolResolver.resolve(negatedSymbol("end")));

        assertInstanceOf(CompilerError.NegativeEndNotAllowed.class, exception.error());
    }

    @Test
    void resolve_bareAnchor_isUnrecognized() {
        var exception = assertThrows(AlaniCompileException.class, () -> SymbolResolver.resolve(symbol("start")));

        var error = assertInstanceOf(CompilerError.UnrecognizedSymbol.class, exception.error());
        assertEquals("start", error.name());
    }

    @Test
    void resolve_unknownName_isUnrecognized() {
        var exception = assertThrows(AlaniCompileException.class, () -> SymbolResolver.resolve(symbol("vowel")));

        assertInstanceOf(CompilerError.UnrecognizedSymbol.class, exception.error());
    }

    @Test
    void resolve_tokenWithoutChildren_failsWithMissingNode() {
        var empty = CstNode.of(SPAN, "Symbol", "<>", List.of());

        var exception = assertThrows(AlaniCompileException.class, () -> SymbolResolver.resolve(empty));

        var error = assertInstanceOf(CompilerError.MissingNode.class, exception.error());
        assertEquals("Symbol", error.rule());
    }

    private static CstNode symbol(String name) {
        return CstNode.of(SPAN, "Symbol", "<" + name + ">", List.of(token("SymbolName", name)));
    }

    private static CstNode negatedSymbol(String name) {
        return CstNode.of(SPAN, "Symbol", "not <" + name + ">",
                          List.of(token("Negation", "not"), token("SymbolName", name)));
    }

    private static CstNode token(String rule, String text) {
        return CstNode.of(SPAN, rule, text, List.of());
    }
}
