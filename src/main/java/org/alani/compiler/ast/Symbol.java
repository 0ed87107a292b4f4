package org.alani.compiler.ast;

/**
 * A named character class such as {@code <word>} or {@code not <digit>}.
 */
public record Symbol(SymbolKind kind, boolean negated) {
    public static Symbol of(SymbolKind kind) {
        return new Symbol(kind, false);
    }

    public static Symbol negated(SymbolKind kind) {
        return new Symbol(kind, true);
    }
}
