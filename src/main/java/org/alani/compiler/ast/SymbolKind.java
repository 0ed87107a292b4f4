package org.alani.compiler.ast;

import java.util.Arrays;
import java.util.Optional;

public enum SymbolKind {
    SPACE("space"),
    NEWLINE("newline"),
    VERTICAL("vertical"),
    WORD("word"),
    DIGIT("digit"),
    WHITESPACE("whitespace"),
    BOUNDARY("boundary"),
    ALPHABETIC("alphabetic"),
    ALPHANUMERIC("alphanumeric"),
    RETURN("return"),
    TAB("tab"),
    NULL("null"),
    CHAR("char"),
    FEED("feed"),
    BACKSPACE("backspace");

    private final String keyword;

    SymbolKind(String keyword) {
        this.keyword = keyword;
    }

    /**
     * The name written between angle brackets in source.
     */
    public String keyword() {
        return keyword;
    }

    public static Optional<SymbolKind> fromKeyword(String keyword) {
        return Arrays.stream(values())
                     .filter(kind -> kind.keyword.equals(keyword))
                     .findFirst();
    }
}
