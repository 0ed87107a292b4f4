package org.alani.peg.grammar;

import org.alani.peg.tree.SourceLocation;
import org.alani.peg.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * Lexer for PEG grammar syntax.
 */
public final class GrammarLexer {
    private static final int MAX_INPUT_SIZE = 1_000_000;
    private static final int DEFAULT_TOKEN_CAPACITY = 32;

    private final String input;
    private int pos;
    private int line;
    private int column;

    private GrammarLexer(String input) {
        this.input = input;
        this.pos = 0;
        this.line = 1;
        this.column = 1;
    }

    public static List<GrammarToken> tokenize(String input) {
        if (input.length() > MAX_INPUT_SIZE) {
            throw new IllegalArgumentException(
            "Grammar input exceeds maximum size of " + MAX_INPUT_SIZE + " characters");
        }
        return new GrammarLexer(input).tokenizeAll();
    }

    private List<GrammarToken> tokenizeAll() {
        var tokens = new ArrayList<GrammarToken>();
        while (!isAtEnd()) {
            skipWhitespaceAndComments();
            if (!isAtEnd()) {
                tokens.add(nextToken());
            }
        }
        tokens.add(new GrammarToken.Eof(currentSpan()));
        return tokens;
    }

    private GrammarToken nextToken() {
        var start = currentLocation();
        char c = peek();
        if (isIdentifierStart(c)) {
            return scanIdentifier(start);
        }
        // Directives %name
        if (c == '%') {
            return scanDirective(start);
        }
        if (c == '\'' || c == '"') {
            return scanStringLiteral(start);
        }
        if (c == '[') {
            return scanCharClass(start);
        }
        // Numbers only appear inside repetition braces
        if (isDigit(c)) {
            return scanNumber(start);
        }
        return scanOperator(start);
    }

    private GrammarToken scanIdentifier(SourceLocation start) {
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && isIdentifierPart(peek())) {
            sb.append(advance());
        }
        return new GrammarToken.Identifier(span(start), sb.toString());
    }

    private GrammarToken scanDirective(SourceLocation start) {
        // skip %
        advance();
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && isIdentifierPart(peek())) {
            sb.append(advance());
        }
        if (sb.length() == 0) {
            return new GrammarToken.Error(span(start), "Missing directive name after '%'");
        }
        return new GrammarToken.Directive(span(start), sb.toString());
    }

    private GrammarToken scanStringLiteral(SourceLocation start) {
        char quote = advance();
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && peek() != quote) {
            if (peek() == '\\' && pos + 1 < input.length()) {
                // skip backslash
                advance();
                sb.append(scanEscapeSequence());
            } else {
                sb.append(advance());
            }
        }
        if (isAtEnd()) {
            return new GrammarToken.Error(span(start), "Unterminated string literal");
        }
        // skip closing quote
        advance();
        boolean caseInsensitive = !isAtEnd() && peek() == 'i' && !isIdentifierPart(peekAt(1));
        if (caseInsensitive) {
            advance();
        }
        return new GrammarToken.StringLiteral(span(start), sb.toString(), caseInsensitive);
    }

    private GrammarToken scanCharClass(SourceLocation start) {
        // skip [
        advance();
        boolean negated = false;
        if (!isAtEnd() && peek() == '^') {
            negated = true;
            advance();
        }
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && peek() != ']') {
            if (peek() == '\\' && pos + 1 < input.length()) {
                sb.append(advance());
                char escaped = advance();
                sb.append(escaped);
                // Preserve full hex/unicode escape sequences
                if (escaped == 'x' && pos + 2 <= input.length()) {
                    sb.append(advance());
                    sb.append(advance());
                } else if (escaped == 'u' && pos + 4 <= input.length()) {
                    for (int i = 0; i < 4; i++) {
                        sb.append(advance());
                    }
                }
            } else {
                sb.append(advance());
            }
        }
        if (isAtEnd()) {
            return new GrammarToken.Error(span(start), "Unterminated character class");
        }
        // skip ]
        advance();
        boolean caseInsensitive = !isAtEnd() && peek() == 'i' && !isIdentifierPart(peekAt(1));
        if (caseInsensitive) {
            advance();
        }
        return new GrammarToken.CharClassLiteral(span(start), sb.toString(), negated, caseInsensitive);
    }

    private GrammarToken scanNumber(SourceLocation start) {
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && isDigit(peek())) {
            sb.append(advance());
        }
        try {
            return new GrammarToken.Number(span(start), Integer.parseInt(sb.toString()));
        } catch (NumberFormatException e) {
            return new GrammarToken.Error(span(start), "Repetition bound too large: " + sb);
        }
    }

    private GrammarToken scanOperator(SourceLocation start) {
        char c = advance();
        return switch (c) {
            case '<' -> {
                if (!isAtEnd() && peek() == '-') {
                    advance();
                    yield new GrammarToken.LeftArrow(span(start));
                }
                yield new GrammarToken.LAngle(span(start));
            }
            case '←' -> new GrammarToken.LeftArrow(span(start));
            case '/' -> new GrammarToken.Slash(span(start));
            case '&' -> new GrammarToken.Ampersand(span(start));
            case '!' -> new GrammarToken.Exclamation(span(start));
            case '?' -> new GrammarToken.Question(span(start));
            case '*' -> new GrammarToken.Star(span(start));
            case '+' -> new GrammarToken.Plus(span(start));
            case '.' -> new GrammarToken.Dot(span(start));
            case '~' -> new GrammarToken.Tilde(span(start));
            case '(' -> new GrammarToken.LParen(span(start));
            case ')' -> new GrammarToken.RParen(span(start));
            case '>' -> new GrammarToken.RAngle(span(start));
            case '{' -> new GrammarToken.LBrace(span(start));
            case '}' -> new GrammarToken.RBrace(span(start));
            case ',' -> new GrammarToken.Comma(span(start));
            default -> new GrammarToken.Error(span(start), "Unexpected character: " + c);
        };
    }

    private char scanEscapeSequence() {
        if (isAtEnd()) {
            return '\\';
        }
        char c = advance();
        return switch (c) {
            case 'n' -> '\n';
            case 'r' -> '\r';
            case 't' -> '\t';
            case '0' -> '\0';
            // hex escape
            case 'x' -> scanHexEscape(2);
            // unicode escape
            case 'u' -> scanHexEscape(4);
            // covers \\ \' \" and any other escaped character
            default -> c;
        };
    }

    private char scanHexEscape(int digits) {
        char fallback = digits == 2
                        ? 'x'
                        : 'u';
        if (pos + digits > input.length()) {
            return fallback;
        }
        var hex = input.substring(pos, pos + digits);
        try {
            var value = Integer.parseInt(hex, 16);
            pos += digits;
            column += digits;
            return (char) value;
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    private void skipWhitespaceAndComments() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ' || c == '\t' || c == '\r' || c == '\n') {
                advance();
            } else if (c == '#') {
                // Line comment
                while (!isAtEnd() && peek() != '\n') {
                    advance();
                }
            } else {
                break;
            }
        }
    }

    private boolean isAtEnd() {
        return pos >= input.length();
    }

    private char peek() {
        return input.charAt(pos);
    }

    private char peekAt(int offset) {
        return pos + offset < input.length()
               ? input.charAt(pos + offset)
               : '\0';
    }

    private char advance() {
        char c = input.charAt(pos++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private SourceLocation currentLocation() {
        return SourceLocation.at(line, column, pos);
    }

    private SourceSpan currentSpan() {
        return SourceSpan.at(currentLocation());
    }

    private SourceSpan span(SourceLocation start) {
        return SourceSpan.of(start, currentLocation());
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
