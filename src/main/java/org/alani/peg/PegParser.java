package org.alani.peg;

import org.alani.peg.error.ParseException;
import org.alani.peg.grammar.Grammar;
import org.alani.peg.grammar.GrammarParser;
import org.alani.peg.parser.Parser;
import org.alani.peg.parser.ParserConfig;
import org.alani.peg.parser.PegEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for creating PEG parsers.
 *
 * <p>Example usage:
 * <pre>{@code
 * var parser = PegParser.fromGrammar("""
 *     Sum <- Number ('+' Number)*
 *     Number <- < [0-9]+ >
 *     %whitespace <- [ \\t]*
 *     """);
 *
 * var root = parser.parseCst("1 + 2");
 * }</pre>
 */
public final class PegParser {
    private static final Logger log = LoggerFactory.getLogger(PegParser.class);

    private PegParser() {}

    /**
     * Create a parser from grammar text.
     */
    public static Parser fromGrammar(String grammarText) throws ParseException {
        return fromGrammar(grammarText, ParserConfig.DEFAULT);
    }

    /**
     * Create a parser from grammar text with custom configuration.
     */
    public static Parser fromGrammar(String grammarText, ParserConfig config) throws ParseException {
        return fromGrammar(GrammarParser.parse(grammarText), config);
    }

    /**
     * Create a parser from a pre-parsed grammar.
     */
    public static Parser fromGrammar(Grammar grammar) throws ParseException {
        return fromGrammar(grammar, ParserConfig.DEFAULT);
    }

    /**
     * Create a parser from a pre-parsed grammar with custom configuration.
     */
    public static Parser fromGrammar(Grammar grammar, ParserConfig config) throws ParseException {
        grammar.validate();
        log.debug("Created parser for {} rules, config {}", grammar.rules().size(), config);
        return PegEngine.create(grammar, config);
    }

    /**
     * Create a builder for more complex parser configuration.
     */
    public static Builder builder(String grammarText) {
        return new Builder(grammarText);
    }

    public static final class Builder {
        private final String grammarText;
        private boolean packratEnabled = ParserConfig.DEFAULT.packratEnabled();
        private int maxInputLength = ParserConfig.DEFAULT.maxInputLength();
        private int maxDepth = ParserConfig.DEFAULT.maxDepth();

        private Builder(String grammarText) {
            this.grammarText = grammarText;
        }

        public Builder packrat(boolean enabled) {
            this.packratEnabled = enabled;
            return this;
        }

        public Builder maxInputLength(int maxInputLength) {
            this.maxInputLength = maxInputLength;
            return this;
        }

        public Builder maxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
            return this;
        }

        public Parser build() throws ParseException {
            return fromGrammar(grammarText, new ParserConfig(packratEnabled, maxInputLength, maxDepth));
        }
    }
}
