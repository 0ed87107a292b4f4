package org.alani.compiler.syntax;

import org.alani.compiler.error.AlaniCompileException;
import org.alani.compiler.error.CompilerError;
import org.alani.peg.PegParser;
import org.alani.peg.error.ParseException;
import org.alani.peg.grammar.Grammar;
import org.alani.peg.grammar.GrammarParser;
import org.alani.peg.parser.Parser;
import org.alani.peg.parser.ParserConfig;
import org.alani.peg.tree.CstNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Token source for Alani: parses source text with the bundled Alani grammar.
 *
 * <p>A successful parse yields a single {@code Root} token whose children are the
 * top-level constructs followed by {@code EOI}.
 */
public final class AlaniSyntax {
    public static final String GRAMMAR_RESOURCE = "/org/alani/compiler/syntax/alani.peg";

    private static final Logger log = LoggerFactory.getLogger(AlaniSyntax.class);
    private static final Grammar GRAMMAR = loadGrammar();

    private final Parser parser;

    private AlaniSyntax(Parser parser) {
        this.parser = parser;
    }

    public static AlaniSyntax create() {
        return create(ParserConfig.DEFAULT);
    }

    public static AlaniSyntax create(ParserConfig config) {
        try {
            return new AlaniSyntax(PegParser.fromGrammar(GRAMMAR, config));
        } catch (ParseException e) {
            throw new IllegalStateException("Bundled Alani grammar is invalid: " + e.getMessage(), e);
        }
    }

    /**
     * The parsed Alani grammar.
     */
    public static Grammar grammar() {
        return GRAMMAR;
    }

    /**
     * Parse source text into its token tree.
     *
     * @throws AlaniCompileException with {@link CompilerError.SyntaxError} if the grammar rejects the text
     */
    public List<CstNode> tokenize(String source) throws AlaniCompileException {
        try {
            return parser.parse(source);
        } catch (ParseException e) {
            throw new AlaniCompileException(new CompilerError.SyntaxError(e.error()), e);
        }
    }

    private static Grammar loadGrammar() {
        try (InputStream in = AlaniSyntax.class.getResourceAsStream(GRAMMAR_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Grammar resource not found: " + GRAMMAR_RESOURCE);
            }
            var grammar = GrammarParser.parse(new String(in.readAllBytes(), StandardCharsets.UTF_8));
            log.debug("Loaded Alani grammar with {} rules", grammar.rules().size());
            return grammar;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + GRAMMAR_RESOURCE, e);
        } catch (ParseException e) {
            throw new IllegalStateException("Cannot parse " + GRAMMAR_RESOURCE + ": " + e.getMessage(), e);
        }
    }
}
