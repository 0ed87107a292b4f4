package org.alani.peg;

import org.alani.peg.error.ParseError;
import org.alani.peg.error.ParseException;
import org.alani.peg.parser.Parser;
import org.alani.peg.parser.ParserConfig;
import org.alani.peg.tree.CstNode;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class PegParserTest {

    @Test
    void parse_simpleLiteral_succeeds() throws ParseException {
        var parser = PegParser.fromGrammar("Root <- 'hello'");
        var node = parser.parseCst("hello");

        assertEquals("Root", node.rule());
        assertEquals("hello", node.text());
    }

    @Test
    void parse_simpleLiteral_failsOnMismatch() throws ParseException {
        var parser = PegParser.fromGrammar("Root <- 'hello'");

        var exception = assertThrows(ParseException.class, () -> parser.parseCst("world"));
        var error = assertInstanceOf(ParseError.UnexpectedInput.class, exception.error());
        assertEquals("w", error.found());
        assertEquals("'hello'", error.expected());
        assertEquals(1, error.location().column());
    }

    @Test
    void parse_characterClass_matchesRange() throws ParseException {
        var parser = PegParser.fromGrammar("Digit <- [0-9]");

        assertTrue(matches(parser, "5"));
        assertTrue(matches(parser, "0"));
        assertTrue(matches(parser, "9"));
        assertFalse(matches(parser, "a"));
    }

    @Test
    void parse_negatedCharClass_matchesComplement() throws ParseException {
        var parser = PegParser.fromGrammar("NonDigit <- [^0-9]");

        assertTrue(matches(parser, "a"));
        assertTrue(matches(parser, "Z"));
        assertFalse(matches(parser, "5"));
    }

    @Test
    void parse_anyChar_matchesSingle() throws ParseException {
        var parser = PegParser.fromGrammar("Any <- .");

        assertTrue(matches(parser, "a"));
        assertTrue(matches(parser, "1"));
        assertFalse(matches(parser, ""));
    }

    @Test
    void parse_sequence_matchesAll() throws ParseException {
        var parser = PegParser.fromGrammar("ABC <- 'a' 'b' 'c'");

        assertTrue(matches(parser, "abc"));
        assertFalse(matches(parser, "ab"));
        assertFalse(matches(parser, "abd"));
    }

    @Test
    void parse_choice_matchesFirst() throws ParseException {
        var parser = PegParser.fromGrammar("Choice <- 'a' / 'b' / 'c'");

        assertTrue(matches(parser, "a"));
        assertTrue(matches(parser, "b"));
        assertTrue(matches(parser, "c"));
        assertFalse(matches(parser, "d"));
    }

    @Test
    void parse_zeroOrMore_matchesNone() throws ParseException {
        var parser = PegParser.fromGrammar("Stars <- 'a'*");

        assertTrue(matches(parser, ""));
        assertTrue(matches(parser, "a"));
        assertTrue(matches(parser, "aaa"));
    }

    @Test
    void parse_oneOrMore_requiresAtLeastOne() throws ParseException {
        var parser = PegParser.fromGrammar("Plus <- 'a'+");

        assertFalse(matches(parser, ""));
        assertTrue(matches(parser, "a"));
        assertTrue(matches(parser, "aaa"));
    }

    @Test
    void parse_optional_matchesZeroOrOne() throws ParseException {
        var parser = PegParser.fromGrammar("Opt <- 'a'?");

        assertTrue(matches(parser, ""));
        assertTrue(matches(parser, "a"));
        assertFalse(matches(parser, "aa"));
    }

    @Test
    void parse_repetition_matchesExact() throws ParseException {
        var parser = PegParser.fromGrammar("Rep <- 'a'{3}");

        assertTrue(matches(parser, "aaa"));
        assertFalse(matches(parser, "aa"));
        assertFalse(matches(parser, "aaaa"));
    }

    @Test
    void parse_repetition_matchesRange() throws ParseException {
        var parser = PegParser.fromGrammar("Rep <- 'a'{2,4}");

        assertFalse(matches(parser, "a"));
        assertTrue(matches(parser, "aa"));
        assertTrue(matches(parser, "aaa"));
        assertTrue(matches(parser, "aaaa"));
        assertFalse(matches(parser, "aaaaa"));
    }

    @Test
    void parse_andPredicate_doesNotConsume() throws ParseException {
        var parser = PegParser.fromGrammar("And <- &'a' 'a'");

        assertTrue(matches(parser, "a"));
        assertFalse(matches(parser, "b"));
    }

    @Test
    void parse_notPredicate_negates() throws ParseException {
        var parser = PegParser.fromGrammar("Not <- !'a' .");

        assertTrue(matches(parser, "b"));
        assertFalse(matches(parser, "a"));
    }

    @Test
    void parse_tokenBoundary_capturesText() throws ParseException {
        var parser = PegParser.fromGrammar("Number <- < [0-9]+ >");
        var node = parser.parseCst("123");

        assertInstanceOf(CstNode.Terminal.class, node);
        assertEquals("123", node.text());
    }

    @Test
    void parse_tokenBoundary_disablesWhitespace() throws ParseException {
        var parser = PegParser.fromGrammar("""
            Number <- < [0-9]+ >
            %whitespace <- [ ]*
            """);

        assertTrue(matches(parser, "12"));
        assertFalse(matches(parser, "1 2"));
    }

    @Test
    void parse_ruleReference_works() throws ParseException {
        var parser = PegParser.fromGrammar("""
            Root <- Digit Digit Digit
            Digit <- [0-9]
            """);

        assertTrue(matches(parser, "123"));
        assertFalse(matches(parser, "12"));
    }

    @Test
    void parse_withWhitespace_skipsSpaces() throws ParseException {
        var parser = PegParser.fromGrammar("""
            Expr <- 'a' 'b' 'c'
            %whitespace <- [ \\t]*
            """);

        assertTrue(matches(parser, "abc"));
        assertTrue(matches(parser, "a b c"));
        assertTrue(matches(parser, "a \t b\tc  "));
    }

    @Test
    void parse_whitespaceWithComments_skipsComments() throws ParseException {
        var parser = PegParser.fromGrammar("""
            List <- Word*
            Word <- < [a-z]+ >
            %whitespace <- ([ \\n]+ / '//' (!'\\n' .)*)*
            """);

        var root = parser.parseCst("ab // comment\ncd");

        assertThat(root.children()).extracting(CstNode::text)
                                   .containsExactly("ab", "cd");
    }

    @Test
    void parse_caseInsensitive_matchesBothCases() throws ParseException {
        var parser = PegParser.fromGrammar("Kw <- 'select'i");

        assertTrue(matches(parser, "select"));
        assertTrue(matches(parser, "SELECT"));
        assertTrue(matches(parser, "SeLeCt"));
    }

    @Test
    void parse_calculator_works() throws ParseException {
        var parser = PegParser.fromGrammar("""
            Expr    <- Term (('+' / '-') Term)*
            Term    <- Factor (('*' / '/') Factor)*
            Factor  <- '(' Expr ')' / Number
            Number  <- < [0-9]+ >
            %whitespace <- [ \\t]*
            """);

        assertTrue(matches(parser, "1"));
        assertTrue(matches(parser, "1+2"));
        assertTrue(matches(parser, "1 + 2"));
        assertTrue(matches(parser, "1 + 2 * 3"));
        assertTrue(matches(parser, "(1 + 2) * 3"));
        assertFalse(matches(parser, "(1 + 2 * 3"));
    }

    @Test
    void hexEscape_inLiteral() throws ParseException {
        // \x41 is 'A'
        var parser = PegParser.fromGrammar("Match <- '\\x41\\x42\\x43'");

        assertTrue(matches(parser, "ABC"));
        assertFalse(matches(parser, "abc"));
    }

    @Test
    void unicodeEscape_inCharClass() throws ParseException {
        var parser = PegParser.fromGrammar("Alpha <- [\\u03B1\\u03B2\\u03B3]+");

        assertTrue(matches(parser, "αβγ"));
        assertFalse(matches(parser, "abc"));
    }

    // === Tree Shape ===

    @Test
    void tree_onlyRulesProduceNodes() throws ParseException {
        var parser = PegParser.fromGrammar("""
            Sum <- Number ('+' Number)*
            Number <- < [0-9]+ >
            %whitespace <- [ ]*
            """);

        var root = parser.parseCst("1 + 22");

        assertEquals("Sum", root.rule());
        assertEquals("1 + 22", root.text());
        assertThat(root.children()).extracting(CstNode::rule)
                                   .containsExactly("Number", "Number");
        assertThat(root.children()).extracting(CstNode::text)
                                   .containsExactly("1", "22");
    }

    @Test
    void tree_nodeSpan_excludesLeadingWhitespace() throws ParseException {
        var parser = PegParser.fromGrammar("""
            Sum <- Number ('+' Number)*
            Number <- < [0-9]+ >
            %whitespace <- [ \\n]*
            """);

        var root = parser.parseCst("  1 +\n 22");
        var last = root.lastChild().orElseThrow();

        assertEquals("1 +\n 22", root.text());
        assertEquals(2, last.span().start().line());
        assertEquals(2, last.span().start().column());
        assertEquals("22", last.text());
    }

    @Test
    void tree_inlineRule_splicesChildrenIntoParent() throws ParseException {
        var parser = PegParser.fromGrammar("""
            List <- _Item+
            _Item <- Word / Num
            Word <- < [a-z]+ >
            Num <- < [0-9]+ >
            %whitespace <- [ ]*
            """);

        var root = parser.parseCst("ab 12 cd");

        assertThat(root.children()).extracting(CstNode::rule)
                                   .containsExactly("Word", "Num", "Word");
    }

    @Test
    void tree_ignore_dropsProducedNodes() throws ParseException {
        var parser = PegParser.fromGrammar("""
            Pair <- ~Key '=' Value
            Key <- < [a-z]+ >
            Value <- < [0-9]+ >
            """);

        var root = parser.parseCst("x=1");

        assertThat(root.children()).extracting(CstNode::rule)
                                   .containsExactly("Value");
    }

    @Test
    void tree_predicates_produceNoNodes() throws ParseException {
        var parser = PegParser.fromGrammar("""
            Root <- &Word Word !Word
            Word <- < [a-z]+ >
            """);

        var root = parser.parseCst("abc");

        assertEquals(1, root.children().size());
    }

    @Test
    void parse_inlineStartRule_returnsAllTopLevelNodes() throws ParseException {
        var parser = PegParser.fromGrammar("""
            _Items <- Word+
            Word <- < [a-z]+ >
            %whitespace <- [ ]*
            """);

        assertEquals(3, parser.parse("a b c").size());
        var exception = assertThrows(ParseException.class, () -> parser.parseCst("a b c"));
        assertInstanceOf(ParseError.SemanticError.class, exception.error());
    }

    @Test
    void parse_explicitStartRule_usesThatRule() throws ParseException {
        var parser = PegParser.fromGrammar("""
            Root <- Word '!'
            Word <- < [a-z]+ >
            """);

        var nodes = parser.parse("hey", "Word");

        assertEquals(1, nodes.size());
        assertEquals("Word", nodes.get(0).rule());
    }

    @Test
    void parse_unknownStartRule_fails() throws ParseException {
        var parser = PegParser.fromGrammar("Root <- 'a'");

        var exception = assertThrows(ParseException.class, () -> parser.parse("a", "Missing"));
        assertThat(exception.getMessage()).contains("Unknown rule: Missing");
    }

    // === Errors ===

    @Test
    void error_unexpectedEnd_reportsEof() throws ParseException {
        var parser = PegParser.fromGrammar("ABC <- 'a' 'b' 'c'");

        var exception = assertThrows(ParseException.class, () -> parser.parseCst("ab"));
        var error = assertInstanceOf(ParseError.UnexpectedEof.class, exception.error());
        assertEquals(2, error.location().offset());
        assertEquals("'c'", error.expected());
    }

    @Test
    void error_trailingInput_expectsEndOfInput() throws ParseException {
        var parser = PegParser.fromGrammar("Rep <- 'a'{3}");

        var exception = assertThrows(ParseException.class, () -> parser.parseCst("aaaa"));
        var error = assertInstanceOf(ParseError.UnexpectedInput.class, exception.error());
        assertEquals(3, error.location().offset());
        assertEquals("end of input", error.expected());
    }

    @Test
    void error_reportsFurthestFailure() throws ParseException {
        var parser = PegParser.fromGrammar("""
            Root <- 'ab' 'c' / 'a'
            """);

        // 'a' matches, then trailing input: the furthest real failure was at 'c'
        var exception = assertThrows(ParseException.class, () -> parser.parseCst("abx"));
        assertEquals(2, exception.error().location().offset());
    }

    @Test
    void error_predicateProbes_areNotReportedAsExpected() throws ParseException {
        var parser = PegParser.fromGrammar("""
            Root <- 'some' ![a-z] '!'
            """);

        var exception = assertThrows(ParseException.class, () -> parser.parseCst("some?"));
        var error = assertInstanceOf(ParseError.UnexpectedInput.class, exception.error());
        assertEquals("'!'", error.expected());
    }

    // === Grammar Validation ===

    @Test
    void fromGrammar_undefinedReference_fails() {
        var exception = assertThrows(ParseException.class, () -> PegParser.fromGrammar("Root <- Missing"));

        assertInstanceOf(ParseError.SemanticError.class, exception.error());
        assertThat(exception.getMessage()).contains("Undefined rule reference: 'Missing'");
    }

    @Test
    void fromGrammar_duplicateRule_fails() {
        var exception = assertThrows(ParseException.class, () -> PegParser.fromGrammar("""
            Root <- 'a'
            Root <- 'b'
            """));

        assertThat(exception.getMessage()).contains("Duplicate rule: 'Root'");
    }

    @Test
    void fromGrammar_undefinedReferenceInWhitespace_fails() {
        var exception = assertThrows(ParseException.class, () -> PegParser.fromGrammar("""
            Root <- 'a'
            %whitespace <- Blank*
            """));

        assertThat(exception.getMessage()).contains("%whitespace");
    }

    // === Configuration ===

    @Test
    void builder_allowsConfiguration() throws ParseException {
        var parser = PegParser.builder("Root <- 'test'")
                              .packrat(false)
                              .build();

        assertTrue(matches(parser, "test"));
    }

    @Test
    void builder_maxInputLength_rejectsLongerInput() throws ParseException {
        var parser = PegParser.builder("Root <- 'a'*")
                              .maxInputLength(3)
                              .build();

        assertTrue(matches(parser, "aaa"));
        var exception = assertThrows(ParseException.class, () -> parser.parseCst("aaaa"));
        var error = assertInstanceOf(ParseError.InputTooLarge.class, exception.error());
        assertEquals(4, error.length());
        assertEquals(3, error.limit());
    }

    @Test
    void builder_maxDepth_limitsRuleNesting() throws ParseException {
        var parser = PegParser.builder("Nest <- '(' Nest? ')'")
                              .maxDepth(4)
                              .build();

        assertTrue(matches(parser, "((()))"));
        var exception = assertThrows(ParseException.class, () -> parser.parseCst("(((())))"));
        var error = assertInstanceOf(ParseError.NestingTooDeep.class, exception.error());
        assertEquals(4, error.limit());
        assertEquals(4, error.location().offset());
    }

    @Test
    void parse_deepNesting_failsWithNestingTooDeep() throws ParseException {
        var parser = PegParser.fromGrammar("Nest <- '(' Nest? ')'");
        var input = "(".repeat(5000) + ")".repeat(5000);

        var exception = assertThrows(ParseException.class, () -> parser.parseCst(input));
        var error = assertInstanceOf(ParseError.NestingTooDeep.class, exception.error());
        assertEquals(ParserConfig.DEFAULT_MAX_DEPTH, error.limit());
    }

    @Test
    void parse_deepNestingWithoutPackrat_failsWithNestingTooDeep() throws ParseException {
        var parser = PegParser.builder("""
            Expr  <- Atom ('+' Atom)*
            Atom  <- '(' Expr ')' / [0-9]
            """).packrat(false).build();
        var input = "(".repeat(3000) + "1" + ")".repeat(3000);

        var exception = assertThrows(ParseException.class, () -> parser.parseCst(input));
        assertInstanceOf(ParseError.NestingTooDeep.class, exception.error());
    }

    @Test
    void packrat_enabledAndDisabled_produceSameTree() throws ParseException {
        var grammar = """
            Expr    <- Term (('+' / '-') Term)*
            Term    <- Factor (('*' / '/') Factor)*
            Factor  <- '(' Expr ')' / Number
            Number  <- < [0-9]+ >
            %whitespace <- [ ]*
            """;
        var input = "(1 + 2) * (3 - 4) + 5";

        var cached = PegParser.builder(grammar).packrat(true).build().parseCst(input);
        var uncached = PegParser.builder(grammar).packrat(false).build().parseCst(input);

        assertEquals(cached, uncached);
    }

    private static boolean matches(Parser parser, String input) {
        try {
            parser.parseCst(input);
            return true;
        } catch (ParseException e) {
            return false;
        }
    }
}
