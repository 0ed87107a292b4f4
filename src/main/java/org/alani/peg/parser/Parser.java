package org.alani.peg.parser;

import org.alani.peg.error.ParseException;
import org.alani.peg.tree.CstNode;

import java.util.List;

/**
 * Parser interface - parses input text according to a grammar.
 */
public interface Parser {

    /**
     * Parse the whole input with the start rule and return the top-level nodes it produced.
     * A regular start rule yields a single node; an inline one yields its children.
     */
    List<CstNode> parse(String input) throws ParseException;

    /**
     * Parse the whole input starting from a specific rule.
     */
    List<CstNode> parse(String input, String startRule) throws ParseException;

    /**
     * Parse input and return the single root node produced by the start rule.
     */
    CstNode parseCst(String input) throws ParseException;
}
