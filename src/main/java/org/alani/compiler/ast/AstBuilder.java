package org.alani.compiler.ast;

import org.alani.compiler.error.AlaniCompileException;
import org.alani.compiler.error.CompilerError;
import org.alani.compiler.syntax.AlaniRule;
import org.alani.peg.tree.CstNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts the Alani token tree into an {@link AlaniAst}, depth first and left to right.
 * The first failure aborts the conversion.
 */
public final class AstBuilder implements NodeBuilder {
    private final QuantifierBuilder quantifiers = new QuantifierBuilder(this);

    /**
     * Build the root from the token source output. End of input markers are dropped,
     * so the root holds exactly one node per top-level construct.
     */
    public AlaniAst buildRoot(List<CstNode> tokens, Environment environment) throws AlaniCompileException {
        return buildRoot(tokens, environment, this);
    }

    /**
     * Build the root, handing every top-level token to {@code nodes} with the same environment.
     */
    static AlaniAst buildRoot(List<CstNode> tokens,
                              Environment environment,
                              NodeBuilder nodes) throws AlaniCompileException {
        if (tokens.isEmpty()) {
            throw new AlaniCompileException(new CompilerError.MissingRootNode());
        }
        var built = new ArrayList<AlaniAstNode>();
        for (var child : tokens.get(0).children()) {
            var node = nodes.build(child, environment);
            if (!(node instanceof AlaniAstNode.Skip)) {
                built.add(node);
            }
        }
        return new AlaniAst.Root(built);
    }

    @Override
    public AlaniAstNode build(CstNode token, Environment environment) throws AlaniCompileException {
        var rule = AlaniRule.of(token.rule())
                            .orElseThrow(() -> unrecognized(token));
        switch (rule) {
            case RAW:
                return new AlaniAstNode.Atom(TextUnescaper.unescapeRaw(delimitedText(token)));
            case LITERAL:
                return new AlaniAstNode.Atom(TextUnescaper.unescapeLiteral(delimitedText(token)));
            case SYMBOL:
                return new AlaniAstNode.SymbolNode(SymbolResolver.resolve(token));
            case QUANTIFIER:
                return new AlaniAstNode.QuantifierNode(quantifiers.build(token, environment));
            case EOI:
                return AlaniAstNode.SKIP;
            default:
                // Groups, assertions, ranges, character classes and variables have no AST form yet
                throw unrecognized(token);
        }
    }

    /**
     * Text of a raw or quoted token, which must still carry its opening and closing delimiter.
     */
    private static String delimitedText(CstNode token) throws AlaniCompileException {
        var text = token.text();
        if (text.length() < 2) {
            throw new AlaniCompileException(new CompilerError.MissingNode(token.rule(), token.span()));
        }
        return text;
    }

    private static AlaniCompileException unrecognized(CstNode token) {
        return new AlaniCompileException(new CompilerError.UnrecognizedSyntax(token.rule(), token.span()));
    }
}
