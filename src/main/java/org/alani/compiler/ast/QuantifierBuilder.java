package org.alani.compiler.ast;

import org.alani.compiler.error.AlaniCompileException;
import org.alani.compiler.error.CompilerError;
import org.alani.compiler.syntax.AlaniRule;
import org.alani.peg.tree.CstNode;

/**
 * Builds a {@link Quantifier} from a {@code Quantifier} token.
 *
 * <p>The token has a {@code Quantity} first child and the operand as its last child.
 * The quantity's first child names the kind: {@code Some}, {@code Any}, {@code Option},
 * {@code Over}, {@code Amount} or {@code QuantityRange}.
 */
public final class QuantifierBuilder {
    public static final String LAZY = "lazy";

    private final NodeBuilder operandBuilder;

    /**
     * @param operandBuilder builds the operand before it is narrowed to an {@link Expression}
     */
    public QuantifierBuilder(NodeBuilder operandBuilder) {
        this.operandBuilder = operandBuilder;
    }

    public Quantifier build(CstNode token, Environment environment) throws AlaniCompileException {
        var quantity = Tokens.firstInner(token);
        var kindToken = Tokens.firstInner(quantity);
        var operand = operandBuilder.build(Tokens.lastInner(token), environment);
        var expression = ExpressionNarrower.narrow(operand, token.span());
        var lazy = quantity.text()
                           .startsWith(LAZY);
        return new Quantifier(kindOf(kindToken), lazy, expression);
    }

    static QuantifierKind kindOf(CstNode kindToken) throws AlaniCompileException {
        var rule = AlaniRule.of(kindToken.rule())
                            .orElseThrow(() -> unrecognized(kindToken));
        switch (rule) {
            case SOME:
                return QuantifierKind.SOME;
            case ANY:
                return QuantifierKind.ANY;
            case OPTION:
                return QuantifierKind.OPTION;
            case OVER:
                return new QuantifierKind.Over(count(Tokens.firstInner(kindToken)));
            case AMOUNT:
                return new QuantifierKind.Amount(count(Tokens.firstInner(kindToken)));
            case QUANTITY_RANGE:
                return range(kindToken);
            default:
                throw unrecognized(kindToken);
        }
    }

    private static QuantifierKind range(CstNode kindToken) throws AlaniCompileException {
        var start = count(Tokens.firstInner(kindToken));
        var end = count(Tokens.lastInner(kindToken));
        if (start > end) {
            throw new AlaniCompileException(new CompilerError.InvalidQuantifierRange(start, end, kindToken.span()));
        }
        return new QuantifierKind.Range(start, end);
    }

    private static int count(CstNode number) throws AlaniCompileException {
        try {
            return Integer.parseInt(number.text());
        } catch (NumberFormatException e) {
            throw new AlaniCompileException(new CompilerError.InvalidQuantity(number.text(), number.span()), e);
        }
    }

    private static AlaniCompileException unrecognized(CstNode token) {
        return new AlaniCompileException(new CompilerError.UnrecognizedSyntax(token.rule(), token.span()));
    }
}
