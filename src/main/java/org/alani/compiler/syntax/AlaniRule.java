package org.alani.compiler.syntax;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Rules of the Alani grammar that appear as tokens.
 */
public enum AlaniRule {
    ROOT("Root"),
    QUANTIFIER("Quantifier"),
    QUANTITY("Quantity"),
    QUANTITY_RANGE("QuantityRange"),
    OVER("Over"),
    SOME("Some"),
    ANY("Any"),
    OPTION("Option"),
    AMOUNT("Amount"),
    NUMBER("Number"),
    GROUP("Group"),
    ASSERTION("Assertion"),
    NEGATIVE_CHAR_CLASS("NegativeCharClass"),
    RANGE("Range"),
    RAW("Raw"),
    LITERAL("Literal"),
    SYMBOL("Symbol"),
    NEGATION("Negation"),
    SYMBOL_NAME("SymbolName"),
    VARIABLE_INVOCATION("VariableInvocation"),
    VARIABLE_DECLARATION("VariableDeclaration"),
    IDENTIFIER("Identifier"),
    EOI("EOI");

    private static final Map<String, AlaniRule> BY_NAME = Arrays.stream(values())
                                                                .collect(Collectors.toMap(AlaniRule::ruleName,
                                                                                          Function.identity()));

    private final String ruleName;

    AlaniRule(String ruleName) {
        this.ruleName = ruleName;
    }

    /**
     * Name of the rule in the grammar.
     */
    public String ruleName() {
        return ruleName;
    }

    public static Optional<AlaniRule> of(String ruleName) {
        return Optional.ofNullable(BY_NAME.get(ruleName));
    }
}
