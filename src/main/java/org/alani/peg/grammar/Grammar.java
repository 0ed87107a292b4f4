package org.alani.peg.grammar;

import org.alani.peg.error.ParseError;
import org.alani.peg.error.ParseException;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * A complete PEG grammar - collection of rules with directives.
 */
public record Grammar(
 List<Rule> rules,
 Optional<Expression> whitespace) {
    /**
     * Get rule by name.
     */
    public Optional<Rule> rule(String name) {
        return rules.stream()
                    .filter(r -> r.name()
                                  .equals(name))
                    .findFirst();
    }

    /**
     * The start rule is the first rule of the grammar.
     */
    public Optional<Rule> startRule() {
        return rules.isEmpty()
               ? Optional.empty()
               : Optional.of(rules.get(0));
    }

    /**
     * Build a lookup map for efficient rule access.
     */
    public Map<String, Rule> ruleMap() {
        return rules.stream()
                    .collect(Collectors.toMap(Rule::name, Function.identity()));
    }

    /**
     * Validate the grammar for duplicate rules and undefined references.
     */
    public Grammar validate() throws ParseException {
        var ruleNames = new HashSet<String>();
        for (var rule : rules) {
            if (!ruleNames.add(rule.name())) {
                throw new ParseException(new ParseError.SemanticError(
                rule.span()
                    .start(),
                "Duplicate rule: '" + rule.name() + "'"));
            }
        }
        for (var rule : rules) {
            var undefinedRef = findUndefinedReference(rule.expression(), ruleNames);
            if (undefinedRef.isPresent()) {
                var ref = undefinedRef.get();
                throw new ParseException(new ParseError.SemanticError(
                ref.span()
                   .start(),
                "Undefined rule reference: '" + ref.ruleName() + "'"));
            }
        }
        if (whitespace.isPresent()) {
            var undefinedRef = findUndefinedReference(whitespace.get(), ruleNames);
            if (undefinedRef.isPresent()) {
                var ref = undefinedRef.get();
                throw new ParseException(new ParseError.SemanticError(
                ref.span()
                   .start(),
                "Undefined rule reference in %whitespace: '" + ref.ruleName() + "'"));
            }
        }
        return this;
    }

    /**
     * Recursively find the first undefined rule reference in an expression.
     */
    private Optional<Expression.Reference> findUndefinedReference(Expression expr, Set<String> ruleNames) {
        if (expr instanceof Expression.Reference ref) {
            return ruleNames.contains(ref.ruleName())
                   ? Optional.empty()
                   : Optional.of(ref);
        }
        if (expr instanceof Expression.Sequence seq) {
            return firstUndefined(seq.elements(), ruleNames);
        }
        if (expr instanceof Expression.Choice choice) {
            return firstUndefined(choice.alternatives(), ruleNames);
        }
        return inner(expr).flatMap(e -> findUndefinedReference(e, ruleNames));
    }

    private Optional<Expression.Reference> firstUndefined(List<Expression> expressions, Set<String> ruleNames) {
        return expressions.stream()
                          .map(e -> findUndefinedReference(e, ruleNames))
                          .flatMap(Optional::stream)
                          .findFirst();
    }

    /**
     * The single nested expression of a unary operator; terminals have none.
     */
    private static Optional<Expression> inner(Expression expr) {
        if (expr instanceof Expression.ZeroOrMore zom) {
            return Optional.of(zom.expression());
        }
        if (expr instanceof Expression.OneOrMore oom) {
            return Optional.of(oom.expression());
        }
        if (expr instanceof Expression.Optional opt) {
            return Optional.of(opt.expression());
        }
        if (expr instanceof Expression.Repetition rep) {
            return Optional.of(rep.expression());
        }
        if (expr instanceof Expression.And and) {
            return Optional.of(and.expression());
        }
        if (expr instanceof Expression.Not not) {
            return Optional.of(not.expression());
        }
        if (expr instanceof Expression.TokenBoundary tb) {
            return Optional.of(tb.expression());
        }
        if (expr instanceof Expression.Ignore ign) {
            return Optional.of(ign.expression());
        }
        if (expr instanceof Expression.Group grp) {
            return Optional.of(grp.expression());
        }
        // Terminals - no nested expressions
        return Optional.empty();
    }
}
