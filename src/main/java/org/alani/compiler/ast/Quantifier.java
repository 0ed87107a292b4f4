package org.alani.compiler.ast;

/**
 * Repetition of an expression.
 *
 * @param kind       how many times the expression repeats
 * @param lazy       match as few repetitions as possible
 * @param expression the repeated expression
 */
public record Quantifier(QuantifierKind kind, boolean lazy, Expression expression) {}
