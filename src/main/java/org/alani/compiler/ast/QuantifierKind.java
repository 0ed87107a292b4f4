package org.alani.compiler.ast;

/**
 * Repetition count of a quantifier.
 */
public sealed interface QuantifierKind {
    Some SOME = new Some();
    Any ANY = new Any();
    Option OPTION = new Option();

    /**
     * Between {@code start} and {@code end} repetitions, both inclusive.
     */
    record Range(int start, int end) implements QuantifierKind {
        public Range {
            requireCount(start);
            requireCount(end);
            if (start > end) {
                throw new IllegalArgumentException("Range start " + start + " is after end " + end);
            }
        }
    }

    /**
     * One or more.
     */
    record Some() implements QuantifierKind {}

    /**
     * Zero or more.
     */
    record Any() implements QuantifierKind {}

    /**
     * More than {@code count} repetitions.
     */
    record Over(int count) implements QuantifierKind {
        public Over {
            requireCount(count);
        }
    }

    /**
     * Zero or one.
     */
    record Option() implements QuantifierKind {}

    /**
     * Exactly {@code count} repetitions.
     */
    record Amount(int count) implements QuantifierKind {
        public Amount {
            requireCount(count);
        }
    }

    private static void requireCount(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("Repetition count must not be negative, got " + count);
        }
    }
}
