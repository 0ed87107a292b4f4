package org.alani.peg.parser;

/**
 * Parser configuration options.
 *
 * @param packratEnabled memoize rule results per input position
 * @param maxInputLength longest input, in characters, the parser accepts
 * @param maxDepth       deepest nesting of rule applications the parser follows before giving up
 */
public record ParserConfig(
    boolean packratEnabled,
    int maxInputLength,
    int maxDepth
) {
    public static final int DEFAULT_MAX_INPUT_LENGTH = 1_000_000;
    public static final int DEFAULT_MAX_DEPTH = 128;

    public static final ParserConfig DEFAULT = new ParserConfig(
        true,
        DEFAULT_MAX_INPUT_LENGTH,
        DEFAULT_MAX_DEPTH
    );

    public ParserConfig {
        if (maxInputLength <= 0) {
            throw new IllegalArgumentException("maxInputLength must be positive, got " + maxInputLength);
        }
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth must be positive, got " + maxDepth);
        }
    }

    public ParserConfig withPackrat(boolean enabled) {
        return new ParserConfig(enabled, maxInputLength, maxDepth);
    }

    public ParserConfig withMaxInputLength(int length) {
        return new ParserConfig(packratEnabled, length, maxDepth);
    }

    public ParserConfig withMaxDepth(int depth) {
        return new ParserConfig(packratEnabled, maxInputLength, depth);
    }
}
