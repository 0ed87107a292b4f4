package org.alani.peg.grammar;

import org.alani.peg.tree.SourceSpan;

/**
 * A grammar rule: Name <- Expression
 *
 * <p>Rules whose name starts with an underscore are inline: they produce no node of
 * their own and hand the nodes produced by their body to the caller.
 */
public record Rule(
 SourceSpan span,
 String name,
 Expression expression) {
    public static final String INLINE_PREFIX = "_";

    public boolean isInline() {
        return name.startsWith(INLINE_PREFIX);
    }
}
