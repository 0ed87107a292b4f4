package org.alani.compiler;

import org.alani.compiler.ast.AlaniAst;
import org.alani.compiler.ast.AstBuilder;
import org.alani.compiler.ast.Environment;
import org.alani.compiler.error.AlaniCompileException;
import org.alani.compiler.syntax.AlaniSyntax;
import org.alani.peg.parser.ParserConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for turning Alani source text into an AST.
 *
 * <p>Example usage:
 * <pre>{@code
 * var ast = AlaniCompiler.create().toAst("""
 *     lazy 2 to 4 of "ab";
 *     not <digit>
 *     """);
 * }</pre>
 *
 * <p>Instances are immutable and may be shared; every call owns its own parsing state.
 */
public final class AlaniCompiler {
    private static final Logger log = LoggerFactory.getLogger(AlaniCompiler.class);

    private final AlaniSyntax syntax;
    private final AstBuilder builder;

    private AlaniCompiler(AlaniSyntax syntax) {
        this.syntax = syntax;
        this.builder = new AstBuilder();
    }

    public static AlaniCompiler create() {
        return create(ParserConfig.DEFAULT);
    }

    public static AlaniCompiler create(ParserConfig config) {
        return new AlaniCompiler(AlaniSyntax.create(config));
    }

    /**
     * Compile source text. The empty string yields {@link AlaniAst.Empty} without parsing.
     *
     * @throws AlaniCompileException on the first syntax or semantic error found
     */
    public AlaniAst toAst(String source) throws AlaniCompileException {
        if (source.isEmpty()) {
            return AlaniAst.EMPTY;
        }
        log.debug("Compiling {} characters", source.length());
        try {
            var tokens = syntax.tokenize(source);
            var ast = builder.buildRoot(tokens, new Environment());
            if (ast instanceof AlaniAst.Root root) {
                log.debug("Compiled {} top-level nodes", root.nodes().size());
            }
            return ast;
        } catch (AlaniCompileException e) {
            log.debug("Compilation failed: {}", e.getMessage());
            throw e;
        }
    }
}
