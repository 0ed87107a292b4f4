package org.alani.compiler.ast;

import org.alani.compiler.error.AlaniCompileException;
import org.alani.peg.tree.CstNode;

/**
 * Builds one AST node from one token.
 */
@FunctionalInterface
public interface NodeBuilder {
    AlaniAstNode build(CstNode token, Environment environment) throws AlaniCompileException;
}
