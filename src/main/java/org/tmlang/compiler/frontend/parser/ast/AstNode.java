package org.tmlang.compiler.frontend.parser.ast;

import org.tmlang.compiler.api.SourceSpan;

/**
 * The base interface for all nodes in the Abstract Syntax Tree (AST).
 */
public interface AstNode {

    /**
     * @return The region of the source code this node was parsed from.
     */
    SourceSpan span();

    /**
     * Accepts a visitor. Part of the visitor pattern.
     * @param visitor The visitor that should visit this node.
     * @param <T> The return type of the visitor.
     * @return The result of the visit operation.
     */
    <T> T accept(AstVisitor<T> visitor);
}
