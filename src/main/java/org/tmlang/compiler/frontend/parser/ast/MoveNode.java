package org.tmlang.compiler.frontend.parser.ast;

import org.tmlang.compiler.api.SourceSpan;

/**
 * Moves the head.
 *
 * @param span The region of the command.
 * @param direction Where the head goes.
 */
public record MoveNode(SourceSpan span, Direction direction) implements AstNode {

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
