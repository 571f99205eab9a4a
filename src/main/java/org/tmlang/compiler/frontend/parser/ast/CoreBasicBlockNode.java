package org.tmlang.compiler.frontend.parser.ast;

import org.tmlang.compiler.api.SourceSpan;

import java.util.Optional;

/**
 * The body of a while case: a symbol write and a head move without any flow command.
 * At least one of the two is present.
 *
 * @param span The region of the block.
 * @param changeTo The symbol write, if any.
 * @param move The head move, if any.
 */
public record CoreBasicBlockNode(SourceSpan span, Optional<ChangeToNode> changeTo, Optional<MoveNode> move)
        implements BlockNode {

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
