package org.tmlang.compiler.frontend.parser.ast;

import org.tmlang.compiler.api.SourceSpan;

import java.util.Optional;

/**
 * An optional symbol write, an optional head move and an optional flow command, in this order.
 * At least one of them is present.
 *
 * @param span The region of the block.
 * @param changeTo The symbol write, if any.
 * @param move The head move, if any.
 * @param flow The goto or termination command, if any.
 */
public record BasicBlockNode(
        SourceSpan span,
        Optional<ChangeToNode> changeTo,
        Optional<MoveNode> move,
        Optional<FlowCommandNode> flow
) implements BlockNode {

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
