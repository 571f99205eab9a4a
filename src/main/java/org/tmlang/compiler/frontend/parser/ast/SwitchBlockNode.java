package org.tmlang.compiler.frontend.parser.ast;

import org.tmlang.compiler.api.SourceSpan;

import java.util.List;

/**
 * Branches on the symbol under the head. The first case that applies is taken.
 *
 * @param span The region of the block.
 * @param cases The cases in source order.
 */
public record SwitchBlockNode(SourceSpan span, List<CaseNode> cases) implements BlockNode {

    public SwitchBlockNode {
        cases = List.copyOf(cases);
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
