package org.tmlang.compiler.frontend.parser.ast;

import org.tmlang.compiler.api.SourceSpan;

import java.util.List;

/**
 * Applies to every symbol. Only allowed as the last case of a switch.
 *
 * @param span The region of the case.
 * @param blocks The case body.
 */
public record ElseCaseNode(SourceSpan span, List<BlockNode> blocks) implements CaseNode {

    public ElseCaseNode {
        blocks = List.copyOf(blocks);
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
