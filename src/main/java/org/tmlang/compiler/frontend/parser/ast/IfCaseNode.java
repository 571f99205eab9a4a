package org.tmlang.compiler.frontend.parser.ast;

import org.tmlang.compiler.api.SourceSpan;

import java.util.List;

/**
 * Runs its blocks once if the symbol under the head is one of its triggers.
 *
 * @param span The region of the case.
 * @param triggers Letters, parameter names or {@link Symbols#BLANK}.
 * @param blocks The case body.
 */
public record IfCaseNode(SourceSpan span, List<String> triggers, List<BlockNode> blocks) implements CaseNode {

    public IfCaseNode {
        triggers = List.copyOf(triggers);
        blocks = List.copyOf(blocks);
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
