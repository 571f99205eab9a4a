package org.tmlang.compiler.frontend.parser.ast;

import org.tmlang.compiler.api.SourceSpan;

import java.util.List;

/**
 * Repeats its body as long as the symbol under the head is one of its triggers.
 *
 * @param span The region of the case.
 * @param triggers Letters, parameter names or {@link Symbols#BLANK}.
 * @param body The block executed on every iteration.
 */
public record WhileCaseNode(SourceSpan span, List<String> triggers, CoreBasicBlockNode body) implements CaseNode {

    public WhileCaseNode {
        triggers = List.copyOf(triggers);
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
