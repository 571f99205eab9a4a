package org.tmlang.compiler.frontend.parser.ast;

import org.tmlang.compiler.api.SourceSpan;

/**
 * Ends the run with the given status.
 *
 * @param span The region of the command.
 * @param status The final status.
 */
public record TerminationNode(SourceSpan span, TerminationStatus status) implements FlowCommandNode {

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
