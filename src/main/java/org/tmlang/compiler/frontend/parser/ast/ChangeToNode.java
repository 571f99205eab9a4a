package org.tmlang.compiler.frontend.parser.ast;

import org.tmlang.compiler.api.SourceSpan;

/**
 * Writes a symbol to the cell under the head.
 *
 * @param span The region of the command.
 * @param symbol A letter, a parameter name or {@link Symbols#BLANK}.
 */
public record ChangeToNode(SourceSpan span, String symbol) implements AstNode {

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
