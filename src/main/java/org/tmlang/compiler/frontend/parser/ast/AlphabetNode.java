package org.tmlang.compiler.frontend.parser.ast;

import org.tmlang.compiler.api.SourceSpan;

import java.util.List;

/**
 * The alphabet declaration: the letters that may appear on the tape besides the blank.
 *
 * @param span The region of the declaration.
 * @param symbols The declared letters in source order.
 */
public record AlphabetNode(SourceSpan span, List<String> symbols) implements AstNode {

    public AlphabetNode {
        symbols = List.copyOf(symbols);
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
