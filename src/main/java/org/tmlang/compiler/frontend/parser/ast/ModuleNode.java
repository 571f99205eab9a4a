package org.tmlang.compiler.frontend.parser.ast;

import org.tmlang.compiler.api.SourceSpan;

import java.util.List;

/**
 * A named, possibly parametrised sequence of blocks.
 *
 * @param span The region of the module.
 * @param identifier The name of the module.
 * @param parameters The names of its letter parameters.
 * @param blocks The body of the module.
 */
public record ModuleNode(SourceSpan span, String identifier, List<String> parameters, List<BlockNode> blocks)
        implements AstNode {

    public ModuleNode {
        parameters = List.copyOf(parameters);
        blocks = List.copyOf(blocks);
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
