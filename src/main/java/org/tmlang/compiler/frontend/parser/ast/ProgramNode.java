package org.tmlang.compiler.frontend.parser.ast;

import org.tmlang.compiler.api.SourceSpan;

import java.util.List;

/**
 * The root of the syntax tree. The first module is the entry point.
 *
 * @param span The region of the whole program.
 * @param alphabet The alphabet declaration.
 * @param modules The modules in source order.
 */
public record ProgramNode(SourceSpan span, AlphabetNode alphabet, List<ModuleNode> modules) implements AstNode {

    public ProgramNode {
        modules = List.copyOf(modules);
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
