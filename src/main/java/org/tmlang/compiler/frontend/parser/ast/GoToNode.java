package org.tmlang.compiler.frontend.parser.ast;

import org.tmlang.compiler.api.SourceSpan;

import java.util.List;

/**
 * Transfers control to the start of a module, binding its parameters.
 *
 * @param span The region of the command.
 * @param moduleIdentifier The target module.
 * @param arguments Letters or parameter names, one per target parameter.
 */
public record GoToNode(SourceSpan span, String moduleIdentifier, List<String> arguments) implements FlowCommandNode {

    public GoToNode {
        arguments = List.copyOf(arguments);
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
