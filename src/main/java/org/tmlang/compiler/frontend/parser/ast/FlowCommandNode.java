package org.tmlang.compiler.frontend.parser.ast;

/**
 * The last command of a basic block: a transfer of control or a termination.
 */
public sealed interface FlowCommandNode extends AstNode permits GoToNode, TerminationNode {
}
