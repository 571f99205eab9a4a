package org.tmlang.compiler.frontend.parser.ast;

/**
 * A block: the unit of execution of a module body or case body.
 */
public sealed interface BlockNode extends AstNode permits BasicBlockNode, CoreBasicBlockNode, SwitchBlockNode {
}
