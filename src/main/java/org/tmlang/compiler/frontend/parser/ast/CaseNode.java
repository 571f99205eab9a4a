package org.tmlang.compiler.frontend.parser.ast;

/**
 * One branch of a {@link SwitchBlockNode}.
 */
public sealed interface CaseNode extends AstNode permits IfCaseNode, WhileCaseNode, ElseCaseNode {
}
