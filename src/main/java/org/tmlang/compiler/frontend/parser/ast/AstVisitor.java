package org.tmlang.compiler.frontend.parser.ast;

/**
 * A visitor for the Abstract Syntax Tree with one handler per node kind.
 * <p>
 * {@link #visit(AstNode)} dispatches any node to the handler of its kind.
 *
 * @param <T> The return type of the visit methods.
 */
public interface AstVisitor<T> {

    /**
     * Dispatches a node of statically unknown kind to its handler.
     * @param node The node to visit.
     * @return The result of the matching handler.
     */
    default T visit(AstNode node) {
        return node.accept(this);
    }

    T visit(ProgramNode node);
    T visit(AlphabetNode node);
    T visit(ModuleNode node);
    T visit(BasicBlockNode node);
    T visit(CoreBasicBlockNode node);
    T visit(SwitchBlockNode node);
    T visit(IfCaseNode node);
    T visit(WhileCaseNode node);
    T visit(ElseCaseNode node);
    T visit(ChangeToNode node);
    T visit(MoveNode node);
    T visit(GoToNode node);
    T visit(TerminationNode node);
}
