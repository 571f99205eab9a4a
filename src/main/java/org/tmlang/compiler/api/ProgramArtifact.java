package org.tmlang.compiler.api;

import org.tmlang.automaton.Automaton;
import org.tmlang.compiler.frontend.parser.ast.ProgramNode;

/**
 * The output of a successful compilation.
 *
 * @param programName The name the program was compiled under.
 * @param syntaxTree The validated syntax tree, which the interpreter executes directly.
 * @param automaton The automaton generated from the syntax tree.
 */
public record ProgramArtifact(String programName, ProgramNode syntaxTree, Automaton automaton) {
}
