package org.tmlang.compiler;

import org.tmlang.automaton.Automaton;
import org.tmlang.compiler.api.CompilationException;
import org.tmlang.compiler.api.ICompiler;
import org.tmlang.compiler.api.ProgramArtifact;
import org.tmlang.compiler.backend.AutomatonGenerator;
import org.tmlang.compiler.frontend.parser.Parser;
import org.tmlang.compiler.frontend.parser.ast.ProgramNode;
import org.tmlang.compiler.frontend.semantics.SemanticAnalyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The main compiler implementation. It runs the pipeline from source text to automaton:
 * parsing, semantic analysis and automaton generation. Each phase stops the compilation
 * at its first error.
 */
public class Compiler implements ICompiler {

    private static final Logger LOG = LoggerFactory.getLogger(Compiler.class);

    @Override
    public ProgramArtifact compile(String source, String programName) throws CompilationException {
        ProgramNode program = check(source, programName);

        LOG.debug("[{}] Generating automaton.", programName);
        Automaton automaton = new AutomatonGenerator(program).generate();
        LOG.info("[{}] Compiled {} module(s) into {} state(s).",
                programName, program.modules().size(), automaton.getStates().size());
        return new ProgramArtifact(programName, program, automaton);
    }

    /**
     * Parses and validates the source without generating an automaton.
     * @param source The program text.
     * @param programName A name for the program, used in log output.
     * @return The validated syntax tree.
     * @throws CompilationException at the first syntax or semantic error.
     */
    public ProgramNode check(String source, String programName) throws CompilationException {
        LOG.debug("[{}] Parsing.", programName);
        ProgramNode program;
        try {
            program = new Parser(source).parse();
        } catch (CompilationException e) {
            LOG.debug("[{}] Parsing failed: {}", programName, e.getDiagnostic());
            throw e;
        }

        LOG.debug("[{}] Running semantic analysis.", programName);
        try {
            new SemanticAnalyzer(program).analyze();
        } catch (CompilationException e) {
            LOG.debug("[{}] Semantic analysis failed: {}", programName, e.getDiagnostic());
            throw e;
        }
        return program;
    }
}
