package org.tmlang.compiler.api;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Defines the public interface of the tmlang compiler.
 */
public interface ICompiler {

    /**
     * Compiles the given source code.
     *
     * @param source The program text.
     * @param programName A name for the program, used in log output.
     * @return A {@link ProgramArtifact} holding the syntax tree and the generated automaton.
     * @throws CompilationException at the first error found.
     */
    ProgramArtifact compile(String source, String programName) throws CompilationException;

    /**
     * Compiles the source code from a file.
     * @param programPath The path to the source file.
     * @return A {@link ProgramArtifact} containing the compiled program.
     * @throws CompilationException if errors occur during compilation.
     * @throws IOException if the file cannot be read.
     */
    default ProgramArtifact compile(Path programPath) throws CompilationException, IOException {
        return compile(Files.readString(programPath), programPath.toString());
    }
}
