package org.tmlang.cli.commands;

import org.tmlang.cli.CommandLineInterface;
import org.tmlang.compiler.Compiler;
import org.tmlang.compiler.api.CompilationException;
import org.tmlang.compiler.api.ProgramArtifact;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.util.concurrent.Callable;

@Command(name = "compile", description = "Compiles a program and prints the transition table of its automaton.")
public class CompileCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "The program file.")
    private File file;

    @CommandLine.ParentCommand
    private CommandLineInterface parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        parent.getConfig();
        try {
            ProgramArtifact artifact = new Compiler().compile(file.toPath());
            spec.commandLine().getOut().print(artifact.automaton().describe());
            spec.commandLine().getOut().flush();
            return 0;
        } catch (CompilationException e) {
            spec.commandLine().getErr().println(file.getName() + ":" + e.getDiagnostic().span() + ": " + e.getMessage());
            return 1;
        }
    }
}
