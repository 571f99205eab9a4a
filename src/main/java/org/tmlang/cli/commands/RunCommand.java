package org.tmlang.cli.commands;

import org.tmlang.cli.CommandLineInterface;
import org.tmlang.cli.config.RunSettings;
import org.tmlang.compiler.Compiler;
import org.tmlang.compiler.api.CompilationException;
import org.tmlang.compiler.api.ProgramArtifact;
import org.tmlang.runtime.AutomatonRunner;
import org.tmlang.runtime.Interpreter;
import org.tmlang.runtime.InvalidTapeException;
import org.tmlang.runtime.RunResult;
import org.tmlang.runtime.StepResult;
import org.tmlang.runtime.TapeMachine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.io.PrintWriter;
import java.util.Optional;
import java.util.concurrent.Callable;

@Command(name = "run", description = "Runs a program on a tape and prints the final status and tape.")
public class RunCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(RunCommand.class);

    /** Exit code when the step budget ran out before the program terminated. */
    public static final int EXIT_STEP_LIMIT = 2;

    @Parameters(index = "0", description = "The program file.")
    private File file;

    @Option(names = {"-t", "--tape"}, defaultValue = "", description = "The initial tape content.")
    private String tape;

    @Option(names = {"-m", "--mode"}, description = "INTERPRET or AUTOMATON (default: from configuration).")
    private RunSettings.Mode mode;

    @Option(names = {"--max-steps"}, description = "The step budget (default: from configuration).")
    private Long maxSteps;

    @Option(names = {"--trace"}, description = "Print every step.")
    private boolean trace;

    @CommandLine.ParentCommand
    private CommandLineInterface parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        RunSettings settings;
        try {
            RunSettings defaults = RunSettings.fromConfig(parent.getConfig());
            settings = new RunSettings(
                    maxSteps != null ? maxSteps : defaults.maxSteps(),
                    mode != null ? mode : defaults.mode());
        } catch (IllegalArgumentException e) {
            err.println("Invalid run settings: " + e.getMessage());
            return 1;
        }
        LOG.debug("Running {} with {}.", file, settings);

        TapeMachine machine;
        try {
            ProgramArtifact artifact = new Compiler().compile(file.toPath());
            machine = settings.mode() == RunSettings.Mode.AUTOMATON
                    ? new AutomatonRunner(artifact.automaton(), tape)
                    : new Interpreter(artifact.syntaxTree(), tape);
        } catch (CompilationException e) {
            err.println(file.getName() + ":" + e.getDiagnostic().span() + ": " + e.getMessage());
            return 1;
        } catch (InvalidTapeException e) {
            err.println(e.getMessage() + " (position " + e.getPosition() + ")");
            return 1;
        }

        RunResult result = trace ? runTraced(machine, settings.maxSteps(), out) : machine.run(settings.maxSteps());
        out.println("steps: " + result.steps());
        out.println("tape: [" + result.tape().contents() + "]");
        if (!result.terminated()) {
            out.println("status: step limit reached");
            out.flush();
            return EXIT_STEP_LIMIT;
        }
        out.println("status: " + result.status().get().keyword());
        out.flush();
        return 0;
    }

    private static RunResult runTraced(TapeMachine machine, long maxSteps, PrintWriter out) {
        long steps = 0;
        while (steps < maxSteps && machine.getTerminationStatus().isEmpty()) {
            Optional<StepResult> step = machine.step();
            steps++;
            if (step.isPresent()) {
                StepResult s = step.get();
                out.printf("%d: read %s, write %s, move %s%s%n", steps, name(s.read()), name(s.written()),
                        s.direction().keyword(), s.termination().map(t -> ", " + t.keyword()).orElse(""));
            }
        }
        return new RunResult(machine.getTerminationStatus(), steps, machine.getTape());
    }

    private static String name(String symbol) {
        return symbol.isEmpty() ? "blank" : symbol;
    }
}
