package org.tmlang.runtime;

import org.tmlang.TestPrograms;
import org.tmlang.compiler.Compiler;
import org.tmlang.compiler.api.CompilationException;
import org.tmlang.compiler.api.ProgramArtifact;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs programs both through the {@link Interpreter} and through the compiled automaton and
 * checks that every step has the same effect.
 */
@Tag("unit")
public class ExecutionEquivalenceTest {

    private static final long MAX_STEPS = 1_000;

    private static final String FALLTHROUGH = String.join("\n",
            "alphabet = [a]",
            "module m():",
            "    if a:",
            "        move right",
            "        if a:",
            "            move right",
            "        else:",
            "            accept",
            "    else:",
            "        reject",
            "    move left",
            "    changeto a",
            "    halt");

    private static final String COPY = String.join("\n",
            "alphabet = [a, b]",
            "module copy():",
            "    if a:",
            "        move right",
            "        goto write(a)",
            "    if b:",
            "        move right",
            "        goto write(b)",
            "    else:",
            "        halt",
            "module write(x):",
            "    while a, b:",
            "        move right",
            "    if blank:",
            "        changeto x",
            "        accept");

    private static final String RETURN = String.join("\n",
            "alphabet = [a]",
            "module main():",
            "    goto side()",
            "    move right",
            "    accept",
            "module side():",
            "    move left");

    private static final String NESTED_RETURN = String.join("\n",
            "alphabet = [a, b]",
            "module main():",
            "    if a:",
            "        goto mark(b)",
            "        move right",
            "    else:",
            "        reject",
            "    accept",
            "module mark(x):",
            "    changeto x");

    static Stream<Arguments> runs() {
        return Stream.of(
                Arguments.of(TestPrograms.load("palindrome"), "abba"),
                Arguments.of(TestPrograms.load("palindrome"), "abab"),
                Arguments.of(TestPrograms.load("palindrome"), ""),
                Arguments.of(TestPrograms.load("isDiv2"), "110"),
                Arguments.of(TestPrograms.load("isDiv2"), "0111"),
                Arguments.of(TestPrograms.load("increment"), "1011"),
                Arguments.of(TestPrograms.load("increment"), "111"),
                Arguments.of(FALLTHROUGH, "aa"),
                Arguments.of(FALLTHROUGH, "a"),
                Arguments.of(FALLTHROUGH, ""),
                Arguments.of(COPY, "ab"),
                Arguments.of(COPY, "b a"),
                Arguments.of(RETURN, "a"),
                Arguments.of(NESTED_RETURN, "a"),
                Arguments.of(NESTED_RETURN, "b"));
    }

    /**
     * Verifies that interpreter and automaton produce the same steps, tape and status.
     */
    @ParameterizedTest
    @MethodSource("runs")
    void interpreterMatchesAutomaton(String source, String tape) throws CompilationException {
        // Arrange
        ProgramArtifact artifact = new Compiler().compile(source, "equivalence");
        Interpreter interpreter = new Interpreter(artifact.syntaxTree(), tape);
        AutomatonRunner runner = new AutomatonRunner(artifact.automaton(), tape);

        // Act
        List<StepResult> interpreted = trace(interpreter);
        List<StepResult> automated = trace(runner);

        // Assert
        assertThat(interpreter.getTerminationStatus()).as("terminates").isPresent();
        assertThat(automated).isEqualTo(interpreted);
        assertThat(runner.getTape()).isEqualTo(interpreter.getTape());
        assertThat(runner.getTerminationStatus()).isEqualTo(interpreter.getTerminationStatus());
    }

    private static List<StepResult> trace(TapeMachine machine) {
        List<StepResult> steps = new ArrayList<>();
        for (long i = 0; i < MAX_STEPS; i++) {
            Optional<StepResult> step = machine.step();
            if (step.isEmpty()) {
                break;
            }
            steps.add(step.get());
        }
        return steps;
    }
}
