package org.tmlang.runtime;

import org.tmlang.compiler.frontend.parser.ast.TerminationStatus;

import java.util.Optional;

/**
 * Something that runs a program on a {@link Tape} one step at a time.
 */
public interface TapeMachine {

    /**
     * Performs exactly one step.
     * @return What the step did, or empty if the run had already ended.
     */
    Optional<StepResult> step();

    /**
     * @return The final status once the run has ended.
     */
    Optional<TerminationStatus> getTerminationStatus();

    /**
     * @return The tape the machine works on.
     */
    Tape getTape();

    /**
     * Steps until the run ends or {@code maxSteps} steps were made.
     * @param maxSteps The step budget.
     * @return The outcome.
     */
    default RunResult run(long maxSteps) {
        long steps = 0;
        while (steps < maxSteps && getTerminationStatus().isEmpty()) {
            step();
            steps++;
        }
        return new RunResult(getTerminationStatus(), steps, getTape());
    }
}
