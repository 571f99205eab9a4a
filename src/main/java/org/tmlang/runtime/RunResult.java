package org.tmlang.runtime;

import org.tmlang.compiler.frontend.parser.ast.TerminationStatus;

import java.util.Optional;

/**
 * The outcome of {@link TapeMachine#run(long)}.
 *
 * @param status The final status, or empty if the step limit was reached first.
 * @param steps The number of steps performed.
 * @param tape The tape after the last step.
 */
public record RunResult(Optional<TerminationStatus> status, long steps, Tape tape) {

    /**
     * @return Whether the run ended before the step limit.
     */
    public boolean terminated() {
        return status.isPresent();
    }
}
