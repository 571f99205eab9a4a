package org.tmlang.runtime;

import org.tmlang.compiler.frontend.parser.ast.Direction;
import org.tmlang.compiler.frontend.parser.ast.TerminationStatus;

import java.util.Optional;

/**
 * What a single step did to the tape and whether it ended the run.
 *
 * @param read The symbol under the head before the step.
 * @param written The symbol in that cell after the step.
 * @param direction The head movement.
 * @param termination The final status if the step ended the run.
 */
public record StepResult(String read, String written, Direction direction, Optional<TerminationStatus> termination) {
}
