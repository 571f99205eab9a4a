package org.tmlang.runtime;

import org.tmlang.automaton.Automaton;
import org.tmlang.automaton.Transition;
import org.tmlang.compiler.frontend.parser.ast.TerminationStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Runs a compiled {@link Automaton} on a tape, one transition per call to {@link #step()}.
 */
public class AutomatonRunner implements TapeMachine {

    private static final Logger LOG = LoggerFactory.getLogger(AutomatonRunner.class);

    private final Automaton automaton;
    private final Tape tape;
    private String currentState;
    private TerminationStatus terminationStatus;

    /**
     * Prepares a run from the initial state.
     * @param automaton The automaton to run.
     * @param tapeContent The initial tape content.
     * @throws InvalidTapeException if the tape holds a letter outside the alphabet.
     */
    public AutomatonRunner(Automaton automaton, String tapeContent) {
        this.automaton = automaton;
        this.tape = Tape.forAlphabet(tapeContent, automaton.getAlphabet());
        this.currentState = automaton.getInitialState();
    }

    @Override
    public Optional<StepResult> step() {
        if (terminationStatus != null) {
            return Optional.empty();
        }
        String symbol = tape.read();
        Transition transition = automaton.getState(currentState).transition(symbol);
        String written = transition.written(symbol);
        tape.change(written);
        tape.move(transition.direction());
        LOG.trace("{}: read \"{}\", wrote \"{}\", moved {}, next {}.",
                currentState, symbol, written, transition.direction(), transition.nextState());

        Optional<TerminationStatus> termination = Automaton.terminationOf(transition.nextState());
        if (termination.isPresent()) {
            terminationStatus = termination.get();
            currentState = null;
            LOG.debug("Run terminated with status {}.", terminationStatus);
        } else {
            currentState = transition.nextState();
        }
        return Optional.of(new StepResult(symbol, written, transition.direction(), termination));
    }

    /**
     * @return The label of the state the next step starts in, or empty once the run has ended.
     */
    public Optional<String> getCurrentState() {
        return Optional.ofNullable(currentState);
    }

    @Override
    public Optional<TerminationStatus> getTerminationStatus() {
        return Optional.ofNullable(terminationStatus);
    }

    @Override
    public Tape getTape() {
        return tape;
    }
}
