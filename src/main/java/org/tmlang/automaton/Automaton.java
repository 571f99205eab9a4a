package org.tmlang.automaton;

import org.tmlang.compiler.frontend.parser.ast.TerminationStatus;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The compiled form of a program: a finite set of labelled states and an initial state.
 * <p>
 * A transition whose next state is one of the termination labels ({@code accept},
 * {@code reject}, {@code halt}) ends the run. Instances are immutable.
 */
public final class Automaton {

    private final String initialState;
    private final Set<String> alphabet;
    private final Map<String, State> states;

    /**
     * Creates an automaton.
     * @param initialState The label of the state the run starts in.
     * @param alphabet The letters the tape may hold besides the blank.
     * @param states The states, keyed by label, in construction order.
     */
    public Automaton(String initialState, Set<String> alphabet, Map<String, State> states) {
        if (!states.containsKey(initialState)) {
            throw new IllegalArgumentException("Unknown initial state: " + initialState);
        }
        this.initialState = initialState;
        this.alphabet = Collections.unmodifiableSet(new LinkedHashSet<>(alphabet));
        this.states = Collections.unmodifiableMap(new LinkedHashMap<>(states));
    }

    /**
     * Maps a next-state label to the termination it stands for.
     * @param label A state label.
     * @return The termination status, or empty for an ordinary state.
     */
    public static Optional<TerminationStatus> terminationOf(String label) {
        return TerminationStatus.fromKeyword(label);
    }

    public String getInitialState() {
        return initialState;
    }

    public Set<String> getAlphabet() {
        return alphabet;
    }

    public Map<String, State> getStates() {
        return states;
    }

    /**
     * Looks up a state.
     * @param label The label of the state.
     * @return The state.
     * @throws IllegalArgumentException if no state has that label.
     */
    public State getState(String label) {
        State state = states.get(label);
        if (state == null) {
            throw new IllegalArgumentException("Unknown state: " + label);
        }
        return state;
    }

    /**
     * Renders the transition table, one line per state and symbol.
     * @return A human readable description of the automaton.
     */
    public String describe() {
        StringBuilder sb = new StringBuilder();
        sb.append("initial: ").append(initialState).append(System.lineSeparator());
        for (State state : states.values()) {
            if (state instanceof ConstantState) {
                sb.append(state.label()).append(" [*]: ")
                        .append(((ConstantState) state).transition()).append(System.lineSeparator());
            } else {
                for (Map.Entry<String, Transition> entry : ((VariableState) state).transitions().entrySet()) {
                    String symbol = entry.getKey().isEmpty() ? "blank" : entry.getKey();
                    sb.append(state.label()).append(" [").append(symbol).append("]: ")
                            .append(entry.getValue()).append(System.lineSeparator());
                }
            }
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "Automaton{initial=" + initialState + ", states=" + states.size() + "}";
    }
}
