package org.tmlang.automaton;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A state whose transition depends on the symbol read.
 *
 * @param label The unique label of the state.
 * @param transitions The transition for each symbol, {@code ""} standing for blank.
 */
public record VariableState(String label, Map<String, Transition> transitions) implements State {

    public VariableState {
        transitions = Collections.unmodifiableMap(new LinkedHashMap<>(transitions));
    }

    @Override
    public Transition transition(String symbol) {
        Transition transition = transitions.get(symbol);
        if (transition == null) {
            throw new IllegalStateException(
                    String.format("State %s has no transition for symbol \"%s\".", label, symbol));
        }
        return transition;
    }
}
