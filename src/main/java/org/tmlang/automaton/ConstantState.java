package org.tmlang.automaton;

/**
 * A state that takes the same transition whatever symbol is read.
 *
 * @param label The unique label of the state.
 * @param transition The transition for every symbol.
 */
public record ConstantState(String label, Transition transition) implements State {

    @Override
    public Transition transition(String symbol) {
        return transition;
    }
}
