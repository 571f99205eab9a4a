package org.tmlang.automaton;

/**
 * A labelled state of an {@link Automaton}.
 */
public sealed interface State permits ConstantState, VariableState {

    /**
     * @return The unique label of this state.
     */
    String label();

    /**
     * Selects the transition taken when the head reads the given symbol.
     * @param symbol The symbol under the head, {@code ""} for blank.
     * @return The transition to take.
     * @throws IllegalStateException if the state has no transition for the symbol.
     */
    Transition transition(String symbol);
}
