package org.tmlang.automaton;

import org.tmlang.compiler.frontend.parser.ast.Direction;

import java.util.Optional;

/**
 * What a state does for one symbol: optionally write, then move, then continue in the next state.
 *
 * @param nextState The label of the next state, or a reserved termination label.
 * @param write The symbol to write, or empty to keep the current one.
 * @param direction The head movement.
 */
public record Transition(String nextState, Optional<String> write, Direction direction) {

    /**
     * Returns the symbol the cell holds after this transition.
     * @param current The symbol that was read.
     * @return The written symbol, or {@code current} if nothing is written.
     */
    public String written(String current) {
        return write.orElse(current);
    }

    @Override
    public String toString() {
        String symbol = write.map(w -> w.isEmpty() ? "blank" : w).orElse("-");
        return String.format("write %s, move %s, next %s", symbol, direction.keyword(), nextState);
    }
}
