package org.tmlang.runtime;

/**
 * Thrown when the initial tape holds a symbol that is neither blank nor in the alphabet.
 */
public class InvalidTapeException extends IllegalArgumentException {

    private final int position;

    /**
     * @param position The index of the first offending character in the tape content.
     */
    public InvalidTapeException(int position) {
        super("The tape is not valid for the given TM Program.");
        this.position = position;
    }

    /**
     * @return The index of the first offending character in the tape content.
     */
    public int getPosition() {
        return position;
    }
}
