package org.tmlang.runtime;

import org.tmlang.compiler.frontend.parser.ast.Direction;
import org.tmlang.compiler.frontend.parser.ast.Symbols;

import java.util.Collections;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * An unbounded tape with a single head. Only non-blank cells are stored; every other cell
 * reads as blank ({@code ""}).
 */
public class Tape {

    private final NavigableMap<Integer, String> cells = new TreeMap<>();
    private int head = 0;

    /**
     * Creates a tape holding the given characters from index 0 on. Whitespace characters
     * leave their cell blank. The head starts at index 0.
     * @param content The initial content.
     */
    public Tape(String content) {
        for (int i = 0; i < content.length(); i++) {
            char c = content.charAt(i);
            if (!Character.isWhitespace(c)) {
                cells.put(i, String.valueOf(c));
            }
        }
    }

    /**
     * Creates a tape after checking that every non-blank character belongs to the alphabet.
     * @param content The initial content.
     * @param alphabet The allowed letters.
     * @return The tape.
     * @throws InvalidTapeException if a character is neither blank nor in the alphabet.
     */
    public static Tape forAlphabet(String content, Set<String> alphabet) {
        for (int i = 0; i < content.length(); i++) {
            char c = content.charAt(i);
            if (!Character.isWhitespace(c) && !alphabet.contains(String.valueOf(c))) {
                throw new InvalidTapeException(i);
            }
        }
        return new Tape(content);
    }

    /**
     * Reads a cell relative to the head.
     * @param offset The distance from the head, negative for cells to the left.
     * @return The symbol in that cell, {@code ""} if it is blank.
     */
    public String get(int offset) {
        return cells.getOrDefault(head + offset, Symbols.BLANK);
    }

    /**
     * @return The symbol under the head.
     */
    public String read() {
        return get(0);
    }

    /**
     * Writes a symbol under the head. A blank clears the cell.
     * @param symbol The symbol to write.
     */
    public void change(String symbol) {
        if (symbol.isBlank()) {
            cells.remove(head);
        } else {
            cells.put(head, symbol);
        }
    }

    /**
     * Moves the head. {@link Direction#START} and {@link Direction#END} go to the leftmost and
     * rightmost non-blank cell, or to index 0 if the tape is blank.
     * @param direction Where to go.
     */
    public void move(Direction direction) {
        switch (direction) {
            case LEFT:
                head--;
                break;
            case START:
                head = cells.isEmpty() ? 0 : cells.firstKey();
                break;
            case END:
                head = cells.isEmpty() ? 0 : cells.lastKey();
                break;
            default:
                head++;
                break;
        }
    }

    public int getHeadPosition() {
        return head;
    }

    /**
     * @return The non-blank cells by index.
     */
    public Map<Integer, String> getCells() {
        return Collections.unmodifiableMap(cells);
    }

    /**
     * Renders the written part of the tape, blanks as spaces.
     * @return The cells from the leftmost to the rightmost non-blank one.
     */
    public String contents() {
        if (cells.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (int i = cells.firstKey(); i <= cells.lastKey(); i++) {
            sb.append(cells.getOrDefault(i, " "));
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Tape)) return false;
        Tape other = (Tape) o;
        return head == other.head && cells.equals(other.cells);
    }

    @Override
    public int hashCode() {
        return Objects.hash(cells, head);
    }

    @Override
    public String toString() {
        return "Tape{head=" + head + ", cells=" + cells + "}";
    }
}
