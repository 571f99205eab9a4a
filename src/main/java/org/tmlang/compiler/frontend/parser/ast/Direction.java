package org.tmlang.compiler.frontend.parser.ast;

import java.util.Locale;
import java.util.Optional;

/**
 * A movement of the tape head.
 */
public enum Direction {
    /** One cell to the left. */
    LEFT,
    /** One cell to the right. */
    RIGHT,
    /** To the leftmost written cell. */
    START,
    /** To the rightmost written cell. */
    END;

    /**
     * Looks up a direction by its keyword.
     * @param keyword The keyword as written in source code, e.g. {@code left}.
     * @return The direction, or empty if the keyword names none.
     */
    public static Optional<Direction> fromKeyword(String keyword) {
        for (Direction direction : values()) {
            if (direction.keyword().equals(keyword)) {
                return Optional.of(direction);
            }
        }
        return Optional.empty();
    }

    /**
     * @return The keyword of this direction in source code.
     */
    public String keyword() {
        return name().toLowerCase(Locale.ROOT);
    }
}
