package org.tmlang.compiler.frontend.parser.ast;

/**
 * Helpers for tape symbols as they appear in the syntax tree.
 */
public final class Symbols {

    /** The blank symbol: an empty tape cell. */
    public static final String BLANK = "";

    /** The keyword that denotes {@link #BLANK} in source code. */
    public static final String BLANK_KEYWORD = "blank";

    private Symbols() {
    }

    /**
     * Renders a symbol for messages: {@code "a"} for a letter and {@code blank} for the blank.
     * @param symbol The symbol to render.
     * @return The rendered symbol.
     */
    public static String describe(String symbol) {
        return BLANK.equals(symbol) ? BLANK_KEYWORD : "\"" + symbol + "\"";
    }

    /**
     * Renders a symbol for state labels: the letter itself, or {@code blank}.
     * @param symbol The symbol to render.
     * @return The rendered symbol.
     */
    public static String name(String symbol) {
        return BLANK.equals(symbol) ? BLANK_KEYWORD : symbol;
    }
}
