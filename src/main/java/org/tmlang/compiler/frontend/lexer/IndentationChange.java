package org.tmlang.compiler.frontend.lexer;

/**
 * The effect the last {@link Lexer#advance()} had on the indentation stack.
 */
public enum IndentationChange {
    /** The token continues a line or starts one at the current level. */
    NONE,
    /** The token starts a line deeper than the current level. */
    INDENT,
    /** The token returns to an enclosing level, possibly several at once. */
    DEDENT,
    /** The token returns to a width that matches no enclosing level. */
    INVALID
}
