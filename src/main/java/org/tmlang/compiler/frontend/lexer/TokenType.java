package org.tmlang.compiler.frontend.lexer;

/**
 * Defines all possible token types that the {@link Lexer} can recognize.
 */
public enum TokenType {
    /** A reserved word of the language, such as {@code module}, {@code if} or {@code goto}. */
    KEYWORD,
    /** Any other run of non-blank characters: module names, letters, directions. */
    WORD,
    /** The equals sign {@code =}. */
    EQUALS,
    /** A comma {@code ,}. */
    COMMA,
    /** A colon {@code :}. */
    COLON,
    /** An opening parenthesis {@code (}. */
    LEFT_PAREN,
    /** A closing parenthesis {@code )}. */
    RIGHT_PAREN,
    /** An opening bracket {@code [}. */
    LEFT_BRACKET,
    /** A closing bracket {@code ]}. */
    RIGHT_BRACKET
}
