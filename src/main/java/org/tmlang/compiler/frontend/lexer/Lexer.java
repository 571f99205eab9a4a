package org.tmlang.compiler.frontend.lexer;

import org.tmlang.compiler.api.SourceSpan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * The Lexer converts the source code into a stream of tokens and tracks the
 * indentation of every line that starts with a token.
 * <p>
 * Tokens are consumed one at a time through {@link #advance()}. Whenever a token is the
 * first one on its line, the indentation stack is updated: a wider line pushes its width,
 * a narrower one pops every deeper level. A narrower width that matches no enclosing level
 * leaves the marker {@value #INVALID_INDENTATION} on top of the stack. The lexer never
 * throws on malformed input; the parser decides what an indentation change means.
 * <p>
 * A standalone {@code ##} token begins a comment which runs to the end of the line.
 */
public class Lexer {

    /** The value pushed on the indentation stack for a de-indentation to an unknown level. */
    public static final int INVALID_INDENTATION = -1;

    /** The reserved words of the language. */
    public static final Set<String> KEYWORDS = Set.of(
            "alphabet", "module", "if", "while", "else", "changeto", "move", "goto",
            "accept", "reject", "halt", "blank");

    private static final String COMMENT_MARKER = "##";

    private final String source;
    private final List<Lexeme> lexemes;
    private final List<Integer> indentationStack = new ArrayList<>();
    private final SourceSpan endOfInput;
    private int current = -1;
    private IndentationChange lastChange = IndentationChange.NONE;

    // Scanner state
    private int position = 0;
    private int line = 0;
    private int column = 0;
    private boolean lineStarted = false;

    /**
     * Creates a new Lexer and scans the whole source.
     * @param source The source code as a single string.
     */
    public Lexer(String source) {
        this.source = source;
        this.lexemes = scanTokens();
        this.endOfInput = SourceSpan.ofToken(line, column, column);
        indentationStack.add(0);
    }

    /**
     * Moves to the next token.
     * @return {@code true} if there was a next token; {@code false} at the end of the input,
     *         in which case the current token and the indentation stack stay as they were.
     */
    public boolean advance() {
        lastChange = IndentationChange.NONE;
        if (current + 1 >= lexemes.size()) {
            return false;
        }
        current++;
        Lexeme lexeme = lexemes.get(current);
        if (lexeme.startsLine()) {
            updateIndentation(lexeme.token().span().startColumn());
        }
        return true;
    }

    private void updateIndentation(int width) {
        int top = indentationStack.get(indentationStack.size() - 1);
        if (width > top) {
            indentationStack.add(width);
            lastChange = IndentationChange.INDENT;
        } else if (width < top) {
            while (indentationStack.get(indentationStack.size() - 1) > width) {
                indentationStack.remove(indentationStack.size() - 1);
            }
            if (indentationStack.get(indentationStack.size() - 1) != width) {
                indentationStack.add(INVALID_INDENTATION);
                lastChange = IndentationChange.INVALID;
            } else {
                lastChange = IndentationChange.DEDENT;
            }
        }
    }

    /**
     * @return The current token.
     * @throws IllegalStateException if {@link #advance()} has not yet returned a token.
     */
    public Token currentToken() {
        if (current < 0) {
            throw new IllegalStateException("No current value.");
        }
        return lexemes.get(current).token();
    }

    /**
     * @return The text of the current token.
     * @throws IllegalStateException if {@link #advance()} has not yet returned a token.
     */
    public String currentValue() {
        return currentToken().text();
    }

    /**
     * @return The source region of the current token.
     * @throws IllegalStateException if {@link #advance()} has not yet returned a token.
     */
    public SourceSpan currentSpan() {
        if (current < 0) {
            throw new IllegalStateException("No current position.");
        }
        return lexemes.get(current).token().span();
    }

    /**
     * @return Whether a token has been read yet.
     */
    public boolean hasCurrent() {
        return current >= 0;
    }

    /**
     * @return An empty span located right after the last character of the source.
     */
    public SourceSpan endOfInputSpan() {
        return endOfInput;
    }

    /**
     * @return A snapshot of the indentation stack, bottom first.
     */
    public List<Integer> indentationStack() {
        return Collections.unmodifiableList(new ArrayList<>(indentationStack));
    }

    /**
     * @return The number of entries on the indentation stack.
     */
    public int indentationDepth() {
        return indentationStack.size();
    }

    /**
     * @return How the last call to {@link #advance()} changed the indentation.
     */
    public IndentationChange lastIndentationChange() {
        return lastChange;
    }

    private List<Lexeme> scanTokens() {
        List<Lexeme> result = new ArrayList<>();
        while (!isAtEnd()) {
            char c = peek();
            if (c == '\n') {
                position++;
                line++;
                column = 0;
                lineStarted = false;
            } else if (Character.isWhitespace(c)) {
                advanceChar();
            } else if (atCommentMarker()) {
                while (!isAtEnd() && peek() != '\n') advanceChar();
            } else {
                result.add(scanToken());
            }
        }
        return result;
    }

    private Lexeme scanToken() {
        boolean startsLine = !lineStarted;
        lineStarted = true;
        int startColumn = column;
        int start = position;
        TokenType type = punctuation(peek());
        if (type != null) {
            advanceChar();
        } else {
            while (!isAtEnd() && !Character.isWhitespace(peek()) && punctuation(peek()) == null) {
                advanceChar();
            }
        }
        String text = source.substring(start, position);
        if (type == null) {
            type = KEYWORDS.contains(text) ? TokenType.KEYWORD : TokenType.WORD;
        }
        return new Lexeme(new Token(type, text, SourceSpan.ofToken(line, startColumn, column)), startsLine);
    }

    private boolean atCommentMarker() {
        int after = position + COMMENT_MARKER.length();
        return source.startsWith(COMMENT_MARKER, position)
                && (after >= source.length() || Character.isWhitespace(source.charAt(after)));
    }

    private static TokenType punctuation(char c) {
        switch (c) {
            case '=': return TokenType.EQUALS;
            case ',': return TokenType.COMMA;
            case ':': return TokenType.COLON;
            case '(': return TokenType.LEFT_PAREN;
            case ')': return TokenType.RIGHT_PAREN;
            case '[': return TokenType.LEFT_BRACKET;
            case ']': return TokenType.RIGHT_BRACKET;
            default: return null;
        }
    }

    private char peek() {
        return source.charAt(position);
    }

    private void advanceChar() {
        position++;
        column++;
    }

    private boolean isAtEnd() {
        return position >= source.length();
    }

    private record Lexeme(Token token, boolean startsLine) {
    }
}
