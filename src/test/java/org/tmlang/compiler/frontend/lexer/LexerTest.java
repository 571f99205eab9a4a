package org.tmlang.compiler.frontend.lexer;

import org.tmlang.compiler.api.SourceSpan;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link Lexer}: tokenization, source spans and the
 * indentation stack.
 */
@Tag("unit")
public class LexerTest {

    private static List<Token> allTokens(Lexer lexer) {
        List<Token> tokens = new ArrayList<>();
        while (lexer.advance()) {
            tokens.add(lexer.currentToken());
        }
        return tokens;
    }

    /**
     * Verifies that punctuation is split from words, that keywords are recognized and that
     * every token carries a 0-based span with an exclusive end column.
     */
    @Test
    void tokenizesWithSpans() {
        // Arrange
        Lexer lexer = new Lexer(String.join("\n",
                "alphabet = [a, b]",
                "module m():",
                "    accept"));

        // Act
        List<Token> tokens = allTokens(lexer);

        // Assert
        assertThat(tokens).extracting(Token::text).containsExactly(
                "alphabet", "=", "[", "a", ",", "b", "]",
                "module", "m", "(", ")", ":",
                "accept");
        assertThat(tokens).extracting(Token::type).startsWith(
                TokenType.KEYWORD, TokenType.EQUALS, TokenType.LEFT_BRACKET, TokenType.WORD,
                TokenType.COMMA, TokenType.WORD, TokenType.RIGHT_BRACKET);
        assertThat(tokens.get(0).span()).isEqualTo(new SourceSpan(0, 1, 0, 8));
        assertThat(tokens.get(3).span()).isEqualTo(new SourceSpan(0, 1, 12, 13));
        assertThat(tokens.get(11).span()).isEqualTo(new SourceSpan(1, 2, 10, 11));
        assertThat(tokens.get(12).span()).isEqualTo(new SourceSpan(2, 3, 4, 10));
    }

    /**
     * Verifies that wider lines push their width and a return to an enclosing level pops
     * every deeper one at once.
     */
    @Test
    void tracksIndentationLevels() {
        // Arrange
        Lexer lexer = new Lexer("a\n    b\n        c\nd");

        // Act & Assert
        assertThat(lexer.advance()).isTrue();
        assertThat(lexer.indentationStack()).containsExactly(0);
        assertThat(lexer.lastIndentationChange()).isEqualTo(IndentationChange.NONE);

        lexer.advance();
        assertThat(lexer.indentationStack()).containsExactly(0, 4);
        assertThat(lexer.lastIndentationChange()).isEqualTo(IndentationChange.INDENT);

        lexer.advance();
        assertThat(lexer.indentationStack()).containsExactly(0, 4, 8);
        assertThat(lexer.indentationDepth()).isEqualTo(3);

        lexer.advance();
        assertThat(lexer.currentValue()).isEqualTo("d");
        assertThat(lexer.indentationStack()).containsExactly(0);
        assertThat(lexer.lastIndentationChange()).isEqualTo(IndentationChange.DEDENT);
    }

    /**
     * Verifies that returning to a width matching no enclosing level leaves the invalid marker.
     */
    @Test
    void marksMalformedDedent() {
        // Arrange
        Lexer lexer = new Lexer("a\n    b\n  c");

        // Act
        allTokens(lexer);

        // Assert
        assertThat(lexer.indentationStack()).containsExactly(0, Lexer.INVALID_INDENTATION);
        assertThat(lexer.currentValue()).isEqualTo("c");
    }

    /**
     * Verifies that the invalid marker is reported as such by the last advance.
     */
    @Test
    void reportsInvalidIndentationChange() {
        // Arrange
        Lexer lexer = new Lexer("a\n    b\n  c");
        lexer.advance();
        lexer.advance();

        // Act
        lexer.advance();

        // Assert
        assertThat(lexer.lastIndentationChange()).isEqualTo(IndentationChange.INVALID);
    }

    /**
     * Verifies that tokens on the same line never change the indentation.
     */
    @Test
    void tokensOnTheSameLineKeepIndentation() {
        // Arrange
        Lexer lexer = new Lexer("    a b");
        lexer.advance();

        // Act
        lexer.advance();

        // Assert
        assertThat(lexer.currentValue()).isEqualTo("b");
        assertThat(lexer.lastIndentationChange()).isEqualTo(IndentationChange.NONE);
        assertThat(lexer.indentationStack()).containsExactly(0, 4);
    }

    /**
     * Verifies that whole-line and trailing comments are skipped without touching the indentation.
     */
    @Test
    void skipsComments() {
        // Arrange
        Lexer lexer = new Lexer(String.join("\n",
                "## leading comment",
                "a ## trailing comment",
                "        ## comment at another width",
                "b"));

        // Act
        List<Token> tokens = allTokens(lexer);

        // Assert
        assertThat(tokens).extracting(Token::text).containsExactly("a", "b");
        assertThat(lexer.indentationStack()).containsExactly(0);
        assertThat(tokens.get(1).span()).isEqualTo(new SourceSpan(3, 4, 0, 1));
    }

    /**
     * Verifies that only a standalone marker starts a comment.
     */
    @Test
    void markerMustStandAlone() {
        // Arrange
        Lexer lexer = new Lexer(String.join("\n",
                "##abc b",
                "c ##"));

        // Act
        List<Token> tokens = allTokens(lexer);

        // Assert
        assertThat(tokens).extracting(Token::text).containsExactly("##abc", "b", "c");
        assertThat(tokens.get(0).type()).isEqualTo(TokenType.WORD);
    }

    /**
     * Verifies that advancing past the end fails softly and keeps the last token and stack.
     */
    @Test
    void keepsLastTokenAtEnd() {
        // Arrange
        Lexer lexer = new Lexer("a\n    b");
        allTokens(lexer);

        // Act
        boolean moved = lexer.advance();

        // Assert
        assertThat(moved).isFalse();
        assertThat(lexer.currentValue()).isEqualTo("b");
        assertThat(lexer.currentSpan()).isEqualTo(new SourceSpan(1, 2, 4, 5));
        assertThat(lexer.indentationStack()).containsExactly(0, 4);
    }

    /**
     * Verifies that the current token cannot be read before the first advance.
     */
    @Test
    void rejectsAccessBeforeFirstAdvance() {
        // Arrange
        Lexer lexer = new Lexer("a");

        // Act & Assert
        assertThat(lexer.hasCurrent()).isFalse();
        assertThatThrownBy(lexer::currentToken)
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("No current value.");
        assertThatThrownBy(lexer::currentSpan)
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("No current position.");
    }

    /**
     * Verifies that empty input yields no tokens and an end position at the origin.
     */
    @Test
    void handlesEmptyInput() {
        // Arrange
        Lexer lexer = new Lexer("");

        // Act & Assert
        assertThat(lexer.advance()).isFalse();
        assertThat(lexer.endOfInputSpan()).isEqualTo(new SourceSpan(0, 1, 0, 0));
    }

    /**
     * Verifies that the end of input is located after the last character.
     */
    @Test
    void locatesEndOfInput() {
        // Arrange
        Lexer lexer = new Lexer("ab\ncd");

        // Act & Assert
        assertThat(lexer.endOfInputSpan()).isEqualTo(new SourceSpan(1, 2, 2, 2));
    }
}
