package org.tmlang.compiler.frontend.lexer;

import org.tmlang.compiler.api.SourceSpan;

/**
 * Represents a single token extracted from the source code by the {@link Lexer}.
 *
 * @param type The type of the token.
 * @param text The exact text of the token from the source code.
 * @param span The region of the source code the token covers.
 */
public record Token(
        TokenType type,
        String text,
        SourceSpan span
) {
}
