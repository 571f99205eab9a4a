package org.tmlang.compiler.diagnostics;

import org.tmlang.compiler.api.SourceSpan;

/**
 * Represents a single error found while compiling a program.
 *
 * @param category The stage family that detected the problem.
 * @param message The diagnostic message.
 * @param span The region of the source code the message refers to.
 */
public record Diagnostic(
        Category category,
        String message,
        SourceSpan span
) {
    /**
     * The kind of a diagnostic.
     */
    public enum Category {
        /** Inconsistent or unexpected indentation. */
        INDENTATION,
        /** Source text that does not follow the grammar. */
        SYNTAX,
        /** A well-formed program that breaks a semantic rule. */
        SEMANTIC
    }

    @Override
    public String toString() {
        return String.format("[%s] %s: %s", category, span, message);
    }
}
