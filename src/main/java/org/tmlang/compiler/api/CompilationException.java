package org.tmlang.compiler.api;

import org.tmlang.compiler.diagnostics.Diagnostic;

/**
 * An exception that is thrown when an error occurs during the compilation process.
 * <p>
 * The compiler stops at the first error. The message is the bare diagnostic text,
 * the position is available through {@link #getDiagnostic()}.
 */
public class CompilationException extends Exception {

    private final transient Diagnostic diagnostic;

    /**
     * Constructs a new compilation exception for the given diagnostic.
     * @param diagnostic The error that stopped the compilation.
     */
    public CompilationException(Diagnostic diagnostic) {
        super(diagnostic.message(), null);
        this.diagnostic = diagnostic;
    }

    /**
     * Constructs a new compilation exception from its parts.
     * @param category The kind of error.
     * @param message The detail message.
     * @param span The source region the error refers to.
     */
    public CompilationException(Diagnostic.Category category, String message, SourceSpan span) {
        this(new Diagnostic(category, message, span));
    }

    /**
     * @return The diagnostic describing the error.
     */
    public Diagnostic getDiagnostic() {
        return diagnostic;
    }

    /**
     * @return The source region the error refers to.
     */
    public SourceSpan getSpan() {
        return diagnostic.span();
    }
}
