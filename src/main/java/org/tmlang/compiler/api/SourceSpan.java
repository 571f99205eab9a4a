package org.tmlang.compiler.api;

/**
 * A region of the source code. Lines and columns are 0-based, the end column is exclusive
 * and a single token spans from its line to the following one.
 *
 * @param startLine The line on which the region starts.
 * @param endLine The line after the last line of the region.
 * @param startColumn The column of the first character.
 * @param endColumn The column after the last character.
 */
public record SourceSpan(int startLine, int endLine, int startColumn, int endColumn) {

    /**
     * Creates the span of a single token.
     * @param line The line of the token.
     * @param startColumn The column of its first character.
     * @param endColumn The column after its last character.
     * @return The span covering the token.
     */
    public static SourceSpan ofToken(int line, int startColumn, int endColumn) {
        return new SourceSpan(line, line + 1, startColumn, endColumn);
    }

    /**
     * Combines two spans into one reaching from the start of {@code start} to the end of {@code end}.
     * @param start The span providing the start position.
     * @param end The span providing the end position.
     * @return The combined span.
     */
    public static SourceSpan combine(SourceSpan start, SourceSpan end) {
        return new SourceSpan(start.startLine, end.endLine, start.startColumn, end.endColumn);
    }

    /**
     * @return The start position in the human readable {@code line:column} form (1-based).
     */
    @Override
    public String toString() {
        return (startLine + 1) + ":" + (startColumn + 1);
    }
}
