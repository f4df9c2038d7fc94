package com.stepgraph.core.lexer;

/**
 * Diagnostic for a character sequence the lexer could not recognize.
 *
 * <p>Lexing never fails; the offending text is emitted as an {@link TokenKind#INVALID}
 * token and reported here so the parser can raise a pinpointed error.
 *
 * @param offset absolute character offset
 * @param line 1-based line
 * @param column 1-based column
 * @param text offending source text
 * @param reason short description of the problem
 */
public record LexError(
    int offset,
    int line,
    int column,
    String text,
    String reason
) {
    @Override
    public String toString() {
        return "line " + line + " column " + column + ": " + reason + " ('" + text + "')";
    }
}
