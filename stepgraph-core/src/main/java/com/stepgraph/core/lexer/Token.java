package com.stepgraph.core.lexer;

import java.util.Objects;

/**
 * A single lexical token of a STEP physical file.
 *
 * @param kind token kind
 * @param text raw source text of the token
 * @param offset absolute character offset in the source
 * @param line 1-based source line
 * @param column 1-based source column
 */
public record Token(
    TokenKind kind,
    String text,
    int offset,
    int line,
    int column
) {
    /**
     * Compact constructor with validation.
     */
    public Token {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(text, "text must not be null");
    }

    /**
     * Returns true if this token has the given kind.
     *
     * @param expected kind to test
     * @return true on match
     */
    public boolean is(TokenKind expected) {
        return kind == expected;
    }

    /**
     * Returns true if this token is the given section keyword.
     *
     * @param keyword keyword text, e.g. "ENDSEC"
     * @return true on match
     */
    public boolean isKeyword(String keyword) {
        return kind == TokenKind.KEYWORD && text.equals(keyword);
    }
}
