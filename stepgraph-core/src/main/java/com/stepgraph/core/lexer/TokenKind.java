package com.stepgraph.core.lexer;

/**
 * Kinds of tokens produced by {@link StepLexer}.
 */
public enum TokenKind {
    /** Entity or header type name, also user-defined {@code !NAME} keywords */
    IDENTIFIER,

    /** Section boundary: {@code ISO-10303-21}, {@code HEADER}, {@code DATA}, {@code ENDSEC}, {@code END-ISO-10303-21} */
    KEYWORD,

    INTEGER,

    REAL,

    /** Quoted string, raw text still carries the quotes and escapes */
    STRING,

    /** Enumeration literal such as {@code .T.} or {@code .UNDEFINED.} */
    ENUMERATION,

    /** Binary literal such as {@code "0A1F"} */
    BINARY,

    /** Entity instance name {@code #123} */
    REFERENCE,

    LEFT_PAREN,

    RIGHT_PAREN,

    COMMA,

    SEMICOLON,

    EQUALS,

    /** Unset attribute marker {@code $} */
    DOLLAR,

    /** Derived / redeclared attribute marker {@code *} */
    ASTERISK,

    /** Character sequence the lexer could not recognize */
    INVALID,

    END_OF_FILE;

    /**
     * Returns a lowercase, human readable name used in diagnostics.
     *
     * @return display name, e.g. "right paren"
     */
    public String displayName() {
        return name().toLowerCase().replace('_', ' ');
    }
}
