package com.stepgraph.core.error;

import com.stepgraph.core.lexer.Token;
import com.stepgraph.core.lexer.TokenKind;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Malformed physical file syntax. Parsing stops at the first one.
 *
 * <p>The message pinpoints the offending token:
 * <pre>
 * On line 7 column 18:
 * Unexpected semicolon (';')
 * Expecting right paren
 * 00007 | #2=LINE('L',#1,#1;
 *                          ^
 * </pre>
 */
public class StepParseException extends StepValidationException {

    private static final String UNEXPECTED_TOKEN = "unexpected_token";
    private static final String UNEXPECTED_CHARACTER = "unexpected_character";

    private final int line;
    private final int column;
    private final int offset;
    private final TokenKind foundKind;
    private final String foundText;
    private final String expected;
    private final String sourceLine;
    private final String detail;

    /**
     * Creates a parse error for an unexpected token.
     *
     * @param found the offending token
     * @param expected human readable expectation, e.g. "right paren"
     * @param sourceLine the full source line containing the token
     * @param detail optional lexer reason for invalid tokens, may be null
     */
    public StepParseException(Token found, String expected, String sourceLine, String detail) {
        super(format(found, expected, sourceLine, detail));
        Objects.requireNonNull(found, "found must not be null");
        this.line = found.line();
        this.column = found.column();
        this.offset = found.offset();
        this.foundKind = found.kind();
        this.foundText = found.text();
        this.expected = expected;
        this.sourceLine = sourceLine;
        this.detail = detail;
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }

    public int offset() {
        return offset;
    }

    public TokenKind foundKind() {
        return foundKind;
    }

    public String foundText() {
        return foundText;
    }

    public String expected() {
        return expected;
    }

    public String sourceLine() {
        return sourceLine;
    }

    @Override
    public String type() {
        return foundKind == TokenKind.INVALID ? UNEXPECTED_CHARACTER : UNEXPECTED_TOKEN;
    }

    @Override
    public Map<String, Object> toDiagnostic() {
        Map<String, Object> diagnostic = new LinkedHashMap<>();
        diagnostic.put("type", type());
        diagnostic.put("lineno", line);
        diagnostic.put("column", column);
        diagnostic.put("found_type", foundKind.name().toLowerCase());
        diagnostic.put("found_value", foundText);
        diagnostic.put("expected", expected);
        if (detail != null) {
            diagnostic.put("detail", detail);
        }
        diagnostic.put("line", sourceLine);
        diagnostic.put("message", getMessage());
        return diagnostic;
    }

    private static String format(Token found, String expected, String sourceLine, String detail) {
        String what = found.kind() == TokenKind.INVALID
            ? "character" + (detail != null ? " (" + detail + ")" : "")
            : found.kind().displayName();
        return "On line " + found.line() + " column " + found.column() + ":\n"
            + "Unexpected " + what + " ('" + found.text() + "')\n"
            + "Expecting " + expected + "\n"
            + String.format("%05d | %s", found.line(), sourceLine) + "\n"
            + " ".repeat(8 + Math.max(0, found.column() - 1)) + "^";
    }
}
