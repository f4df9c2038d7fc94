package com.stepgraph.core.lexer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;

/**
 * Pull-based lexer for the ISO-10303-21 physical file syntax.
 *
 * <p>Tokens are produced lazily, one per {@link #next()} call, in a single forward pass.
 * The sequence always ends with exactly one {@link TokenKind#END_OF_FILE} token and is
 * not restartable.
 *
 * <p>The lexer never throws on malformed input. Unrecognized characters, unterminated
 * strings and unterminated comments become {@link TokenKind#INVALID} tokens and are
 * recorded in {@link #lexErrors()}; the parser turns them into a pinpointed error.
 *
 * <p><b>Recognized lexemes:</b>
 * <ul>
 *   <li>Quoted strings, where {@code ''} stands for one literal quote</li>
 *   <li>Enumerations {@code .T.}, {@code .UNDEFINED.}</li>
 *   <li>Entity names {@code #123}</li>
 *   <li>Integers and reals ({@code 12}, {@code -3}, {@code 0.}, {@code 1.5E-3})</li>
 *   <li>Binary literals {@code "0A1F"}</li>
 *   <li>The markers {@code $} and {@code *}</li>
 *   <li>Section keywords {@code ISO-10303-21}, {@code HEADER}, {@code DATA}, {@code ENDSEC},
 *       {@code END-ISO-10303-21}</li>
 * </ul>
 * Whitespace and {@code /* ... *}{@code /} comments are skipped.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * StepLexer lexer = new StepLexer("#1=POINT('P1',(0.,0.,0.));");
 * while (lexer.hasNext()) {
 *     Token token = lexer.next();
 *     ...
 * }
 * }</pre>
 */
public class StepLexer implements Iterator<Token> {

    private static final Set<String> SECTION_KEYWORDS = Set.of("HEADER", "DATA", "ENDSEC");
    private static final String ISO_PREFIX = "ISO-";
    private static final String END_ISO_PREFIX = "END-ISO-";

    private final String source;
    private final List<LexError> lexErrors = new ArrayList<>();

    private int pos;
    private int line = 1;
    private int lineStart;
    private boolean finished;

    /**
     * Creates a lexer over the full file text.
     *
     * @param source file content
     */
    public StepLexer(String source) {
        this.source = Objects.requireNonNull(source, "source must not be null");
    }

    /**
     * Tokenizes the whole input eagerly.
     *
     * @param source file content
     * @return all tokens, ending with {@link TokenKind#END_OF_FILE}
     */
    public static List<Token> tokenize(String source) {
        StepLexer lexer = new StepLexer(source);
        List<Token> tokens = new ArrayList<>();
        lexer.forEachRemaining(tokens::add);
        return tokens;
    }

    /**
     * Returns the lexical problems seen so far.
     *
     * @return unmodifiable list of lex errors, in source order
     */
    public List<LexError> lexErrors() {
        return Collections.unmodifiableList(lexErrors);
    }

    /**
     * Returns the source text this lexer reads.
     *
     * @return source text
     */
    public String source() {
        return source;
    }

    @Override
    public boolean hasNext() {
        return !finished;
    }

    @Override
    public Token next() {
        if (finished) {
            throw new NoSuchElementException("Token stream already exhausted");
        }

        Token comment = skipTrivia();
        if (comment != null) {
            return comment;
        }

        if (pos >= source.length()) {
            finished = true;
            return token(TokenKind.END_OF_FILE, pos, line, column(pos));
        }

        int start = pos;
        int startLine = line;
        int startColumn = column(pos);
        char c = source.charAt(pos);

        switch (c) {
            case '(':
                pos++;
                return token(TokenKind.LEFT_PAREN, start, startLine, startColumn);
            case ')':
                pos++;
                return token(TokenKind.RIGHT_PAREN, start, startLine, startColumn);
            case ',':
                pos++;
                return token(TokenKind.COMMA, start, startLine, startColumn);
            case ';':
                pos++;
                return token(TokenKind.SEMICOLON, start, startLine, startColumn);
            case '=':
                pos++;
                return token(TokenKind.EQUALS, start, startLine, startColumn);
            case '$':
                pos++;
                return token(TokenKind.DOLLAR, start, startLine, startColumn);
            case '*':
                pos++;
                return token(TokenKind.ASTERISK, start, startLine, startColumn);
            case '\'':
                return readString(start, startLine, startColumn);
            case '"':
                return readBinary(start, startLine, startColumn);
            case '#':
                return readReference(start, startLine, startColumn);
            case '.':
                return readEnumeration(start, startLine, startColumn);
            case '!':
                return readUserKeyword(start, startLine, startColumn);
            default:
                break;
        }

        if (isDigit(c) || ((c == '+' || c == '-') && isDigit(peek(1)))) {
            return readNumber(start, startLine, startColumn);
        }
        if (isLetter(c) || c == '_') {
            return readWord(start, startLine, startColumn);
        }

        pos++;
        return invalid(start, startLine, startColumn, "unrecognized character");
    }

    /**
     * Skips whitespace and comments.
     *
     * @return an invalid token for an unterminated comment, otherwise null
     */
    private Token skipTrivia() {
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == '\n') {
                pos++;
                line++;
                lineStart = pos;
            } else if (Character.isWhitespace(c)) {
                pos++;
            } else if (c == '/' && peek(1) == '*') {
                int start = pos;
                int startLine = line;
                int startColumn = column(pos);
                int end = source.indexOf("*/", pos + 2);
                if (end < 0) {
                    advanceTo(source.length());
                    return invalid(start, startLine, startColumn, "unterminated comment");
                }
                advanceTo(end + 2);
            } else {
                return null;
            }
        }
        return null;
    }

    private Token readString(int start, int startLine, int startColumn) {
        int i = pos + 1;
        while (i < source.length()) {
            char c = source.charAt(i);
            if (c == '\'') {
                if (i + 1 < source.length() && source.charAt(i + 1) == '\'') {
                    i += 2;
                    continue;
                }
                advanceTo(i + 1);
                return token(TokenKind.STRING, start, startLine, startColumn);
            }
            i++;
        }
        advanceTo(source.length());
        return invalid(start, startLine, startColumn, "unterminated string");
    }

    private Token readBinary(int start, int startLine, int startColumn) {
        int end = source.indexOf('"', pos + 1);
        if (end < 0) {
            advanceTo(source.length());
            return invalid(start, startLine, startColumn, "unterminated binary literal");
        }
        advanceTo(end + 1);
        String body = source.substring(start + 1, end);
        if (!isValidBinary(body)) {
            return invalid(start, startLine, startColumn, "malformed binary literal");
        }
        return token(TokenKind.BINARY, start, startLine, startColumn);
    }

    private Token readReference(int start, int startLine, int startColumn) {
        int i = pos + 1;
        while (i < source.length() && isDigit(source.charAt(i))) {
            i++;
        }
        if (i == pos + 1) {
            pos++;
            return invalid(start, startLine, startColumn, "expected digits after '#'");
        }
        pos = i;
        return token(TokenKind.REFERENCE, start, startLine, startColumn);
    }

    private Token readEnumeration(int start, int startLine, int startColumn) {
        int i = pos + 1;
        if (i >= source.length() || !(isLetter(source.charAt(i)) || source.charAt(i) == '_')) {
            pos++;
            return invalid(start, startLine, startColumn, "expected enumeration literal");
        }
        while (i < source.length() && isWordChar(source.charAt(i))) {
            i++;
        }
        if (i >= source.length() || source.charAt(i) != '.') {
            pos = i;
            return invalid(start, startLine, startColumn, "unterminated enumeration literal");
        }
        pos = i + 1;
        return token(TokenKind.ENUMERATION, start, startLine, startColumn);
    }

    private Token readUserKeyword(int start, int startLine, int startColumn) {
        int i = pos + 1;
        if (i >= source.length() || !isLetter(source.charAt(i))) {
            pos++;
            return invalid(start, startLine, startColumn, "expected user-defined keyword after '!'");
        }
        while (i < source.length() && isWordChar(source.charAt(i))) {
            i++;
        }
        pos = i;
        return token(TokenKind.IDENTIFIER, start, startLine, startColumn);
    }

    private Token readNumber(int start, int startLine, int startColumn) {
        int i = pos;
        if (source.charAt(i) == '+' || source.charAt(i) == '-') {
            i++;
        }
        while (i < source.length() && isDigit(source.charAt(i))) {
            i++;
        }
        boolean real = false;
        if (i < source.length() && source.charAt(i) == '.') {
            real = true;
            i++;
            while (i < source.length() && isDigit(source.charAt(i))) {
                i++;
            }
            if (i < source.length() && (source.charAt(i) == 'E' || source.charAt(i) == 'e')) {
                int exponent = i + 1;
                if (exponent < source.length() && (source.charAt(exponent) == '+' || source.charAt(exponent) == '-')) {
                    exponent++;
                }
                if (exponent < source.length() && isDigit(source.charAt(exponent))) {
                    i = exponent;
                    while (i < source.length() && isDigit(source.charAt(i))) {
                        i++;
                    }
                }
            }
        }
        pos = i;
        return token(real ? TokenKind.REAL : TokenKind.INTEGER, start, startLine, startColumn);
    }

    private Token readWord(int start, int startLine, int startColumn) {
        int i = pos;
        while (i < source.length() && isWordChar(source.charAt(i))) {
            i++;
        }
        String word = source.substring(start, i);
        if ((word.equals("ISO") || word.equals("END")) && i < source.length() && source.charAt(i) == '-') {
            while (i < source.length() && (isWordChar(source.charAt(i)) || source.charAt(i) == '-')) {
                i++;
            }
            word = source.substring(start, i);
        }
        pos = i;
        boolean keyword = SECTION_KEYWORDS.contains(word)
            || word.startsWith(ISO_PREFIX)
            || word.startsWith(END_ISO_PREFIX);
        return token(keyword ? TokenKind.KEYWORD : TokenKind.IDENTIFIER, start, startLine, startColumn);
    }

    private Token token(TokenKind kind, int start, int startLine, int startColumn) {
        return new Token(kind, source.substring(start, pos), start, startLine, startColumn);
    }

    private Token invalid(int start, int startLine, int startColumn, String reason) {
        Token token = token(TokenKind.INVALID, start, startLine, startColumn);
        lexErrors.add(new LexError(start, startLine, startColumn, token.text(), reason));
        return token;
    }

    /**
     * Moves the cursor forward, keeping line bookkeeping for skipped newlines.
     */
    private void advanceTo(int target) {
        while (pos < target) {
            if (source.charAt(pos) == '\n') {
                line++;
                lineStart = pos + 1;
            }
            pos++;
        }
    }

    private int column(int offset) {
        return offset - lineStart + 1;
    }

    private char peek(int ahead) {
        int i = pos + ahead;
        return i < source.length() ? source.charAt(i) : '\0';
    }

    private static boolean isValidBinary(String body) {
        if (body.isEmpty() || body.charAt(0) < '0' || body.charAt(0) > '3') {
            return false;
        }
        for (int i = 1; i < body.length(); i++) {
            char c = body.charAt(i);
            if (!(isDigit(c) || (c >= 'A' && c <= 'F'))) {
                return false;
            }
        }
        return true;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isLetter(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z');
    }

    private static boolean isWordChar(char c) {
        return isLetter(c) || isDigit(c) || c == '_';
    }
}
