package com.stepgraph.core.parser;

import com.stepgraph.core.error.StepParseException;
import com.stepgraph.core.lexer.LexError;
import com.stepgraph.core.lexer.StepLexer;
import com.stepgraph.core.lexer.Token;
import com.stepgraph.core.lexer.TokenKind;
import com.stepgraph.core.util.SourceLines;

/**
 * Token cursor shared by the parsing methods of {@link StepParser}.
 *
 * <p>Holds one token of lookahead over a {@link StepLexer}; tokens are pulled on demand
 * and never revisited.
 */
class ParseContext {

    /** Deepest accepted nesting of parameter lists and typed parameters */
    static final int MAX_NESTING_DEPTH = 1000;

    private final StepLexer lexer;
    private Token current;
    private int consumed;
    private int depth;

    ParseContext(StepLexer lexer) {
        this.lexer = lexer;
        this.current = lexer.next();
    }

    Token current() {
        return current;
    }

    boolean at(TokenKind kind) {
        return current.is(kind);
    }

    boolean atKeyword(String keyword) {
        return current.isKeyword(keyword);
    }

    /**
     * Consumes the current token and returns it.
     */
    Token advance() {
        Token token = current;
        if (!token.is(TokenKind.END_OF_FILE)) {
            current = lexer.next();
            consumed++;
        }
        return token;
    }

    /**
     * Consumes the current token if it has the expected kind, otherwise fails.
     *
     * @param kind expected kind
     * @param expectation description used in the error message
     */
    Token expect(TokenKind kind, String expectation) throws StepParseException {
        if (!current.is(kind)) {
            throw error(expectation);
        }
        return advance();
    }

    Token expectKeyword(String keyword) throws StepParseException {
        if (!current.isKeyword(keyword)) {
            throw error(keyword);
        }
        return advance();
    }

    /**
     * Opens one nesting level at the current token.
     *
     * @throws StepParseException if the nesting limit is exceeded
     */
    void enterNested() throws StepParseException {
        if (++depth > MAX_NESTING_DEPTH) {
            throw error("parameter nesting of at most " + MAX_NESTING_DEPTH + " levels");
        }
    }

    void leaveNested() {
        depth--;
    }

    /**
     * Builds a parse error at the current token.
     */
    StepParseException error(String expectation) {
        return errorAt(current, expectation);
    }

    StepParseException errorAt(Token token, String expectation) {
        String detail = null;
        if (token.is(TokenKind.INVALID)) {
            detail = lexer.lexErrors().stream()
                .filter(e -> e.offset() == token.offset())
                .map(LexError::reason)
                .findFirst()
                .orElse(null);
        }
        return new StepParseException(token, expectation, SourceLines.lineAt(lexer.source(), token.line()), detail);
    }

    int consumedTokens() {
        return consumed;
    }
}
