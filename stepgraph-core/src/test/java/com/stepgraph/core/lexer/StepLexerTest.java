package com.stepgraph.core.lexer;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.NoSuchElementException;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link StepLexer}.
 */
class StepLexerTest {

    @Test
    void tokenize_simpleInstance_producesTokensInOrder() {
        List<Token> tokens = StepLexer.tokenize("#1=POINT('P1',(0.,0.,0.));");

        assertThat(tokens).extracting(Token::kind).containsExactly(
            TokenKind.REFERENCE, TokenKind.EQUALS, TokenKind.IDENTIFIER, TokenKind.LEFT_PAREN,
            TokenKind.STRING, TokenKind.COMMA, TokenKind.LEFT_PAREN,
            TokenKind.REAL, TokenKind.COMMA, TokenKind.REAL, TokenKind.COMMA, TokenKind.REAL,
            TokenKind.RIGHT_PAREN, TokenKind.RIGHT_PAREN, TokenKind.SEMICOLON, TokenKind.END_OF_FILE
        );
        assertThat(tokens.get(0).text()).isEqualTo("#1");
        assertThat(tokens.get(2).text()).isEqualTo("POINT");
        assertThat(tokens.get(4).text()).isEqualTo("'P1'");
    }

    @Test
    void next_afterEndOfFile_throwsNoSuchElement() {
        StepLexer lexer = new StepLexer("  ");

        assertThat(lexer.hasNext()).isTrue();
        assertThat(lexer.next().kind()).isEqualTo(TokenKind.END_OF_FILE);
        assertThat(lexer.hasNext()).isFalse();
        assertThatThrownBy(lexer::next).isInstanceOf(NoSuchElementException.class);
    }

    @Test
    void next_producesTokensLazily() {
        // Given: garbage after the first statement
        StepLexer lexer = new StepLexer("#1=A();@");

        // When: only the first token is pulled
        Token first = lexer.next();

        // Then: the garbage has not been looked at yet
        assertThat(first.kind()).isEqualTo(TokenKind.REFERENCE);
        assertThat(lexer.lexErrors()).isEmpty();
    }

    @Test
    void tokenize_tracksLineAndColumn() {
        List<Token> tokens = StepLexer.tokenize("#1=A();\n  #2=B(#1);");

        Token second = tokens.stream().filter(t -> t.text().equals("#2")).findFirst().orElseThrow();
        assertThat(second.line()).isEqualTo(2);
        assertThat(second.column()).isEqualTo(3);
        assertThat(second.offset()).isEqualTo(10);
    }

    @Test
    void tokenize_skipsComments() {
        List<Token> tokens = StepLexer.tokenize("/* header\n comment */ #1=A();");

        assertThat(tokens.get(0).kind()).isEqualTo(TokenKind.REFERENCE);
        assertThat(tokens.get(0).line()).isEqualTo(2);
        assertThat(tokens.get(0).column()).isEqualTo(13);
    }

    @Test
    void tokenize_stringWithDoubledQuote_isSingleToken() {
        List<Token> tokens = StepLexer.tokenize("'it''s'");

        assertThat(tokens).hasSize(2);
        assertThat(tokens.get(0).kind()).isEqualTo(TokenKind.STRING);
        assertThat(tokens.get(0).text()).isEqualTo("'it''s'");
    }

    @Test
    void tokenize_stringContainingSpecialCharacters_isSingleToken() {
        List<Token> tokens = StepLexer.tokenize("'a;b#1(c)$*'");

        assertThat(tokens).extracting(Token::kind).containsExactly(TokenKind.STRING, TokenKind.END_OF_FILE);
    }

    @Test
    void tokenize_unterminatedString_recordsLexError() {
        StepLexer lexer = new StepLexer("#1=A('abc);");
        List<Token> tokens = List.of(lexer.next(), lexer.next(), lexer.next(), lexer.next(), lexer.next());

        assertThat(tokens.get(4).kind()).isEqualTo(TokenKind.INVALID);
        assertThat(tokens.get(4).text()).isEqualTo("'abc);");
        assertThat(lexer.lexErrors()).singleElement()
            .satisfies(error -> {
                assertThat(error.reason()).isEqualTo("unterminated string");
                assertThat(error.column()).isEqualTo(6);
            });
    }

    @Test
    void tokenize_bareHash_isInvalid() {
        StepLexer lexer = new StepLexer("# 1");

        assertThat(lexer.next().kind()).isEqualTo(TokenKind.INVALID);
        assertThat(lexer.lexErrors().get(0).reason()).isEqualTo("expected digits after '#'");
        assertThat(lexer.next().kind()).isEqualTo(TokenKind.INTEGER);
    }

    @Test
    void tokenize_unterminatedComment_isInvalid() {
        List<Token> tokens = StepLexer.tokenize("#1=A(); /* open");

        assertThat(tokens.get(tokens.size() - 2).kind()).isEqualTo(TokenKind.INVALID);
        assertThat(tokens.get(tokens.size() - 1).kind()).isEqualTo(TokenKind.END_OF_FILE);
    }

    @Test
    void tokenize_sectionKeywords() {
        List<Token> tokens = StepLexer.tokenize("ISO-10303-21; HEADER; ENDSEC; DATA; END-ISO-10303-21;");

        assertThat(tokens)
            .filteredOn(t -> t.kind() == TokenKind.KEYWORD)
            .extracting(Token::text)
            .containsExactly("ISO-10303-21", "HEADER", "ENDSEC", "DATA", "END-ISO-10303-21");
    }

    @ParameterizedTest
    @CsvSource({
        "12, INTEGER",
        "-3, INTEGER",
        "+7, INTEGER",
        "0., REAL",
        "1.5E-3, REAL",
        "-2.5e+10, REAL",
        ".T., ENUMERATION",
        ".UNDEFINED., ENUMERATION",
        "$, DOLLAR",
        "*, ASTERISK",
        "IFCWALL, IDENTIFIER",
        "!MYTYPE, IDENTIFIER",
        "#42, REFERENCE",
        "\"0FF\", BINARY",
        "\"5FF\", INVALID",
        "@, INVALID"
    })
    void tokenize_singleLexeme_hasExpectedKind(String text, TokenKind kind) {
        List<Token> tokens = StepLexer.tokenize(text);

        assertThat(tokens).hasSize(2);
        assertThat(tokens.get(0).kind()).isEqualTo(kind);
        assertThat(tokens.get(0).text()).isEqualTo(text);
    }

    @Test
    void tokenize_negativeNumberInList() {
        List<Token> tokens = StepLexer.tokenize("(1,-3)");

        assertThat(tokens).extracting(Token::text).containsExactly("(", "1", ",", "-3", ")", "");
    }
}
