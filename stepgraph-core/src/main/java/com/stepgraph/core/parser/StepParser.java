package com.stepgraph.core.parser;

import com.stepgraph.core.error.StepParseException;
import com.stepgraph.core.lexer.StepLexer;
import com.stepgraph.core.lexer.StepStrings;
import com.stepgraph.core.lexer.Token;
import com.stepgraph.core.lexer.TokenKind;
import com.stepgraph.core.model.AttributeValue;
import com.stepgraph.core.model.EntityRecord;
import com.stepgraph.core.model.EntitySegment;
import com.stepgraph.core.model.HeaderEntity;
import com.stepgraph.core.model.StepFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Recursive descent parser for ISO-10303-21 physical files.
 *
 * <p>Consumes the token stream of a {@link StepLexer} once, front to back, and produces
 * one {@link EntityRecord} per instance statement of the DATA sections. The HEADER
 * section is parsed into plain {@link HeaderEntity} entries and otherwise left alone.
 *
 * <p><b>Instance forms:</b>
 * <ul>
 *   <li>Simple: {@code #1=POINT('P1',(0.,0.,0.));}</li>
 *   <li>Complex: {@code #2=(LENGTH_UNIT()NAMED_UNIT(*)SI_UNIT(.MILLI.,.METRE.));}, also
 *       accepted without the enclosing parentheses</li>
 * </ul>
 * Parameter lists nest up to {@value ParseContext#MAX_NESTING_DEPTH} levels.
 *
 * <p>Parsing is fail-fast: the first syntax error aborts with a {@link StepParseException}
 * carrying line, column and the expectation that was not met. No partial result is
 * returned.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * StepFile file = new StepParser(Files.readString(path)).parseFile();
 *
 * // Bare statements without the file envelope
 * List<EntityRecord> records = new StepParser("#1=A(#2);#2=B();").parseInstances();
 * }</pre>
 */
public class StepParser {

    private static final Logger log = LoggerFactory.getLogger(StepParser.class);

    private static final String ISO_KEYWORD_PREFIX = "ISO-";
    private static final String END_ISO_KEYWORD_PREFIX = "END-ISO-";
    private static final String HEADER = "HEADER";
    private static final String DATA = "DATA";
    private static final String ENDSEC = "ENDSEC";

    private static final String EXPECT_INSTANCE_NAME = "entity instance name (#id)";
    private static final String EXPECT_TYPE_NAME = "entity type name";
    private static final String EXPECT_PARAMETER = "parameter";

    private final String source;

    /**
     * Creates a parser over the full file text.
     *
     * @param source file content
     */
    public StepParser(String source) {
        this.source = Objects.requireNonNull(source, "source must not be null");
    }

    /**
     * Parses a complete physical file including header and trailer.
     *
     * @return parsed file
     * @throws StepParseException on the first syntax error
     */
    public StepFile parseFile() throws StepParseException {
        ParseContext ctx = newContext();

        Token iso = ctx.current();
        if (!iso.is(TokenKind.KEYWORD) || !iso.text().startsWith(ISO_KEYWORD_PREFIX)) {
            throw ctx.error("ISO-10303-21");
        }
        ctx.advance();
        ctx.expect(TokenKind.SEMICOLON, "semicolon");

        List<HeaderEntity> header = parseHeaderSection(ctx);
        List<EntityRecord> instances = new ArrayList<>();

        while (ctx.atKeyword(DATA)) {
            parseDataSection(ctx, instances);
        }

        Token end = ctx.current();
        if (!end.is(TokenKind.KEYWORD) || !end.text().startsWith(END_ISO_KEYWORD_PREFIX)) {
            throw ctx.error("DATA or END-ISO-10303-21");
        }
        ctx.advance();
        ctx.expect(TokenKind.SEMICOLON, "semicolon");
        ctx.expect(TokenKind.END_OF_FILE, "end of file");

        log.debug("Parsed {} header entities and {} instances ({} tokens)",
            header.size(), instances.size(), ctx.consumedTokens());
        return new StepFile(header, instances);
    }

    /**
     * Parses a bare sequence of instance statements with no file envelope.
     *
     * @return instances in source order
     * @throws StepParseException on the first syntax error
     */
    public List<EntityRecord> parseInstances() throws StepParseException {
        ParseContext ctx = newContext();
        List<EntityRecord> instances = new ArrayList<>();
        while (!ctx.at(TokenKind.END_OF_FILE)) {
            instances.add(parseInstance(ctx));
        }
        log.debug("Parsed {} instances ({} tokens)", instances.size(), ctx.consumedTokens());
        return instances;
    }

    /**
     * Parses a single parenthesized parameter list such as {@code ('a',#1,(2,3))}.
     *
     * @return the parameters
     * @throws StepParseException if the text is not exactly one parameter list
     */
    public List<AttributeValue> parseParameterList() throws StepParseException {
        ParseContext ctx = newContext();
        List<AttributeValue> parameters = parseParameters(ctx);
        ctx.expect(TokenKind.END_OF_FILE, "end of input");
        return parameters;
    }

    private ParseContext newContext() {
        return new ParseContext(new StepLexer(source));
    }

    private List<HeaderEntity> parseHeaderSection(ParseContext ctx) throws StepParseException {
        ctx.expectKeyword(HEADER);
        ctx.expect(TokenKind.SEMICOLON, "semicolon");

        List<HeaderEntity> header = new ArrayList<>();
        while (!ctx.atKeyword(ENDSEC)) {
            if (!ctx.at(TokenKind.IDENTIFIER)) {
                throw ctx.error("header entity or ENDSEC");
            }
            String name = ctx.advance().text();
            List<AttributeValue> parameters = parseParameters(ctx);
            ctx.expect(TokenKind.SEMICOLON, "semicolon");
            header.add(new HeaderEntity(name, parameters));
        }
        ctx.expectKeyword(ENDSEC);
        ctx.expect(TokenKind.SEMICOLON, "semicolon");
        return header;
    }

    private void parseDataSection(ParseContext ctx, List<EntityRecord> instances) throws StepParseException {
        ctx.expectKeyword(DATA);
        if (ctx.at(TokenKind.LEFT_PAREN)) {
            // Edition 3 section parameters: DATA('name',('schema'));
            parseParameters(ctx);
        }
        ctx.expect(TokenKind.SEMICOLON, "semicolon");

        while (!ctx.atKeyword(ENDSEC)) {
            if (ctx.at(TokenKind.END_OF_FILE)) {
                throw ctx.error("ENDSEC");
            }
            instances.add(parseInstance(ctx));
        }
        ctx.expectKeyword(ENDSEC);
        ctx.expect(TokenKind.SEMICOLON, "semicolon");
    }

    private EntityRecord parseInstance(ParseContext ctx) throws StepParseException {
        Token name = ctx.expect(TokenKind.REFERENCE, EXPECT_INSTANCE_NAME);
        long id = parseId(ctx, name);
        ctx.expect(TokenKind.EQUALS, "equals sign");

        List<EntitySegment> segments = new ArrayList<>();
        if (ctx.at(TokenKind.LEFT_PAREN)) {
            ctx.advance();
            do {
                segments.add(parseSegment(ctx));
            } while (ctx.at(TokenKind.IDENTIFIER));
            ctx.expect(TokenKind.RIGHT_PAREN, "entity type name or right paren");
        } else {
            do {
                segments.add(parseSegment(ctx));
            } while (ctx.at(TokenKind.IDENTIFIER));
        }

        ctx.expect(TokenKind.SEMICOLON, "semicolon");
        return new EntityRecord(id, segments, name.line(), name.offset());
    }

    private EntitySegment parseSegment(ParseContext ctx) throws StepParseException {
        Token type = ctx.expect(TokenKind.IDENTIFIER, EXPECT_TYPE_NAME);
        return new EntitySegment(type.text(), parseParameters(ctx));
    }

    private List<AttributeValue> parseParameters(ParseContext ctx) throws StepParseException {
        ctx.enterNested();
        ctx.expect(TokenKind.LEFT_PAREN, "left paren");
        List<AttributeValue> parameters = new ArrayList<>();
        if (ctx.at(TokenKind.RIGHT_PAREN)) {
            ctx.advance();
        } else {
            parameters.add(parseParameter(ctx));
            while (ctx.at(TokenKind.COMMA)) {
                ctx.advance();
                parameters.add(parseParameter(ctx));
            }
            ctx.expect(TokenKind.RIGHT_PAREN, "comma or right paren");
        }
        ctx.leaveNested();
        return parameters;
    }

    private AttributeValue parseParameter(ParseContext ctx) throws StepParseException {
        Token token = ctx.current();
        switch (token.kind()) {
            case DOLLAR:
                ctx.advance();
                return AttributeValue.UNSET;
            case ASTERISK:
                ctx.advance();
                return AttributeValue.DERIVED;
            case INTEGER:
                ctx.advance();
                return parseInteger(ctx, token);
            case REAL:
                ctx.advance();
                return parseReal(ctx, token);
            case STRING:
                ctx.advance();
                return AttributeValue.string(StepStrings.decodeLiteral(token.text()));
            case ENUMERATION:
                ctx.advance();
                return enumeration(token.text());
            case BINARY:
                ctx.advance();
                return new AttributeValue.BinaryValue(token.text().substring(1, token.text().length() - 1));
            case REFERENCE:
                ctx.advance();
                return AttributeValue.reference(parseId(ctx, token));
            case LEFT_PAREN:
                return new AttributeValue.ListValue(parseParameters(ctx));
            case IDENTIFIER:
                ctx.advance();
                ctx.enterNested();
                ctx.expect(TokenKind.LEFT_PAREN, "left paren after typed parameter " + token.text());
                AttributeValue wrapped = parseParameter(ctx);
                ctx.expect(TokenKind.RIGHT_PAREN, "right paren");
                ctx.leaveNested();
                return new AttributeValue.TypedValue(token.text(), wrapped);
            default:
                throw ctx.error(EXPECT_PARAMETER);
        }
    }

    private AttributeValue parseInteger(ParseContext ctx, Token token) throws StepParseException {
        try {
            return AttributeValue.integer(Long.parseLong(token.text()));
        } catch (NumberFormatException e) {
            throw ctx.errorAt(token, "integer within 64-bit range");
        }
    }

    private AttributeValue parseReal(ParseContext ctx, Token token) throws StepParseException {
        double value = Double.parseDouble(token.text());
        if (Double.isInfinite(value)) {
            throw ctx.errorAt(token, "real within double range");
        }
        return AttributeValue.real(value);
    }

    private static AttributeValue enumeration(String text) {
        String literal = text.substring(1, text.length() - 1);
        if (literal.equals("T")) {
            return new AttributeValue.BooleanValue(true);
        }
        if (literal.equals("F")) {
            return new AttributeValue.BooleanValue(false);
        }
        return AttributeValue.enumeration(literal);
    }

    private static long parseId(ParseContext ctx, Token token) throws StepParseException {
        try {
            return Long.parseLong(token.text().substring(1));
        } catch (NumberFormatException e) {
            throw ctx.errorAt(token, "entity id within 64-bit range");
        }
    }
}
