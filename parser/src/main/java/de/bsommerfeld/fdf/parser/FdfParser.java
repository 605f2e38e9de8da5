package de.bsommerfeld.fdf.parser;

import de.bsommerfeld.fdf.core.ast.BlockItem;
import de.bsommerfeld.fdf.core.ast.FdfValue;
import de.bsommerfeld.fdf.core.ast.FrameDefinition;
import de.bsommerfeld.fdf.core.ast.Include;
import de.bsommerfeld.fdf.core.ast.NestedFrame;
import de.bsommerfeld.fdf.core.ast.Program;
import de.bsommerfeld.fdf.core.ast.Property;
import de.bsommerfeld.fdf.core.ast.Statement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser building a {@link Program} from FDF tokens.
 *
 * <h3>Grammar</h3>
 * <pre>{@code
 * Program      := (Include | FrameDef)*
 * Include      := INCLUDEFILE STRING
 * FrameDef     := FRAME STRING STRING Template? '{' Body '}'
 * NestedBlock  := ('Texture' | 'String') STRING? Template? '{' Body '}'
 * Template     := INHERITS WITHCHILDREN? STRING
 * Body         := (FrameDef | NestedBlock | Property)*
 * Property     := IDENTIFIER Values?
 * Values       := Value (',' Value | STRING | NUMBER)* ','?
 * Value        := STRING | NUMBER | IDENTIFIER
 * }</pre>
 *
 * <h3>Property values</h3>
 * Blizzard's own files mix comma-separated values ({@code SetPoint TOPLEFT, "X", TOPLEFT, 0, 0,})
 * with space-separated ones ({@code FontColor 1.0 1.0 1.0 1.0,}) and end most lines
 * with a trailing comma, but also put several properties on one line
 * ({@code { Width 0.1 Height 0.05 }}). Values continue across commas, including a
 * comma ending a line when the next line carries more values of a wrapped list.
 * Strings and numbers may follow without a comma; an identifier without a comma
 * before it starts the next property. A property without values is a flag; a flag
 * followed by another property on the same line needs a comma between them.
 *
 * <p>
 * Brace and header errors raise {@link FrameSyntaxException} and abort parsing.
 */
public final class FdfParser {

    private static final Logger LOG = LoggerFactory.getLogger(FdfParser.class);

    private final List<Token> tokens;
    private int position;

    public FdfParser(List<Token> tokens) {
        List<Token> filtered = new ArrayList<>();
        for (Token token : tokens) {
            if (!token.is(TokenType.COMMENT) && !token.is(TokenType.NEWLINE))
                filtered.add(token);
        }
        if (filtered.isEmpty() || !filtered.get(filtered.size() - 1).is(TokenType.EOF)) {
            Token last = filtered.isEmpty() ? null : filtered.get(filtered.size() - 1);
            filtered.add(new Token(TokenType.EOF, "",
                    last == null ? 1 : last.line(), last == null ? 1 : last.column() + last.text().length()));
        }
        this.tokens = filtered;
    }

    /** Lexes and parses {@code text}. */
    public static Program parse(String text) {
        return new FdfParser(FdfLexer.tokenize(text)).parseProgram();
    }

    /**
     * Parses the whole token stream.
     *
     * @throws FrameSyntaxException on the first grammar violation
     */
    public Program parseProgram() {
        List<Statement> statements = new ArrayList<>();
        while (!check(TokenType.EOF)) {
            if (check(TokenType.INCLUDEFILE)) {
                statements.add(parseInclude());
            } else if (check(TokenType.FRAME)) {
                statements.add(parseFrameDefinition());
            } else if (check(TokenType.COMMA)) {
                // IncludeFile "x.fdf",
                advance();
            } else {
                throw new FrameSyntaxException("FRAME or INCLUDEFILE", current());
            }
        }
        LOG.debug("Parsed {} top-level statements", statements.size());
        return new Program(statements);
    }

    private Include parseInclude() {
        Token keyword = expect(TokenType.INCLUDEFILE, "INCLUDEFILE");
        Token path = expect(TokenType.STRING, "include path string");
        return new Include(path.text(), keyword.line());
    }

    private FrameDefinition parseFrameDefinition() {
        Header header = parseFrameHeader();
        List<BlockItem> items = parseBody();
        return new FrameDefinition(header.type, header.name, header.inherits, header.withChildren, items,
                header.line);
    }

    private NestedFrame parseNestedFrameDefinition() {
        Header header = parseFrameHeader();
        List<BlockItem> items = parseBody();
        return new NestedFrame(header.type, header.name, header.inherits, header.withChildren, items, header.line);
    }

    private Header parseFrameHeader() {
        Token keyword = expect(TokenType.FRAME, "FRAME");
        Token type = expect(TokenType.STRING, "frame type string");
        Token name = expect(TokenType.STRING, "frame name string");
        Header header = new Header(type.text(), name.text(), keyword.line());
        parseTemplate(header);
        return header;
    }

    private NestedFrame parseReservedBlock() {
        Token keyword = advance();
        Header header = new Header(keyword.text(), null, keyword.line());
        if (check(TokenType.STRING))
            header.name = advance().text();
        parseTemplate(header);
        List<BlockItem> items = parseBody();
        return new NestedFrame(header.type, header.name, header.inherits, header.withChildren, items, header.line);
    }

    private void parseTemplate(Header header) {
        if (!check(TokenType.INHERITS))
            return;
        advance();
        if (check(TokenType.WITHCHILDREN)) {
            advance();
            header.withChildren = true;
        }
        header.inherits = expect(TokenType.STRING, "template name string").text();
    }

    private List<BlockItem> parseBody() {
        expect(TokenType.LEFT_BRACE, "'{'");
        List<BlockItem> items = new ArrayList<>();
        while (!check(TokenType.RIGHT_BRACE)) {
            if (check(TokenType.EOF))
                throw new FrameSyntaxException("'}'", current());
            if (check(TokenType.FRAME)) {
                items.add(parseNestedFrameDefinition());
            } else if (atReservedBlock()) {
                items.add(parseReservedBlock());
            } else if (check(TokenType.IDENTIFIER)) {
                items.add(parseProperty());
            } else if (check(TokenType.COMMA)) {
                // stray separator between properties
                advance();
            } else {
                throw new FrameSyntaxException("property or nested frame", current());
            }
        }
        advance();
        return items;
    }

    /** {@code Texture}/{@code String} followed by '{', a block name or INHERITS. */
    private boolean atReservedBlock() {
        if (!check(TokenType.IDENTIFIER) || !NestedFrame.isReservedBlock(current().text()))
            return false;
        Token next = peek(1);
        if (next.is(TokenType.LEFT_BRACE) || next.is(TokenType.INHERITS))
            return true;
        if (next.is(TokenType.STRING)) {
            Token afterName = peek(2);
            return afterName.is(TokenType.LEFT_BRACE) || afterName.is(TokenType.INHERITS);
        }
        return false;
    }

    private Property parseProperty() {
        Token name = advance();
        List<FdfValue> values = new ArrayList<>();

        if (startsFirstValue(name))
            values.add(toValue(advance()));
        else if (check(TokenType.COMMA))
            advance();

        while (!values.isEmpty()) {
            Token token = current();
            if (token.is(TokenType.COMMA)) {
                advance();
                if (!continuesAfterComma(token))
                    break;
                values.add(toValue(advance()));
            } else if (token.is(TokenType.STRING) || token.is(TokenType.NUMBER)) {
                // space-separated, as in FontColor 1.0 0.8 0.0 1.0
                values.add(toValue(advance()));
            } else {
                // an identifier without a comma starts the next property
                break;
            }
        }

        FdfValue value;
        if (values.isEmpty())
            value = FdfValue.FLAG;
        else if (values.size() == 1)
            value = values.get(0);
        else
            value = new FdfValue.ArrayValue(values);
        return new Property(name.text(), value, name.line());
    }

    /**
     * Strings and numbers always belong to the property before them. An
     * identifier only does when it sits on the property's line; on a later line
     * it names the property after a flag.
     */
    private boolean startsFirstValue(Token name) {
        Token token = current();
        if (token.is(TokenType.STRING) || token.is(TokenType.NUMBER))
            return true;
        return token.is(TokenType.IDENTIFIER) && token.line() == name.line();
    }

    /**
     * Whether the value after {@code comma} continues the list. A value on the
     * comma's line always does. After a line break a string or number does,
     * while an identifier only does when a comma and a value follow it on its
     * own line ({@code TOPLEFT, 0, 0} of a wrapped {@code SetPoint}); otherwise
     * the comma was the list's trailing one.
     */
    private boolean continuesAfterComma(Token comma) {
        Token next = current();
        if (!isValue(next))
            return false;
        if (next.line() == comma.line())
            return true;
        if (!next.is(TokenType.IDENTIFIER))
            return true;
        Token separator = peek(1);
        Token following = peek(2);
        return separator.is(TokenType.COMMA) && separator.line() == next.line()
                && isValue(following) && following.line() == next.line();
    }

    private static boolean isValue(Token token) {
        return token.is(TokenType.STRING) || token.is(TokenType.NUMBER) || token.is(TokenType.IDENTIFIER);
    }

    private static FdfValue toValue(Token token) {
        return switch (token.type()) {
            case STRING -> new FdfValue.StringLiteral(token.text());
            case NUMBER -> new FdfValue.NumberLiteral(parseNumber(token));
            default -> new FdfValue.Identifier(token.text());
        };
    }

    private static double parseNumber(Token token) {
        try {
            return Double.parseDouble(token.text());
        } catch (NumberFormatException e) {
            throw new FrameSyntaxException("number", token);
        }
    }

    private Token expect(TokenType type, String description) {
        if (!check(type))
            throw new FrameSyntaxException(description, current());
        return advance();
    }

    private boolean check(TokenType type) {
        return current().is(type);
    }

    private Token current() {
        return tokens.get(position);
    }

    private Token peek(int offset) {
        return tokens.get(Math.min(position + offset, tokens.size() - 1));
    }

    private Token advance() {
        Token token = tokens.get(position);
        if (position < tokens.size() - 1)
            position++;
        return token;
    }

    private static final class Header {
        final String type;
        final int line;
        String name;
        String inherits;
        boolean withChildren;

        Header(String type, String name, int line) {
            this.type = type;
            this.name = name;
            this.line = line;
        }
    }
}
