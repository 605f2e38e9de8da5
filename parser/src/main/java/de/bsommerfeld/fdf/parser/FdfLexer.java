package de.bsommerfeld.fdf.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Character-level scanner turning FDF text into tokens.
 *
 * <h3>Permissive lexing</h3>
 * The lexer never fails. Characters that cannot start a token are dropped,
 * an unterminated string or block comment simply runs to the end of input,
 * and an unknown escape sequence inside a string keeps its backslash, so
 * Windows paths such as {@code "UI\Widgets\Glues"} survive unchanged.
 *
 * <h3>Token stream</h3>
 * {@link #tokenizeAll()} yields every token including {@code NEWLINE} and
 * {@code COMMENT}. {@link #tokenize(String)} is the form the parser consumes:
 * comments and line breaks are removed, positions are kept on each token.
 *
 * <p>
 * An instance holds scan state and is not reusable; create one per input.
 */
public final class FdfLexer {

    private final String input;
    private int position;
    private int line = 1;
    private int column = 1;

    public FdfLexer(String input) {
        this.input = input == null ? "" : input;
    }

    /**
     * Tokenizes {@code text} for parsing: no comments, no line breaks,
     * terminated by a single {@code EOF} token.
     */
    public static List<Token> tokenize(String text) {
        List<Token> tokens = new ArrayList<>();
        for (Token token : new FdfLexer(text).tokenizeAll()) {
            if (token.is(TokenType.NEWLINE) || token.is(TokenType.COMMENT))
                continue;
            tokens.add(token);
        }
        return tokens;
    }

    /** Scans the whole input, including comment and line-break tokens. */
    public List<Token> tokenizeAll() {
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = nextToken();
            tokens.add(token);
        } while (!token.is(TokenType.EOF));
        return tokens;
    }

    private Token nextToken() {
        while (true) {
            skipWhitespace();
            int startLine = line;
            int startColumn = column;
            char c = current();

            if (atEnd())
                return new Token(TokenType.EOF, "", startLine, startColumn);

            if (c == '/' && peek(1) == '/')
                return readLineComment();
            if (c == '/' && peek(1) == '*')
                return readBlockComment();

            if (c == '\n') {
                advance();
                return new Token(TokenType.NEWLINE, "\n", startLine, startColumn);
            }
            if (c == '"' || c == '\'')
                return readString();
            if (startsNumber())
                return readNumber();
            if (isIdentifierStart(c))
                return readIdentifier();

            switch (c) {
                case '{':
                    advance();
                    return new Token(TokenType.LEFT_BRACE, "{", startLine, startColumn);
                case '}':
                    advance();
                    return new Token(TokenType.RIGHT_BRACE, "}", startLine, startColumn);
                case ',':
                    advance();
                    return new Token(TokenType.COMMA, ",", startLine, startColumn);
                default:
                    // not part of the grammar, dropped
                    advance();
            }
        }
    }

    private Token readLineComment() {
        int startLine = line;
        int startColumn = column;
        advance();
        advance();
        StringBuilder sb = new StringBuilder();
        while (!atEnd() && current() != '\n')
            sb.append(advance());
        return new Token(TokenType.COMMENT, sb.toString().trim(), startLine, startColumn);
    }

    private Token readBlockComment() {
        int startLine = line;
        int startColumn = column;
        advance();
        advance();
        StringBuilder sb = new StringBuilder();
        while (!atEnd() && !(current() == '*' && peek(1) == '/'))
            sb.append(advance());
        if (current() == '*') {
            advance();
            advance();
        }
        return new Token(TokenType.COMMENT, sb.toString().trim(), startLine, startColumn);
    }

    private Token readString() {
        int startLine = line;
        int startColumn = column;
        char quote = advance();
        StringBuilder sb = new StringBuilder();

        while (!atEnd() && current() != quote) {
            char c = advance();
            if (c != '\\') {
                sb.append(c);
                continue;
            }
            if (atEnd()) {
                sb.append('\\');
                break;
            }
            char escaped = advance();
            switch (escaped) {
                case 'n' -> sb.append('\n');
                case 't' -> sb.append('\t');
                case 'r' -> sb.append('\r');
                case '\\' -> sb.append('\\');
                case '"' -> sb.append('"');
                case '\'' -> sb.append('\'');
                default -> sb.append('\\').append(escaped);
            }
        }
        if (!atEnd() && current() == quote)
            advance();

        return new Token(TokenType.STRING, sb.toString(), startLine, startColumn);
    }

    /** A digit, or a sign or decimal point directly followed by a digit. */
    private boolean startsNumber() {
        char c = current();
        if (isDigit(c))
            return true;
        if (c == '-')
            return isDigit(peek(1)) || (peek(1) == '.' && isDigit(peek(2)));
        return c == '.' && isDigit(peek(1));
    }

    private Token readNumber() {
        int startLine = line;
        int startColumn = column;
        StringBuilder sb = new StringBuilder();

        if (current() == '-')
            sb.append(advance());
        while (isDigit(current()))
            sb.append(advance());
        if (current() == '.' && isDigit(peek(1))) {
            sb.append(advance());
            while (isDigit(current()))
                sb.append(advance());
        } else if (current() == '.') {
            // "1." is a complete number
            advance();
        }
        if ((current() == 'e' || current() == 'E') && exponentFollows()) {
            sb.append(advance());
            if (current() == '+' || current() == '-')
                sb.append(advance());
            while (isDigit(current()))
                sb.append(advance());
        }

        String text = sb.toString();
        if (text.startsWith("."))
            text = "0" + text;
        else if (text.startsWith("-."))
            text = "-0" + text.substring(1);
        return new Token(TokenType.NUMBER, text, startLine, startColumn);
    }

    private boolean exponentFollows() {
        char next = peek(1);
        if (isDigit(next))
            return true;
        return (next == '+' || next == '-') && isDigit(peek(2));
    }

    private Token readIdentifier() {
        int startLine = line;
        int startColumn = column;
        StringBuilder sb = new StringBuilder();
        while (isIdentifierPart(current()))
            sb.append(advance());

        String text = sb.toString();
        TokenType type = switch (text.toUpperCase(Locale.ROOT)) {
            case "FRAME" -> TokenType.FRAME;
            case "INHERITS" -> TokenType.INHERITS;
            case "WITHCHILDREN" -> TokenType.WITHCHILDREN;
            case "INCLUDEFILE" -> TokenType.INCLUDEFILE;
            default -> TokenType.IDENTIFIER;
        };
        return new Token(type, text, startLine, startColumn);
    }

    private void skipWhitespace() {
        while (current() == ' ' || current() == '\t' || current() == '\r' || current() == '\f')
            advance();
    }

    private boolean atEnd() {
        return position >= input.length();
    }

    private char current() {
        return peek(0);
    }

    private char peek(int offset) {
        int index = position + offset;
        return index < input.length() ? input.charAt(index) : 0;
    }

    private char advance() {
        char c = input.charAt(position++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }
}
