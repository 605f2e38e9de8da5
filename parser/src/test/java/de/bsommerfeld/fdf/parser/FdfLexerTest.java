package de.bsommerfeld.fdf.parser;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FdfLexerTest {

    private static List<TokenType> types(List<Token> tokens) {
        return tokens.stream().map(Token::type).toList();
    }

    // -- tokenize --

    @Test
    void tokenize_shouldRecognizeFrameHeader() {
        List<Token> tokens = FdfLexer.tokenize("Frame \"BACKDROP\" \"Panel\" INHERITS \"Base\" {}");

        assertEquals(List.of(TokenType.FRAME, TokenType.STRING, TokenType.STRING, TokenType.INHERITS,
                TokenType.STRING, TokenType.LEFT_BRACE, TokenType.RIGHT_BRACE, TokenType.EOF), types(tokens));
        assertEquals("BACKDROP", tokens.get(1).text());
        assertEquals("Panel", tokens.get(2).text());
    }

    @Test
    void tokenize_shouldMatchKeywordsCaseInsensitively() {
        List<Token> tokens = FdfLexer.tokenize("frame Inherits withChildren INCLUDEFILE includeFile");

        assertEquals(List.of(TokenType.FRAME, TokenType.INHERITS, TokenType.WITHCHILDREN,
                TokenType.INCLUDEFILE, TokenType.INCLUDEFILE, TokenType.EOF), types(tokens));
    }

    @Test
    void tokenize_shouldDropCommentsAndNewlines() {
        String text = """
                // header comment
                Width 0.1 /* inline
                   block */ Height 0.2
                """;
        List<Token> tokens = FdfLexer.tokenize(text);

        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.NUMBER, TokenType.IDENTIFIER, TokenType.NUMBER,
                TokenType.EOF), types(tokens));
    }

    @Test
    void tokenizeAll_shouldKeepCommentsAndNewlines() {
        List<Token> tokens = new FdfLexer("// note\nWidth 0.1\n").tokenizeAll();

        assertEquals(List.of(TokenType.COMMENT, TokenType.NEWLINE, TokenType.IDENTIFIER, TokenType.NUMBER,
                TokenType.NEWLINE, TokenType.EOF), types(tokens));
        assertEquals("note", tokens.get(0).text());
    }

    @Test
    void tokenize_shouldTrackLineAndColumn() {
        List<Token> tokens = FdfLexer.tokenize("Width 0.1\n  Height 0.2");

        Token height = tokens.get(2);
        assertEquals(2, height.line());
        assertEquals(3, height.column());
    }

    // -- numbers --

    @Test
    void tokenize_shouldReadSignedDecimalAndExponentNumbers() {
        List<Token> tokens = FdfLexer.tokenize("-0.025 12 1.5e-3 2E+2 .5 -.25");

        assertEquals(List.of("-0.025", "12", "1.5e-3", "2E+2", "0.5", "-0.25"),
                tokens.stream().filter(t -> t.is(TokenType.NUMBER)).map(Token::text).toList());
    }

    @Test
    void tokenize_shouldNotTreatIdentifierAfterNumberAsExponent() {
        List<Token> tokens = FdfLexer.tokenize("3end");

        assertEquals(List.of(TokenType.NUMBER, TokenType.IDENTIFIER, TokenType.EOF), types(tokens));
    }

    // -- strings --

    @Test
    void tokenize_shouldUnescapeKnownEscapes() {
        List<Token> tokens = FdfLexer.tokenize("\"a\\nb\\tc\\\\d\\\"e\\'f\"");

        assertEquals("a\nb\tc\\d\"e'f", tokens.get(0).text());
    }

    @Test
    void tokenize_shouldKeepBackslashOfUnknownEscape() {
        List<Token> tokens = FdfLexer.tokenize("\"UI\\Widgets\\Character\"");

        assertEquals("UI\\Widgets\\Character", tokens.get(0).text());
    }

    @Test
    void tokenize_shouldAcceptSingleQuotedStrings() {
        List<Token> tokens = FdfLexer.tokenize("'it\"s'");

        assertEquals(TokenType.STRING, tokens.get(0).type());
        assertEquals("it\"s", tokens.get(0).text());
    }

    @Test
    void tokenize_shouldRunUnterminatedStringToEndOfInput() {
        List<Token> tokens = FdfLexer.tokenize("Text \"open");

        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.STRING, TokenType.EOF), types(tokens));
        assertEquals("open", tokens.get(1).text());
    }

    // -- permissive lexing --

    @Test
    void tokenize_shouldSkipUnknownCharacters() {
        List<Token> tokens = FdfLexer.tokenize("Width # 0.1 ; @");

        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.NUMBER, TokenType.EOF), types(tokens));
    }

    @Test
    void tokenize_shouldHandleEmptyAndNullInput() {
        assertEquals(List.of(TokenType.EOF), types(FdfLexer.tokenize("")));
        assertEquals(List.of(TokenType.EOF), types(FdfLexer.tokenize(null)));
    }
}
