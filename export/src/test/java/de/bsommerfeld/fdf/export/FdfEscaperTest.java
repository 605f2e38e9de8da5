package de.bsommerfeld.fdf.export;

import de.bsommerfeld.fdf.parser.FdfLexer;
import de.bsommerfeld.fdf.parser.Token;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FdfEscaperTest {

    private static String lexString(String literal) {
        List<Token> tokens = FdfLexer.tokenize(literal);
        return tokens.get(0).text();
    }

    @Test
    void escape_shouldDoubleBackslashesAndEscapeQuotes() {
        assertEquals("UI\\\\Widgets \\\"quoted\\\"", FdfEscaper.escape("UI\\Widgets \"quoted\""));
    }

    @Test
    void escape_shouldEscapeControlCharacters() {
        assertEquals("a\\nb\\tc\\rd", FdfEscaper.escape("a\nb\tc\rd"));
    }

    @Test
    void quote_shouldWrapInDoubleQuotes() {
        assertEquals("\"Paused\"", FdfEscaper.quote("Paused"));
        assertEquals("\"\"", FdfEscaper.quote(null));
    }

    @Test
    void quote_shouldSurviveLexerForUnknownEscapeSequences() {
        String path = lexString("\"ReplaceableTextures\\CommandButtons\\BTNFootman.blp\"");
        assertEquals("ReplaceableTextures\\CommandButtons\\BTNFootman.blp", path);

        assertEquals(path, lexString(FdfEscaper.quote(path)));
    }

    @Test
    void quote_shouldSurviveLexerForMixedContent() {
        String text = "Line 1\nSay \"hi\"\t\\Character\\n'x'";

        assertEquals(text, lexString(FdfEscaper.quote(text)));
    }
}
