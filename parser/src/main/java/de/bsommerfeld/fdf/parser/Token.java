package de.bsommerfeld.fdf.parser;

/**
 * A lexical token.
 *
 * @param type   token kind
 * @param text   token text; the unescaped content for strings, the comment body for comments
 * @param line   1-based source line of the first character
 * @param column 1-based source column of the first character
 */
public record Token(TokenType type, String text, int line, int column) {

    public boolean is(TokenType expected) {
        return type == expected;
    }

    /** Short human-readable form used in error messages. */
    public String describe() {
        return switch (type) {
            case EOF -> "end of input";
            case NEWLINE -> "line break";
            case STRING -> "STRING \"" + text + "\"";
            default -> type + " '" + text + "'";
        };
    }
}
