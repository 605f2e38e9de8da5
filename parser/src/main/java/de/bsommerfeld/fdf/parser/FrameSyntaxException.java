package de.bsommerfeld.fdf.parser;

/**
 * Thrown when FDF text does not follow the frame definition grammar, for
 * example an unbalanced brace or a frame header missing its name. This is the
 * only failure the import pipeline raises for malformed text; everything else
 * degrades to a documented fallback.
 */
public class FrameSyntaxException extends RuntimeException {

    private final String expected;
    private final String actual;
    private final int line;
    private final int column;

    public FrameSyntaxException(String expected, Token actual) {
        super("Expected " + expected + " but found " + actual.describe()
                + " at " + actual.line() + ":" + actual.column());
        this.expected = expected;
        this.actual = actual.describe();
        this.line = actual.line();
        this.column = actual.column();
    }

    public String getExpected() {
        return expected;
    }

    public String getActual() {
        return actual;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
