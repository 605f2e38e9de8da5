package de.bsommerfeld.fdf.export;

import com.google.common.escape.Escaper;
import com.google.common.escape.Escapers;

/**
 * Quoting for FDF string literals, the inverse of the lexer's unescaping.
 * Every backslash is doubled, so a path like {@code UI\Widgets} is written as
 * {@code "UI\\Widgets"} and reads back unchanged.
 */
public final class FdfEscaper {

    private static final Escaper ESCAPER = Escapers.builder()
            .addEscape('\\', "\\\\")
            .addEscape('"', "\\\"")
            .addEscape('\n', "\\n")
            .addEscape('\t', "\\t")
            .addEscape('\r', "\\r")
            .build();

    private FdfEscaper() {
    }

    public static String escape(String value) {
        return ESCAPER.escape(value);
    }

    /** The value escaped and wrapped in double quotes. */
    public static String quote(String value) {
        return "\"" + escape(value == null ? "" : value) + "\"";
    }
}
